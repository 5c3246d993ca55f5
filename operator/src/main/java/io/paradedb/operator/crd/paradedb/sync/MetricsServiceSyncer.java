package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@NullMarked
@ApplicationScoped
public class MetricsServiceSyncer extends ServiceSyncer {
    public MetricsServiceSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.metricsService(paradeDB);
    }

    @Override
    protected Service desired(ParadeDB paradeDB) {
        var port = paradeDB.getSpec().getMonitoringOrDefault().getPort();

        return new ServiceBuilder()
                .withNewMetadata()
                .withName(name(paradeDB))
                .withNamespace(paradeDB.getMetadata().getNamespace())
                .withLabels(ParadeDBNames.labels(paradeDB, ParadeDBNames.COMPONENT_METRICS))
                .withAnnotations(scrapeAnnotations(port))
                .endMetadata()
                .withNewSpec()
                .withType("ClusterIP")
                .withSelector(ParadeDBNames.selectorLabels(paradeDB))
                .withPorts(port("metrics", port))
                .endSpec()
                .build();
    }

    @Override
    protected boolean isUpToDate(
            Service actual,
            Service desired
    ) {
        return super.isUpToDate(actual, desired)
                && hasAnnotations(actual, desired.getMetadata().getAnnotations());
    }

    @Override
    protected void applyMutableFields(
            Service actual,
            Service desired
    ) {
        super.applyMutableFields(actual, desired);

        var annotations = new LinkedHashMap<String, String>();
        if (actual.getMetadata().getAnnotations() != null) {
            annotations.putAll(actual.getMetadata().getAnnotations());
        }
        annotations.putAll(desired.getMetadata().getAnnotations());

        actual.getMetadata().setAnnotations(annotations);
    }

    @Override
    protected String createdReason() {
        return EventRecorder.REASON_METRICS_SERVICE_CREATED;
    }

    private static Map<String, String> scrapeAnnotations(int port) {
        var annotations = new LinkedHashMap<String, String>();
        annotations.put("prometheus.io/scrape", "true");
        annotations.put("prometheus.io/port", String.valueOf(port));

        return annotations;
    }

    private static boolean hasAnnotations(
            Service actual,
            Map<String, String> expected
    ) {
        var annotations = actual.getMetadata().getAnnotations();

        return annotations != null
                && expected.entrySet().stream()
                .allMatch(entry -> Objects.equals(annotations.get(entry.getKey()), entry.getValue()));
    }
}
