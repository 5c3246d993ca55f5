package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.crd.paradedb.MonitoringSpec;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prometheus Operator scrape configuration for the metrics endpoint.
 */
@NullMarked
@ApplicationScoped
public class ServiceMonitorSyncer extends SubResourceSyncer<GenericKubernetesResource> {
    public static final String API_VERSION = "monitoring.coreos.com/v1";
    public static final String KIND = "ServiceMonitor";

    private static final ResourceDefinitionContext SERVICE_MONITOR_CONTEXT = new ResourceDefinitionContext.Builder()
            .withGroup("monitoring.coreos.com")
            .withVersion("v1")
            .withKind(KIND)
            .withPlural("servicemonitors")
            .withNamespaced(true)
            .build();

    public ServiceMonitorSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.serviceMonitor(paradeDB);
    }

    @Override
    protected Class<GenericKubernetesResource> resourceType() {
        return GenericKubernetesResource.class;
    }

    @Override
    protected String resourceKind() {
        return KIND;
    }

    @Override
    protected NonNamespaceOperation<GenericKubernetesResource, ? extends KubernetesResourceList<GenericKubernetesResource>, Resource<GenericKubernetesResource>> resources(String namespace) {
        return kubernetesClient.genericKubernetesResources(SERVICE_MONITOR_CONTEXT).inNamespace(namespace);
    }

    @Override
    protected GenericKubernetesResource desired(ParadeDB paradeDB) {
        var monitoring = paradeDB.getSpec().getMonitoringOrDefault();
        var serviceMonitor = monitoring.getServiceMonitor();

        var labels = ParadeDBNames.labels(paradeDB, ParadeDBNames.COMPONENT_METRICS);
        if (serviceMonitor != null) {
            labels.putAll(serviceMonitor.getLabels());
        }

        var matchLabels = new LinkedHashMap<String, String>(ParadeDBNames.selectorLabels(paradeDB));
        matchLabels.put(ParadeDBNames.LABEL_COMPONENT, ParadeDBNames.COMPONENT_METRICS);

        var endpoint = new LinkedHashMap<String, Object>();
        endpoint.put("port", "metrics");
        endpoint.put("interval", interval(serviceMonitor));

        var spec = new LinkedHashMap<String, Object>();
        spec.put("selector", Map.of("matchLabels", matchLabels));
        spec.put("endpoints", List.of(endpoint));

        var resource = new GenericKubernetesResource();
        resource.setApiVersion(API_VERSION);
        resource.setKind(KIND);
        resource.setMetadata(new ObjectMetaBuilder()
                .withName(name(paradeDB))
                .withNamespace(paradeDB.getMetadata().getNamespace())
                .withLabels(labels)
                .build()
        );
        resource.setAdditionalProperty("spec", spec);

        DesiredStateHash.stamp(resource, spec);

        return resource;
    }

    @Override
    protected boolean isUpToDate(
            GenericKubernetesResource actual,
            GenericKubernetesResource desired
    ) {
        return DesiredStateHash.matches(actual, desired)
                && hasLabels(actual, desired);
    }

    @Override
    protected void applyMutableFields(
            GenericKubernetesResource actual,
            GenericKubernetesResource desired
    ) {
        actual.setAdditionalProperty("spec", desired.getAdditionalProperties().get("spec"));
        DesiredStateHash.copy(desired, actual);
        mergeLabels(actual, desired);
    }

    private static String interval(MonitoringSpec.@Nullable ServiceMonitor serviceMonitor) {
        if (serviceMonitor == null || serviceMonitor.getInterval().isBlank()) {
            return "30s";
        }

        return serviceMonitor.getInterval();
    }
}
