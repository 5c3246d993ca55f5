package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;

/**
 * Stable per-replica DNS for the StatefulSet. Created once, never updated.
 */
@NullMarked
@ApplicationScoped
public class HeadlessServiceSyncer extends ServiceSyncer {
    public HeadlessServiceSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.headlessService(paradeDB);
    }

    @Override
    protected Service desired(ParadeDB paradeDB) {
        return new ServiceBuilder()
                .withNewMetadata()
                .withName(name(paradeDB))
                .withNamespace(paradeDB.getMetadata().getNamespace())
                .withLabels(ParadeDBNames.labels(paradeDB))
                .endMetadata()
                .withNewSpec()
                .withClusterIP("None")
                .withSelector(ParadeDBNames.selectorLabels(paradeDB))
                .withPorts(port("postgres", ParadeDBNames.POSTGRES_PORT))
                .endSpec()
                .build();
    }

    @Override
    protected boolean isMutable() {
        return false;
    }
}
