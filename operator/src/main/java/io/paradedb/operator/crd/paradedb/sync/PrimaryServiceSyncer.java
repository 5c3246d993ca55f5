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
 * Client-facing endpoint of the database.
 */
@NullMarked
@ApplicationScoped
public class PrimaryServiceSyncer extends ServiceSyncer {
    public PrimaryServiceSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.primaryService(paradeDB);
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
                .withType(paradeDB.getSpec().getServiceType())
                .withSelector(ParadeDBNames.selectorLabels(paradeDB))
                .withPorts(port("postgres", ParadeDBNames.POSTGRES_PORT))
                .endSpec()
                .build();
    }

    @Override
    protected String createdReason() {
        return EventRecorder.REASON_SERVICE_CREATED;
    }
}
