package io.paradedb.operator.crd.paradedb.status;

import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.CRPhase;
import io.paradedb.operator.core.Conditions;
import io.paradedb.operator.core.OperatorConfig;
import io.paradedb.operator.core.ParadeDBException;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import io.paradedb.operator.crd.paradedb.ParadeDBStatus;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;

import static io.paradedb.operator.crd.paradedb.ParadeDBNames.POSTGRES_PORT;

/**
 * Derives the observed part of {@link ParadeDBStatus} from the live workload.
 */
@NullMarked
@ApplicationScoped
@RequiredArgsConstructor
public class StatusAggregator {
    static final String REASON_ALL_REPLICAS_READY = "AllReplicasReady";
    static final String REASON_REPLICAS_NOT_READY = "ReplicasNotReady";
    static final String REASON_DEPLOYMENT_COMPLETE = "DeploymentComplete";
    static final String REASON_SCALING = "Scaling";
    static final String REASON_CREATING = "Creating";
    static final String REASON_ALL_REPLICAS_HEALTHY = "AllReplicasHealthy";
    static final String REASON_RECONCILIATION_SUCCEEDED = "ReconciliationSucceeded";

    private final KubernetesClient kubernetesClient;
    private final OperatorConfig operatorConfig;

    public void aggregate(
            ParadeDB paradeDB,
            ParadeDBStatus status
    ) {
        var namespace = paradeDB.getMetadata().getNamespace();
        var spec = paradeDB.getSpec();

        var statefulSet = kubernetesClient.resources(StatefulSet.class)
                .inNamespace(namespace)
                .withName(ParadeDBNames.workload(paradeDB))
                .get();

        //noinspection ConstantConditions
        if (statefulSet == null) {
            throw new ParadeDBException("StatefulSet not found [resource=%s/%s, statefulSet=%s]".formatted(
                    namespace,
                    paradeDB.getMetadata().getName(),
                    ParadeDBNames.workload(paradeDB)
            ));
        }

        var ready = statefulSet.getStatus() == null || statefulSet.getStatus().getReadyReplicas() == null
                ? 0
                : statefulSet.getStatus().getReadyReplicas();

        applyReplicaState(paradeDB, status, ready);

        status.setEndpoint(endpoint(ParadeDBNames.primaryService(paradeDB), namespace))
                .setPoolerEndpoint(spec.isConnectionPoolingEnabled()
                        ? endpoint(ParadeDBNames.pooler(paradeDB), namespace)
                        : null
                )
                .setCurrentVersion(spec.getImage());

        if (spec.isBackupEnabled()) {
            var cronJob = kubernetesClient.resources(CronJob.class)
                    .inNamespace(namespace)
                    .withName(ParadeDBNames.backup(paradeDB))
                    .get();

            //noinspection ConstantConditions
            if (cronJob != null
                    && cronJob.getStatus() != null
                    && cronJob.getStatus().getLastSuccessfulTime() != null
            ) {
                status.setLastBackup(cronJob.getStatus().getLastSuccessfulTime());
            }
        }
    }

    /**
     * Map the ready replica count onto phase, message and the Ready/Progressing/Degraded conditions.
     */
    public void applyReplicaState(
            ParadeDB paradeDB,
            ParadeDBStatus status,
            int ready
    ) {
        int desired = paradeDB.getSpec().getReplicas();
        var generation = paradeDB.getMetadata().getGeneration() == null
                ? 0L
                : paradeDB.getMetadata().getGeneration();
        var conditions = status.getConditions();

        status.setReadyReplicas(Math.min(ready, desired))
                .setObservedGeneration(generation);

        if (ready == desired && desired > 0) {
            status.setPhase(CRPhase.RUNNING)
                    .setMessage("ParadeDB is running");

            Conditions.set(conditions, Conditions.TYPE_READY, true, REASON_ALL_REPLICAS_READY, "All replicas are ready", generation);
            Conditions.set(conditions, Conditions.TYPE_PROGRESSING, false, REASON_DEPLOYMENT_COMPLETE, "Deployment is complete", generation);
            Conditions.set(conditions, Conditions.TYPE_DEGRADED, false, REASON_ALL_REPLICAS_HEALTHY, "All replicas are healthy", generation);

            return;
        }

        if (ready > 0) {
            var message = ready > desired
                    ? "Scaling down: %d/%d replicas ready".formatted(ready, desired)
                    : "Scaling: %d/%d replicas ready".formatted(ready, desired);

            status.setPhase(CRPhase.UPDATING)
                    .setMessage(message);

            Conditions.set(conditions, Conditions.TYPE_PROGRESSING, true, REASON_SCALING, message, generation);
            Conditions.set(conditions, Conditions.TYPE_READY, false, REASON_REPLICAS_NOT_READY, message, generation);
            Conditions.set(conditions, Conditions.TYPE_DEGRADED, false, REASON_RECONCILIATION_SUCCEEDED, "Reconciliation succeeded", generation);

            return;
        }

        var message = "Waiting for replicas to become ready";

        status.setPhase(CRPhase.CREATING)
                .setMessage(message);

        Conditions.set(conditions, Conditions.TYPE_PROGRESSING, true, REASON_CREATING, message, generation);
        Conditions.set(conditions, Conditions.TYPE_READY, false, REASON_REPLICAS_NOT_READY, message, generation);
        Conditions.set(conditions, Conditions.TYPE_DEGRADED, false, REASON_RECONCILIATION_SUCCEEDED, "Reconciliation succeeded", generation);
    }

    private String endpoint(
            String service,
            String namespace
    ) {
        return "%s.%s.%s:%d".formatted(service, namespace, operatorConfig.clusterDomain(), POSTGRES_PORT);
    }
}
