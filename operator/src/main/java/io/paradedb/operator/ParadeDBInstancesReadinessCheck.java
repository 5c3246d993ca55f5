package io.paradedb.operator;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.CRPhase;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import lombok.RequiredArgsConstructor;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jspecify.annotations.NullMarked;

/**
 * MicroProfile readiness health check that reports the phase of every managed ParadeDB.
 * The operator is reported as not ready while any instance is {@link CRPhase#FAILED}.
 */
@NullMarked
@Readiness
@RequiredArgsConstructor
public class ParadeDBInstancesReadinessCheck implements HealthCheck {
    static final String UNKNOWN_PHASE = "Unknown";

    private final KubernetesClient kubernetesClient;

    @Override
    public HealthCheckResponse call() {
        var builder = HealthCheckResponse.builder().name("ParadeDB Instances");

        var instances = kubernetesClient.resources(ParadeDB.class)
                .inAnyNamespace()
                .list()
                .getItems();

        var allUp = true;

        for (var instance : instances) {
            var status = instance.getStatus();
            //noinspection ConstantConditions
            var phase = status == null ? null : status.getPhase();

            builder.withData(
                    "%s/%s".formatted(
                            instance.getMetadata().getNamespace(),
                            instance.getMetadata().getName()
                    ),
                    phase == null ? UNKNOWN_PHASE : phase.getValue()
            );

            if (phase == CRPhase.FAILED) {
                allUp = false;
            }
        }

        return builder.status(allUp).build();
    }
}
