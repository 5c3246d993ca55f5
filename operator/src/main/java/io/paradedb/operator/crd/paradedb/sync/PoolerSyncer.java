package io.paradedb.operator.crd.paradedb.sync;

import io.paradedb.operator.crd.paradedb.ParadeDB;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;

/**
 * Connection pooling tier: configuration, workload and endpoint, in that order.
 */
@NullMarked
@ApplicationScoped
@RequiredArgsConstructor
public class PoolerSyncer {
    private final PoolerConfigMapSyncer poolerConfigMapSyncer;
    private final PoolerDeploymentSyncer poolerDeploymentSyncer;
    private final PoolerServiceSyncer poolerServiceSyncer;

    public void sync(ParadeDB paradeDB) {
        poolerConfigMapSyncer.sync(paradeDB);
        poolerDeploymentSyncer.sync(paradeDB);
        poolerServiceSyncer.sync(paradeDB);
    }
}
