package io.paradedb.operator.crd.paradedb;

import io.paradedb.operator.core.EventRecorder;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;

/**
 * Last step before the finalizer is removed. Owned objects carry a controller owner reference and are
 * removed by the garbage collector, so nothing is deleted here explicitly.
 */
@NullMarked
@Slf4j
@ApplicationScoped
@RequiredArgsConstructor
public class ParadeDBFinalizer {
    private final EventRecorder eventRecorder;

    /**
     * @return {@code true} when the finalizer may be removed
     */
    public boolean release(ParadeDB paradeDB) {
        log.info(
                "Releasing ParadeDB [resource={}/{}]",
                paradeDB.getMetadata().getNamespace(),
                paradeDB.getMetadata().getName()
        );

        eventRecorder.normal(
                paradeDB,
                EventRecorder.REASON_DELETED,
                "ParadeDB deleted, owned resources are garbage collected"
        );

        return true;
    }
}
