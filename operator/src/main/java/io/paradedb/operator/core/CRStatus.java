package io.paradedb.operator.core;

import io.fabric8.kubernetes.api.model.Condition;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Status Object for the Custom Resources.
 * <p>
 * This object captures the state of the managed instance as last observed by the reconciler.
 */
@NullMarked
@Getter
@Setter
@Accessors(chain = true)
public class CRStatus {
    /**
     * Current lifecycle phase. {@code null} until the first reconciliation.
     */
    @Nullable
    @Setter(AccessLevel.NONE)
    private CRPhase phase = null;

    /**
     * Human-readable message providing details about the current state.
     */
    @Nullable
    private String message = null;

    /**
     * Last time the phase transitioned from one value to another.
     */
    @Nullable
    @Setter(AccessLevel.NONE)
    private OffsetDateTime lastPhaseTransitionTime = null;

    /**
     * Observed resource generation that the controller acted upon.
     */
    private long observedGeneration = 0;

    private List<Condition> conditions = new ArrayList<>();

    /**
     * Update the current phase. When the phase changes, the {@link #lastPhaseTransitionTime}
     * is updated to the current UTC time.
     *
     * @param newPhase the new phase
     * @return this status instance
     */
    public CRStatus setPhase(CRPhase newPhase) {
        if (this.phase == newPhase) {
            return this;
        }

        this.phase = newPhase;
        this.lastPhaseTransitionTime = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);

        return this;
    }
}
