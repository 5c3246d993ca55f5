package io.paradedb.operator.core;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import org.jspecify.annotations.NullMarked;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@NullMarked
public final class Conditions {
    public static final String TYPE_READY = "Ready";
    public static final String TYPE_PROGRESSING = "Progressing";
    public static final String TYPE_DEGRADED = "Degraded";

    public static final String STATUS_TRUE = "True";
    public static final String STATUS_FALSE = "False";

    public static Optional<Condition> find(
            List<Condition> conditions,
            String type
    ) {
        return conditions.stream()
                .filter(condition -> Objects.equals(condition.getType(), type))
                .findFirst();
    }

    /**
     * Insert or update the condition of the given type.
     * <p>
     * {@code lastTransitionTime} only moves when the status value flips, reason and message are
     * overwritten in place.
     */
    public static void set(
            List<Condition> conditions,
            String type,
            boolean value,
            String reason,
            String message,
            long observedGeneration
    ) {
        var status = value ? STATUS_TRUE : STATUS_FALSE;
        var existing = find(conditions, type);

        if (existing.isEmpty()) {
            conditions.add(new ConditionBuilder()
                    .withType(type)
                    .withStatus(status)
                    .withReason(reason)
                    .withMessage(message)
                    .withObservedGeneration(observedGeneration)
                    .withLastTransitionTime(now())
                    .build()
            );

            return;
        }

        var condition = existing.get();

        if (!Objects.equals(condition.getStatus(), status)) {
            condition.setStatus(status);
            condition.setLastTransitionTime(now());
        }

        condition.setReason(reason);
        condition.setMessage(message);
        condition.setObservedGeneration(observedGeneration);
    }

    public static boolean isTrue(
            List<Condition> conditions,
            String type
    ) {
        return find(conditions, type)
                .map(condition -> STATUS_TRUE.equals(condition.getStatus()))
                .orElse(false);
    }

    private static String now() {
        return OffsetDateTime.now(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    private Conditions() {
    }
}
