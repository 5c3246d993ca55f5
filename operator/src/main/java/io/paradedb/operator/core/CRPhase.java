package io.paradedb.operator.core;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;

@NullMarked
@Getter
@RequiredArgsConstructor
public enum CRPhase {
    PENDING("Pending"),
    CREATING("Creating"),
    RUNNING("Running"),
    UPDATING("Updating"),
    FAILED("Failed"),
    DELETING("Deleting");

    @JsonValue
    private final String value;
}
