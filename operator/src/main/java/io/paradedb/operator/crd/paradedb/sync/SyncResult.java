package io.paradedb.operator.crd.paradedb.sync;

import org.jspecify.annotations.NullMarked;

@NullMarked
public enum SyncResult {
    CREATED,
    UPDATED,
    UNCHANGED
}
