package io.paradedb.operator.crd.paradedb;

import io.paradedb.operator.core.CRStatus;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

@NullMarked
@Getter
@Setter
@Accessors(chain = true)
public class ParadeDBStatus extends CRStatus {
    private int readyReplicas = 0;

    /**
     * Image currently rolled out to the workload.
     */
    @Nullable
    private String currentVersion;

    /**
     * In-cluster connection address of the primary endpoint, {@code host:port}.
     */
    @Nullable
    private String endpoint;

    @Nullable
    private String poolerEndpoint;

    @Nullable
    private String lastBackup;

    @Nullable
    private String lastBackupSize;
}
