package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;

import static io.paradedb.operator.core.KubernetesUtil.getReferencedSecret;

/**
 * Backup target and schedule. Without an S3 target, dumps go to an in-cluster volume.
 */
@NullMarked
@ApplicationScoped
@RequiredArgsConstructor
public class BackupSyncer {
    private final KubernetesClient kubernetesClient;

    private final BackupVolumeSyncer backupVolumeSyncer;
    private final BackupCronJobSyncer backupCronJobSyncer;

    public void sync(ParadeDB paradeDB) {
        //noinspection ConstantConditions
        var s3 = paradeDB.getSpec().getBackup().getS3();

        if (s3 != null) {
            getReferencedSecret(
                    kubernetesClient,
                    paradeDB,
                    s3.getSecretRef(),
                    "Backup S3"
            );
        } else {
            backupVolumeSyncer.sync(paradeDB);
        }

        backupCronJobSyncer.sync(paradeDB);
    }
}
