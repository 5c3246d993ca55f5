package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodSpecBuilder;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.api.model.batch.v1.CronJobBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.crd.paradedb.BackupSpec;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import io.paradedb.operator.crd.paradedb.config.BackupScriptBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.List;

import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_PASSWORD_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_S3_ACCESS_KEY_ID_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_S3_SECRET_ACCESS_KEY_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_USERNAME_KEY;
import static io.paradedb.operator.crd.paradedb.ParadeDBNames.POSTGRES_PORT;
import static io.paradedb.operator.crd.paradedb.config.BackupScriptBuilder.ENV_BACKUP_DIR;
import static io.paradedb.operator.crd.paradedb.config.BackupScriptBuilder.ENV_BACKUP_PREFIX;
import static io.paradedb.operator.crd.paradedb.config.BackupScriptBuilder.ENV_KEEP_DAILY;
import static io.paradedb.operator.crd.paradedb.config.BackupScriptBuilder.ENV_KEEP_LAST;
import static io.paradedb.operator.crd.paradedb.config.BackupScriptBuilder.ENV_KEEP_WEEKLY;
import static io.paradedb.operator.crd.paradedb.config.BackupScriptBuilder.ENV_S3_BUCKET;
import static io.paradedb.operator.crd.paradedb.config.BackupScriptBuilder.ENV_S3_ENDPOINT;
import static io.paradedb.operator.crd.paradedb.config.BackupScriptBuilder.ENV_S3_PREFIX;
import static io.paradedb.operator.crd.paradedb.sync.StatefulSetSyncer.secretEnv;
import static io.paradedb.operator.crd.paradedb.sync.StatefulSetSyncer.valueEnv;
import static io.paradedb.operator.crd.paradedb.sync.StatefulSetSyncer.volumeMount;

/**
 * Scheduled logical backups with {@code pg_dump}.
 * <p>
 * For a volume target one container dumps into the backup claim and prunes it. For S3 an init container
 * dumps into a scratch directory and the uploader copies the dump to the bucket and prunes the prefix.
 * Runs never overlap.
 */
@NullMarked
@ApplicationScoped
public class BackupCronJobSyncer extends SubResourceSyncer<CronJob> {
    public static final String BACKUP_VOLUME = "backup";
    public static final String BACKUP_MOUNT_PATH = "/backups";

    public BackupCronJobSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.backup(paradeDB);
    }

    @Override
    protected Class<CronJob> resourceType() {
        return CronJob.class;
    }

    @Override
    protected CronJob desired(ParadeDB paradeDB) {
        //noinspection ConstantConditions
        var backup = paradeDB.getSpec().getBackup();
        var labels = ParadeDBNames.labels(paradeDB, ParadeDBNames.COMPONENT_BACKUP);

        var cronJob = new CronJobBuilder()
                .withNewMetadata()
                .withName(name(paradeDB))
                .withNamespace(paradeDB.getMetadata().getNamespace())
                .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                .withSchedule(backup.getSchedule())
                .withConcurrencyPolicy("Forbid")
                .withSuccessfulJobsHistoryLimit(3)
                .withFailedJobsHistoryLimit(1)
                .withNewJobTemplate()
                .withNewSpec()
                .withBackoffLimit(2)
                .withNewTemplate()
                .withNewMetadata()
                .withLabels(labels)
                .endMetadata()
                .withSpec(backup.getS3() != null
                        ? s3PodSpec(paradeDB, backup, backup.getS3())
                        : volumePodSpec(paradeDB, backup)
                )
                .endTemplate()
                .endSpec()
                .endJobTemplate()
                .endSpec()
                .build();

        DesiredStateHash.stamp(cronJob, cronJob.getSpec());

        return cronJob;
    }

    @Override
    protected boolean isUpToDate(
            CronJob actual,
            CronJob desired
    ) {
        return DesiredStateHash.matches(actual, desired)
                && hasLabels(actual, desired);
    }

    @Override
    protected void applyMutableFields(
            CronJob actual,
            CronJob desired
    ) {
        var actualSpec = actual.getSpec();
        var desiredSpec = desired.getSpec();

        actualSpec.setSchedule(desiredSpec.getSchedule());
        actualSpec.setConcurrencyPolicy(desiredSpec.getConcurrencyPolicy());
        actualSpec.setSuccessfulJobsHistoryLimit(desiredSpec.getSuccessfulJobsHistoryLimit());
        actualSpec.setFailedJobsHistoryLimit(desiredSpec.getFailedJobsHistoryLimit());
        actualSpec.setJobTemplate(desiredSpec.getJobTemplate());

        DesiredStateHash.copy(desired, actual);
        mergeLabels(actual, desired);
    }

    @Override
    protected String createdReason() {
        return EventRecorder.REASON_BACKUP_SCHEDULED;
    }

    @Override
    protected String createdMessage(ParadeDB paradeDB) {
        //noinspection ConstantConditions
        return "Backup scheduled [schedule=%s]".formatted(paradeDB.getSpec().getBackup().getSchedule());
    }

    private static PodSpec volumePodSpec(
            ParadeDB paradeDB,
            BackupSpec backup
    ) {
        var env = dumpEnv(paradeDB, BACKUP_MOUNT_PATH);
        env.addAll(retentionEnv(backup));

        return new PodSpecBuilder()
                .withRestartPolicy("OnFailure")
                .addToContainers(new ContainerBuilder()
                        .withName("backup")
                        .withImage(paradeDB.getSpec().getImage())
                        .withCommand("/bin/sh", "-c", BackupScriptBuilder.volumeScript())
                        .withEnv(env)
                        .withVolumeMounts(volumeMount(BACKUP_VOLUME, BACKUP_MOUNT_PATH))
                        .build()
                )
                .addToVolumes(new VolumeBuilder()
                        .withName(BACKUP_VOLUME)
                        .withNewPersistentVolumeClaim()
                        .withClaimName(ParadeDBNames.backup(paradeDB))
                        .endPersistentVolumeClaim()
                        .build()
                )
                .build();
    }

    private static PodSpec s3PodSpec(
            ParadeDB paradeDB,
            BackupSpec backup,
            BackupSpec.S3 s3
    ) {
        var scratchPath = "/scratch";

        Container dump = new ContainerBuilder()
                .withName("dump")
                .withImage(paradeDB.getSpec().getImage())
                .withCommand("/bin/sh", "-c", BackupScriptBuilder.dumpScript())
                .withEnv(dumpEnv(paradeDB, scratchPath))
                .withVolumeMounts(volumeMount("scratch", scratchPath))
                .build();

        var uploadEnv = new ArrayList<EnvVar>();
        uploadEnv.add(valueEnv(ENV_BACKUP_DIR, scratchPath));
        uploadEnv.add(valueEnv(ENV_BACKUP_PREFIX, paradeDB.getMetadata().getName()));
        uploadEnv.add(valueEnv(ENV_S3_BUCKET, s3.getBucket()));
        uploadEnv.add(valueEnv(ENV_S3_PREFIX, BackupScriptBuilder.s3InstancePrefix(
                s3.getPath(),
                paradeDB.getMetadata().getNamespace(),
                paradeDB.getMetadata().getName()
        )));
        if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
            uploadEnv.add(valueEnv(ENV_S3_ENDPOINT, s3.getEndpoint()));
        }
        if (s3.getRegion() != null && !s3.getRegion().isBlank()) {
            uploadEnv.add(valueEnv("AWS_DEFAULT_REGION", s3.getRegion()));
        }
        uploadEnv.add(secretEnv("AWS_ACCESS_KEY_ID", s3.getSecretRef().getName(), SECRET_DATA_S3_ACCESS_KEY_ID_KEY));
        uploadEnv.add(secretEnv("AWS_SECRET_ACCESS_KEY", s3.getSecretRef().getName(), SECRET_DATA_S3_SECRET_ACCESS_KEY_KEY));
        uploadEnv.addAll(retentionEnv(backup));

        Container uploader = new ContainerBuilder()
                .withName("uploader")
                .withImage(backup.getImage())
                .withCommand("/bin/sh", "-c", BackupScriptBuilder.s3UploadScript())
                .withEnv(uploadEnv)
                .withVolumeMounts(volumeMount("scratch", scratchPath))
                .build();

        return new PodSpecBuilder()
                .withRestartPolicy("OnFailure")
                .addToInitContainers(dump)
                .addToContainers(uploader)
                .addToVolumes(new VolumeBuilder()
                        .withName("scratch")
                        .withNewEmptyDir()
                        .endEmptyDir()
                        .build()
                )
                .build();
    }

    private static List<EnvVar> dumpEnv(
            ParadeDB paradeDB,
            String backupDir
    ) {
        var credentialsSecret = CredentialsSecretSyncer.credentialsSecretName(paradeDB);

        var env = new ArrayList<EnvVar>();
        env.add(valueEnv("PGHOST", ParadeDBNames.primaryService(paradeDB)));
        env.add(valueEnv("PGPORT", String.valueOf(POSTGRES_PORT)));
        env.add(secretEnv("PGUSER", credentialsSecret, SECRET_DATA_USERNAME_KEY));
        env.add(secretEnv("PGPASSWORD", credentialsSecret, SECRET_DATA_PASSWORD_KEY));
        env.add(valueEnv("PGDATABASE", paradeDB.getSpec().getAuth().getDatabase()));
        env.add(valueEnv(ENV_BACKUP_DIR, backupDir));
        env.add(valueEnv(ENV_BACKUP_PREFIX, paradeDB.getMetadata().getName()));

        return env;
    }

    private static List<EnvVar> retentionEnv(BackupSpec backup) {
        var retention = backup.getRetentionPolicy();

        return List.of(
                valueEnv(ENV_KEEP_LAST, String.valueOf(retention.getKeepLast())),
                valueEnv(ENV_KEEP_DAILY, String.valueOf(retention.getKeepDaily())),
                valueEnv(ENV_KEEP_WEEKLY, String.valueOf(retention.getKeepWeekly()))
        );
    }
}
