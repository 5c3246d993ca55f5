package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.api.model.Probe;
import io.fabric8.kubernetes.api.model.ProbeBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import io.paradedb.operator.crd.paradedb.config.InitScriptBuilder;
import io.paradedb.operator.crd.paradedb.config.MetricsQueriesBuilder;
import io.paradedb.operator.crd.paradedb.config.PostgresConfigBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_PASSWORD_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_USERNAME_KEY;
import static io.paradedb.operator.crd.paradedb.ParadeDBNames.POSTGRES_PORT;

/**
 * The database workload.
 * <p>
 * Volume claim templates are immutable and only set at creation. Updates overwrite replicas and the pod
 * template. A hash of the rendered configuration is part of the pod template, so a configuration change rolls
 * the pods.
 */
@NullMarked
@ApplicationScoped
public class StatefulSetSyncer extends SubResourceSyncer<StatefulSet> {
    public static final String DATABASE_CONTAINER = "paradedb";
    public static final String EXPORTER_CONTAINER = "postgres-exporter";

    public static final String DATA_VOLUME = "data";
    public static final String WAL_VOLUME = "wal";
    public static final String CONFIG_VOLUME = "config";
    public static final String TLS_VOLUME = "tls";

    public static final String DATA_MOUNT_PATH = "/var/lib/postgresql/data";
    public static final String PGDATA = DATA_MOUNT_PATH + "/pgdata";
    public static final String WAL_MOUNT_PATH = "/var/lib/postgresql/wal";
    public static final String INIT_MOUNT_PATH = "/docker-entrypoint-initdb.d";
    public static final String CONFIG_MOUNT_PATH = "/etc/paradedb";
    public static final String EXPORTER_QUERIES_MOUNT_PATH = "/etc/postgres-exporter";

    public static final String CONFIG_HASH_ANNOTATION = "paradedb.io/config-hash";

    public StatefulSetSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.workload(paradeDB);
    }

    @Override
    protected Class<StatefulSet> resourceType() {
        return StatefulSet.class;
    }

    @Override
    protected StatefulSet desired(ParadeDB paradeDB) {
        var spec = paradeDB.getSpec();
        var labels = ParadeDBNames.labels(paradeDB);

        var statefulSet = new StatefulSetBuilder()
                .withNewMetadata()
                .withName(name(paradeDB))
                .withNamespace(paradeDB.getMetadata().getNamespace())
                .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                .withServiceName(ParadeDBNames.headlessService(paradeDB))
                .withReplicas(spec.getReplicas())
                .withNewSelector()
                .withMatchLabels(ParadeDBNames.selectorLabels(paradeDB))
                .endSelector()
                .withNewTemplate()
                .withNewMetadata()
                .withLabels(labels)
                .withAnnotations(podAnnotations(paradeDB))
                .endMetadata()
                .withNewSpec()
                .withContainers(containers(paradeDB))
                .withVolumes(volumes(paradeDB))
                .withNodeSelector(spec.getNodeSelector().isEmpty() ? null : spec.getNodeSelector())
                .withTolerations(spec.getTolerations().isEmpty() ? null : spec.getTolerations())
                .withAffinity(spec.getAffinity())
                .withSecurityContext(spec.getPodSecurityContext())
                .endSpec()
                .endTemplate()
                .withVolumeClaimTemplates(volumeClaimTemplates(paradeDB))
                .endSpec()
                .build();

        DesiredStateHash.stamp(statefulSet, hashedState(statefulSet));

        return statefulSet;
    }

    @Override
    protected boolean isUpToDate(
            StatefulSet actual,
            StatefulSet desired
    ) {
        return DesiredStateHash.matches(actual, desired)
                && hasLabels(actual, desired);
    }

    @Override
    protected void applyMutableFields(
            StatefulSet actual,
            StatefulSet desired
    ) {
        actual.getSpec().setReplicas(desired.getSpec().getReplicas());
        actual.getSpec().setTemplate(desired.getSpec().getTemplate());

        DesiredStateHash.copy(desired, actual);
        mergeLabels(actual, desired);
    }

    @Override
    protected String createdReason() {
        return EventRecorder.REASON_STATEFUL_SET_CREATED;
    }

    private static Map<String, Object> hashedState(StatefulSet statefulSet) {
        var state = new LinkedHashMap<String, Object>();
        state.put("replicas", statefulSet.getSpec().getReplicas());
        state.put("template", statefulSet.getSpec().getTemplate());

        return state;
    }

    private static Map<String, String> podAnnotations(ParadeDB paradeDB) {
        var annotations = new LinkedHashMap<String, String>();

        if (paradeDB.getSpec().isMonitoringEnabled()) {
            annotations.put("prometheus.io/scrape", "true");
            annotations.put("prometheus.io/port", String.valueOf(paradeDB.getSpec().getMonitoringOrDefault().getPort()));
        }

        annotations.put(CONFIG_HASH_ANNOTATION, DesiredStateHash.of(ConfigMapSyncer.configData(paradeDB)));

        return annotations;
    }

    private static List<Container> containers(ParadeDB paradeDB) {
        var containers = new ArrayList<Container>();
        containers.add(databaseContainer(paradeDB));

        if (paradeDB.getSpec().isMonitoringEnabled()) {
            containers.add(exporterContainer(paradeDB));
        }

        return containers;
    }

    private static Container databaseContainer(ParadeDB paradeDB) {
        var spec = paradeDB.getSpec();
        var credentialsSecret = CredentialsSecretSyncer.credentialsSecretName(paradeDB);

        var env = new ArrayList<EnvVar>();
        env.add(secretEnv("POSTGRES_USER", credentialsSecret, SECRET_DATA_USERNAME_KEY));
        env.add(secretEnv("POSTGRES_PASSWORD", credentialsSecret, SECRET_DATA_PASSWORD_KEY));
        env.add(valueEnv("POSTGRES_DB", spec.getAuth().getDatabase()));
        env.add(valueEnv("PGDATA", PGDATA));

        if (spec.getStorage().getWalStorage() != null) {
            env.add(valueEnv("POSTGRES_INITDB_WALDIR", WAL_MOUNT_PATH + "/pg_wal"));
        }

        var users = spec.getAuth().getUsers();
        for (int index = 0; index < users.size(); index++) {
            env.add(secretEnv(
                    InitScriptBuilder.userPasswordEnv(index),
                    users.get(index).getSecretRef().getName(),
                    SECRET_DATA_PASSWORD_KEY
            ));
        }

        var mounts = new ArrayList<VolumeMount>();
        mounts.add(volumeMount(DATA_VOLUME, DATA_MOUNT_PATH));
        mounts.add(volumeMount(CONFIG_VOLUME, INIT_MOUNT_PATH));
        mounts.add(volumeMount(CONFIG_VOLUME, CONFIG_MOUNT_PATH));

        if (spec.getStorage().getWalStorage() != null) {
            mounts.add(volumeMount(WAL_VOLUME, WAL_MOUNT_PATH));
        }
        if (spec.isTlsEnabled()) {
            mounts.add(volumeMount(TLS_VOLUME, PostgresConfigBuilder.TLS_MOUNT_PATH));
        }

        return new ContainerBuilder()
                .withName(DATABASE_CONTAINER)
                .withImage(spec.getImage())
                .withArgs(
                        "-c", "config_file=" + CONFIG_MOUNT_PATH + "/" + ConfigMapSyncer.POSTGRESQL_CONF,
                        "-c", "hba_file=" + CONFIG_MOUNT_PATH + "/" + ConfigMapSyncer.PG_HBA_CONF
                )
                .addNewPort()
                .withName("postgres")
                .withContainerPort(POSTGRES_PORT)
                .withProtocol("TCP")
                .endPort()
                .withEnv(env)
                .withVolumeMounts(mounts)
                .withResources(spec.getResources())
                .withLivenessProbe(pgIsReady(30, 10, 5, 6))
                .withReadinessProbe(pgIsReady(5, 5, 3, 3))
                .withSecurityContext(spec.getContainerSecurityContext())
                .build();
    }

    private static Container exporterContainer(ParadeDB paradeDB) {
        var spec = paradeDB.getSpec();
        var monitoring = spec.getMonitoringOrDefault();
        var credentialsSecret = CredentialsSecretSyncer.credentialsSecretName(paradeDB);

        var env = new ArrayList<EnvVar>();
        env.add(valueEnv("DATA_SOURCE_URI", "localhost:%d/%s?sslmode=disable".formatted(
                POSTGRES_PORT,
                spec.getAuth().getDatabase()
        )));
        env.add(secretEnv("DATA_SOURCE_USER", credentialsSecret, SECRET_DATA_USERNAME_KEY));
        env.add(secretEnv("DATA_SOURCE_PASS", credentialsSecret, SECRET_DATA_PASSWORD_KEY));

        var mounts = new ArrayList<VolumeMount>();

        if (!monitoring.getCustomQueries().isEmpty()) {
            env.add(valueEnv(
                    "PG_EXPORTER_EXTEND_QUERY_PATH",
                    EXPORTER_QUERIES_MOUNT_PATH + "/" + MetricsQueriesBuilder.FILE_NAME
            ));
            mounts.add(volumeMount(CONFIG_VOLUME, EXPORTER_QUERIES_MOUNT_PATH));
        }

        return new ContainerBuilder()
                .withName(EXPORTER_CONTAINER)
                .withImage(monitoring.getImage())
                .addNewPort()
                .withName("metrics")
                .withContainerPort(monitoring.getPort())
                .withProtocol("TCP")
                .endPort()
                .withEnv(env)
                .withVolumeMounts(mounts.isEmpty() ? null : mounts)
                .withResources(monitoring.getResources())
                .build();
    }

    private static List<Volume> volumes(ParadeDB paradeDB) {
        var volumes = new ArrayList<Volume>();

        volumes.add(new VolumeBuilder()
                .withName(CONFIG_VOLUME)
                .withNewConfigMap()
                .withName(ParadeDBNames.configMap(paradeDB))
                .endConfigMap()
                .build()
        );

        if (paradeDB.getSpec().isTlsEnabled()) {
            volumes.add(new VolumeBuilder()
                    .withName(TLS_VOLUME)
                    .withNewSecret()
                    .withSecretName(TlsCertificateSyncer.tlsSecretName(paradeDB))
                    .withDefaultMode(0640)
                    .endSecret()
                    .build()
            );
        }

        return volumes;
    }

    private static List<PersistentVolumeClaim> volumeClaimTemplates(ParadeDB paradeDB) {
        var storage = paradeDB.getSpec().getStorage();
        var labels = ParadeDBNames.labels(paradeDB);

        var accessModes = storage.getAccessModes().isEmpty()
                ? List.of("ReadWriteOnce")
                : storage.getAccessModes();

        var claims = new ArrayList<PersistentVolumeClaim>();
        claims.add(claimTemplate(DATA_VOLUME, labels, accessModes, storage.getSize(), storage.getStorageClassName()));

        var walStorage = storage.getWalStorage();
        if (walStorage != null) {
            claims.add(claimTemplate(WAL_VOLUME, labels, accessModes, walStorage.getSize(), walStorage.getStorageClassName()));
        }

        return claims;
    }

    private static PersistentVolumeClaim claimTemplate(
            String name,
            Map<String, String> labels,
            List<String> accessModes,
            Quantity size,
            @Nullable String storageClassName
    ) {
        return new PersistentVolumeClaimBuilder()
                .withNewMetadata()
                .withName(name)
                .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                .withAccessModes(accessModes)
                .withNewResources()
                .withRequests(Map.of("storage", size))
                .endResources()
                .withStorageClassName(storageClassName)
                .endSpec()
                .build();
    }

    private static Probe pgIsReady(
            int initialDelaySeconds,
            int periodSeconds,
            int timeoutSeconds,
            int failureThreshold
    ) {
        return new ProbeBuilder()
                .withNewExec()
                .withCommand("pg_isready", "-U", CredentialsSecretSyncer.SUPERUSER)
                .endExec()
                .withInitialDelaySeconds(initialDelaySeconds)
                .withPeriodSeconds(periodSeconds)
                .withTimeoutSeconds(timeoutSeconds)
                .withFailureThreshold(failureThreshold)
                .build();
    }

    static EnvVar valueEnv(
            String name,
            String value
    ) {
        return new EnvVarBuilder()
                .withName(name)
                .withValue(value)
                .build();
    }

    static EnvVar secretEnv(
            String name,
            String secretName,
            String key
    ) {
        return new EnvVarBuilder()
                .withName(name)
                .withNewValueFrom()
                .withNewSecretKeyRef()
                .withName(secretName)
                .withKey(key)
                .endSecretKeyRef()
                .endValueFrom()
                .build();
    }

    static VolumeMount volumeMount(
            String name,
            String mountPath
    ) {
        return new VolumeMountBuilder()
                .withName(name)
                .withMountPath(mountPath)
                .build();
    }
}
