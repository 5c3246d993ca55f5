package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Probe;
import io.fabric8.kubernetes.api.model.ProbeBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.crd.paradedb.ConnectionPoolingSpec;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_PASSWORD_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_USERNAME_KEY;
import static io.paradedb.operator.crd.paradedb.ParadeDBNames.POSTGRES_PORT;
import static io.paradedb.operator.crd.paradedb.sync.StatefulSetSyncer.CONFIG_HASH_ANNOTATION;
import static io.paradedb.operator.crd.paradedb.sync.StatefulSetSyncer.secretEnv;
import static io.paradedb.operator.crd.paradedb.sync.StatefulSetSyncer.valueEnv;
import static io.paradedb.operator.crd.paradedb.sync.StatefulSetSyncer.volumeMount;

/**
 * PgBouncer in front of the primary endpoint.
 */
@NullMarked
@ApplicationScoped
public class PoolerDeploymentSyncer extends SubResourceSyncer<Deployment> {
    public static final String CONTAINER = "pgbouncer";
    public static final String CONFIG_MOUNT_PATH = "/etc/pgbouncer";

    public PoolerDeploymentSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.pooler(paradeDB);
    }

    @Override
    protected Class<Deployment> resourceType() {
        return Deployment.class;
    }

    @Override
    protected Deployment desired(ParadeDB paradeDB) {
        //noinspection ConstantConditions
        var pooling = paradeDB.getSpec().getConnectionPooling();
        var labels = ParadeDBNames.poolerLabels(paradeDB);

        var annotations = new LinkedHashMap<String, String>();
        annotations.put(CONFIG_HASH_ANNOTATION, DesiredStateHash.of(PoolerConfigMapSyncer.configData(paradeDB)));

        var deployment = new DeploymentBuilder()
                .withNewMetadata()
                .withName(name(paradeDB))
                .withNamespace(paradeDB.getMetadata().getNamespace())
                .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                .withReplicas(1)
                .withNewSelector()
                .withMatchLabels(ParadeDBNames.poolerSelectorLabels(paradeDB))
                .endSelector()
                .withNewTemplate()
                .withNewMetadata()
                .withLabels(labels)
                .withAnnotations(annotations)
                .endMetadata()
                .withNewSpec()
                .addNewContainer()
                .withName(CONTAINER)
                .withImage(pooling.getImage())
                .addNewPort()
                .withName("pgbouncer")
                .withContainerPort(POSTGRES_PORT)
                .withProtocol("TCP")
                .endPort()
                .withEnv(env(paradeDB, pooling))
                .withVolumeMounts(volumeMount(StatefulSetSyncer.CONFIG_VOLUME, CONFIG_MOUNT_PATH))
                .withResources(pooling.getResources())
                .withLivenessProbe(tcpProbe(10, 10))
                .withReadinessProbe(tcpProbe(5, 5))
                .endContainer()
                .addNewVolume()
                .withName(StatefulSetSyncer.CONFIG_VOLUME)
                .withNewConfigMap()
                .withName(ParadeDBNames.poolerConfigMap(paradeDB))
                .endConfigMap()
                .endVolume()
                .endSpec()
                .endTemplate()
                .endSpec()
                .build();

        var state = new LinkedHashMap<String, Object>();
        state.put("replicas", deployment.getSpec().getReplicas());
        state.put("template", deployment.getSpec().getTemplate());
        DesiredStateHash.stamp(deployment, state);

        return deployment;
    }

    @Override
    protected boolean isUpToDate(
            Deployment actual,
            Deployment desired
    ) {
        return DesiredStateHash.matches(actual, desired)
                && hasLabels(actual, desired);
    }

    @Override
    protected void applyMutableFields(
            Deployment actual,
            Deployment desired
    ) {
        actual.getSpec().setReplicas(desired.getSpec().getReplicas());
        actual.getSpec().setTemplate(desired.getSpec().getTemplate());

        DesiredStateHash.copy(desired, actual);
        mergeLabels(actual, desired);
    }

    @Override
    protected String createdReason() {
        return EventRecorder.REASON_POOLER_CREATED;
    }

    @Override
    protected String createdMessage(ParadeDB paradeDB) {
        return "Connection pooler created";
    }

    private static List<EnvVar> env(
            ParadeDB paradeDB,
            ConnectionPoolingSpec pooling
    ) {
        var credentialsSecret = CredentialsSecretSyncer.credentialsSecretName(paradeDB);

        var env = new ArrayList<EnvVar>();
        env.add(valueEnv("PGBOUNCER_DATABASE", paradeDB.getSpec().getAuth().getDatabase()));
        env.add(valueEnv("POSTGRESQL_HOST", ParadeDBNames.primaryService(paradeDB)));
        env.add(secretEnv("POSTGRESQL_USERNAME", credentialsSecret, SECRET_DATA_USERNAME_KEY));
        env.add(secretEnv("POSTGRESQL_PASSWORD", credentialsSecret, SECRET_DATA_PASSWORD_KEY));
        env.add(valueEnv("PGBOUNCER_POOL_MODE", pooling.getPoolMode()));
        env.add(valueEnv("PGBOUNCER_MAX_CLIENT_CONN", String.valueOf(pooling.getMaxClientConnections())));
        env.add(valueEnv("PGBOUNCER_DEFAULT_POOL_SIZE", String.valueOf(pooling.getDefaultPoolSize())));
        env.add(valueEnv("PGBOUNCER_MIN_POOL_SIZE", String.valueOf(pooling.getMinPoolSize())));
        env.add(valueEnv("PGBOUNCER_RESERVE_POOL_SIZE", String.valueOf(pooling.getReservePoolSize())));

        return env;
    }

    private static Probe tcpProbe(
            int initialDelaySeconds,
            int periodSeconds
    ) {
        return new ProbeBuilder()
                .withNewTcpSocket()
                .withPort(new IntOrString(POSTGRES_PORT))
                .endTcpSocket()
                .withInitialDelaySeconds(initialDelaySeconds)
                .withPeriodSeconds(periodSeconds)
                .build();
    }
}
