package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import io.paradedb.operator.crd.paradedb.config.PgBouncerConfigBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;

import java.util.Map;
import java.util.Objects;

@NullMarked
@ApplicationScoped
public class PoolerConfigMapSyncer extends SubResourceSyncer<ConfigMap> {
    public static final String PGBOUNCER_INI = "pgbouncer.ini";

    public PoolerConfigMapSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    public static Map<String, String> configData(ParadeDB paradeDB) {
        //noinspection ConstantConditions
        return Map.of(
                PGBOUNCER_INI,
                PgBouncerConfigBuilder.build(paradeDB, paradeDB.getSpec().getConnectionPooling())
        );
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.poolerConfigMap(paradeDB);
    }

    @Override
    protected Class<ConfigMap> resourceType() {
        return ConfigMap.class;
    }

    @Override
    protected ConfigMap desired(ParadeDB paradeDB) {
        return new ConfigMapBuilder()
                .withNewMetadata()
                .withName(name(paradeDB))
                .withNamespace(paradeDB.getMetadata().getNamespace())
                .withLabels(ParadeDBNames.poolerLabels(paradeDB))
                .endMetadata()
                .withData(configData(paradeDB))
                .build();
    }

    @Override
    protected boolean isUpToDate(
            ConfigMap actual,
            ConfigMap desired
    ) {
        return Objects.equals(actual.getData(), desired.getData())
                && hasLabels(actual, desired);
    }

    @Override
    protected void applyMutableFields(
            ConfigMap actual,
            ConfigMap desired
    ) {
        actual.setData(desired.getData());
        mergeLabels(actual, desired);
    }
}
