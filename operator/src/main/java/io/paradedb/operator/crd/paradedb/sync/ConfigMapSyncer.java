package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import io.paradedb.operator.crd.paradedb.config.InitScriptBuilder;
import io.paradedb.operator.crd.paradedb.config.MetricsQueriesBuilder;
import io.paradedb.operator.crd.paradedb.config.PgHbaConfigBuilder;
import io.paradedb.operator.crd.paradedb.config.PostgresConfigBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Database configuration files, regenerated from the ParadeDB spec on every pass.
 */
@NullMarked
@ApplicationScoped
public class ConfigMapSyncer extends SubResourceSyncer<ConfigMap> {
    public static final String POSTGRESQL_CONF = "postgresql.conf";
    public static final String PG_HBA_CONF = "pg_hba.conf";
    public static final String INIT_SQL = "init.sql";

    public ConfigMapSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    public static Map<String, String> configData(ParadeDB paradeDB) {
        var spec = paradeDB.getSpec();
        var data = new LinkedHashMap<String, String>();

        data.put(POSTGRESQL_CONF, PostgresConfigBuilder.build(spec));
        data.put(PG_HBA_CONF, PgHbaConfigBuilder.build(spec));
        data.put(INIT_SQL, InitScriptBuilder.build(spec));

        var monitoring = spec.getMonitoringOrDefault();
        if (spec.isMonitoringEnabled() && !monitoring.getCustomQueries().isEmpty()) {
            data.put(MetricsQueriesBuilder.FILE_NAME, MetricsQueriesBuilder.build(monitoring));
        }

        return data;
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.configMap(paradeDB);
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
                .withLabels(ParadeDBNames.labels(paradeDB))
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

    @Override
    protected String createdReason() {
        return EventRecorder.REASON_CONFIG_MAP_CREATED;
    }
}
