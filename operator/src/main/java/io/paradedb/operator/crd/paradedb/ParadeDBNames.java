package io.paradedb.operator.crd.paradedb;

import org.jspecify.annotations.NullMarked;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic names and labels of every object owned by a {@link ParadeDB}.
 * All names derive from {@code metadata.name} only.
 */
@NullMarked
public final class ParadeDBNames {
    public static final String LABEL_NAME = "app.kubernetes.io/name";
    public static final String LABEL_INSTANCE = "app.kubernetes.io/instance";
    public static final String LABEL_VERSION = "app.kubernetes.io/version";
    public static final String LABEL_COMPONENT = "app.kubernetes.io/component";
    public static final String LABEL_MANAGED_BY = "app.kubernetes.io/managed-by";

    public static final String APP_NAME = "paradedb";
    public static final String POOLER_APP_NAME = "pgbouncer";
    public static final String MANAGED_BY = "paradedb-operator";

    public static final String COMPONENT_DATABASE = "database";
    public static final String COMPONENT_POOLER = "pooler";
    public static final String COMPONENT_METRICS = "metrics";
    public static final String COMPONENT_BACKUP = "backup";

    public static final int POSTGRES_PORT = 5432;

    public static String workload(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName();
    }

    public static String primaryService(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName();
    }

    public static String credentialsSecret(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName() + "-credentials";
    }

    public static String configMap(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName() + "-config";
    }

    public static String headlessService(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName() + "-headless";
    }

    public static String pooler(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName() + "-pooler";
    }

    public static String poolerConfigMap(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName() + "-pooler-config";
    }

    public static String metricsService(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName() + "-metrics";
    }

    public static String serviceMonitor(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName() + "-metrics";
    }

    public static String backup(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName() + "-backup";
    }

    public static String tlsCertificate(ParadeDB paradeDB) {
        return paradeDB.getMetadata().getName() + "-tls";
    }

    /**
     * Labels of the database workload and its endpoints.
     */
    public static Map<String, String> labels(ParadeDB paradeDB) {
        var labels = new LinkedHashMap<String, String>();

        labels.put(LABEL_NAME, APP_NAME);
        labels.put(LABEL_INSTANCE, paradeDB.getMetadata().getName());
        labels.put(LABEL_VERSION, paradeDB.getSpec().getPostgresVersion());
        labels.put(LABEL_COMPONENT, COMPONENT_DATABASE);
        labels.put(LABEL_MANAGED_BY, MANAGED_BY);

        return labels;
    }

    public static Map<String, String> labels(
            ParadeDB paradeDB,
            String component
    ) {
        var labels = labels(paradeDB);
        labels.put(LABEL_COMPONENT, component);

        return labels;
    }

    /**
     * The subset of {@link #labels(ParadeDB)} that is stable across spec changes.
     */
    public static Map<String, String> selectorLabels(ParadeDB paradeDB) {
        var labels = new LinkedHashMap<String, String>();

        labels.put(LABEL_NAME, APP_NAME);
        labels.put(LABEL_INSTANCE, paradeDB.getMetadata().getName());

        return labels;
    }

    public static Map<String, String> poolerLabels(ParadeDB paradeDB) {
        var labels = new LinkedHashMap<String, String>();

        labels.put(LABEL_NAME, POOLER_APP_NAME);
        labels.put(LABEL_INSTANCE, paradeDB.getMetadata().getName());
        labels.put(LABEL_COMPONENT, COMPONENT_POOLER);
        labels.put(LABEL_MANAGED_BY, MANAGED_BY);

        return labels;
    }

    public static Map<String, String> poolerSelectorLabels(ParadeDB paradeDB) {
        var labels = new LinkedHashMap<String, String>();

        labels.put(LABEL_NAME, POOLER_APP_NAME);
        labels.put(LABEL_INSTANCE, paradeDB.getMetadata().getName());
        labels.put(LABEL_COMPONENT, COMPONENT_POOLER);

        return labels;
    }

    private ParadeDBNames() {
    }
}
