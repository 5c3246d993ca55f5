package io.paradedb.operator.crd.paradedb.config;

import io.paradedb.operator.crd.paradedb.MonitoringSpec;
import org.jspecify.annotations.NullMarked;

import java.util.TreeMap;

/**
 * Renders the postgres_exporter {@code queries.yaml} from the custom query definitions.
 */
@NullMarked
public final class MetricsQueriesBuilder {
    public static final String FILE_NAME = "queries.yaml";

    public static String build(MonitoringSpec monitoring) {
        var queries = new StringBuilder();

        for (var entry : new TreeMap<>(monitoring.getCustomQueries()).entrySet()) {
            queries.append(entry.getKey()).append(":\n");

            entry.getValue()
                    .stripTrailing()
                    .lines()
                    .forEach(line -> queries.append(line.isBlank() ? "" : "  " + line).append('\n'));
        }

        return queries.toString();
    }

    private MetricsQueriesBuilder() {
    }
}
