package io.paradedb.operator.crd.paradedb.config;

import io.paradedb.operator.crd.paradedb.ParadeDBSpec;
import org.jspecify.annotations.NullMarked;

/**
 * Renders {@code pg_hba.conf}. Rules are matched top-down, so user rules are placed before the catch-all.
 */
@NullMarked
public final class PgHbaConfigBuilder {
    private static final String ROW_FORMAT = "%-8s%-16s%-16s%-24s%s\n";

    public static String build(ParadeDBSpec spec) {
        var config = new StringBuilder("# Generated by paradedb-operator. Do not edit.\n");

        config.append(ROW_FORMAT.formatted("# TYPE", "DATABASE", "USER", "ADDRESS", "METHOD"));
        config.append(ROW_FORMAT.formatted("local", "all", "all", "", "trust"));
        config.append(ROW_FORMAT.formatted("host", "all", "all", "127.0.0.1/32", "trust"));
        config.append(ROW_FORMAT.formatted("host", "all", "all", "::1/128", "trust"));

        for (var rule : spec.getAuth().getPgHBA()) {
            var trimmed = rule.strip();

            if (!trimmed.isEmpty()) {
                config.append(trimmed).append('\n');
            }
        }

        var hostType = spec.isTlsEnabled() ? "hostssl" : "host";
        config.append(ROW_FORMAT.formatted(hostType, "all", "all", "all", "scram-sha-256"));

        return config.toString();
    }

    private PgHbaConfigBuilder() {
    }
}
