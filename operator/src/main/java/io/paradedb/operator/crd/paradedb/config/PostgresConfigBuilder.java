package io.paradedb.operator.crd.paradedb.config;

import io.paradedb.operator.crd.paradedb.ParadeDBSpec;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Renders {@code postgresql.conf}.
 */
@NullMarked
public final class PostgresConfigBuilder {
    public static final String TLS_MOUNT_PATH = "/etc/postgresql/tls";

    private static final Pattern UNQUOTED_VALUE = Pattern.compile("^(-?\\d+(\\.\\d+)?|on|off|true|false)$");

    public static String build(ParadeDBSpec spec) {
        var parameters = new LinkedHashMap<String, String>();

        parameters.put("listen_addresses", "*");
        parameters.put("port", "5432");
        parameters.put("max_connections", "100");
        parameters.put("shared_buffers", "128MB");
        parameters.put("password_encryption", "scram-sha-256");

        var preloadLibraries = new ArrayList<String>();
        if (spec.getExtensions().isPgSearch()) {
            preloadLibraries.add("pg_search");
        }
        if (spec.getExtensions().isPgAnalytics()) {
            preloadLibraries.add("pg_analytics");
        }
        if (!preloadLibraries.isEmpty()) {
            parameters.put("shared_preload_libraries", String.join(",", preloadLibraries));
        }

        if (spec.isTlsEnabled()) {
            parameters.put("ssl", "on");
            parameters.put("ssl_cert_file", TLS_MOUNT_PATH + "/tls.crt");
            parameters.put("ssl_key_file", TLS_MOUNT_PATH + "/tls.key");
            parameters.put("ssl_ca_file", TLS_MOUNT_PATH + "/ca.crt");
        }

        if (spec.getStorage().getWalStorage() != null) {
            parameters.put("wal_compression", "on");
        }

        // user overrides win, in a stable order
        parameters.putAll(new TreeMap<>(spec.getPostgresConfig()));

        var config = new StringBuilder("# Generated by paradedb-operator. Do not edit.\n");

        for (Map.Entry<String, String> parameter : parameters.entrySet()) {
            config.append(parameter.getKey())
                    .append(" = ")
                    .append(formatValue(parameter.getValue()))
                    .append('\n');
        }

        return config.toString();
    }

    static String formatValue(String value) {
        if (UNQUOTED_VALUE.matcher(value).matches()) {
            return value;
        }

        if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
            return value;
        }

        return "'" + value.replace("'", "''") + "'";
    }

    private PostgresConfigBuilder() {
    }
}
