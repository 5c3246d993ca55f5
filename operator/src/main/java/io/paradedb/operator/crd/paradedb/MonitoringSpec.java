package io.paradedb.operator.crd.paradedb;

import io.fabric8.generator.annotation.Max;
import io.fabric8.generator.annotation.Min;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

@NullMarked
@Getter
@Setter
public class MonitoringSpec {
    private boolean enabled = true;

    private String image = "quay.io/prometheuscommunity/postgres-exporter:latest";

    @Min(1)
    @Max(65535)
    private int port = 9187;

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private ResourceRequirements resources;

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private ServiceMonitor serviceMonitor;

    /**
     * postgres_exporter custom query definitions, keyed by metric namespace. Each value is the YAML body
     * of the query entry.
     */
    private Map<String, String> customQueries = new LinkedHashMap<>();

    @NullMarked
    @Getter
    @Setter
    public static class ServiceMonitor {
        private boolean enabled = false;

        private Map<String, String> labels = new LinkedHashMap<>();

        private String interval = "30s";
    }
}
