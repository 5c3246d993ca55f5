package io.paradedb.operator.crd.paradedb;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fabric8.generator.annotation.Max;
import io.fabric8.generator.annotation.Min;
import io.fabric8.generator.annotation.Pattern;
import io.fabric8.generator.annotation.ValidationRule;
import io.fabric8.kubernetes.api.model.Affinity;
import io.fabric8.kubernetes.api.model.PodSecurityContext;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.SecurityContext;
import io.fabric8.kubernetes.api.model.Toleration;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@NullMarked
@Getter
@Setter
public class ParadeDBSpec {
    private String image = "paradedb/paradedb:latest";

    @Min(1)
    @Max(10)
    private int replicas = 1;

    private String postgresVersion = "16";

    private StorageSpec storage = new StorageSpec();

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private ResourceRequirements resources;

    private AuthSpec auth = new AuthSpec();

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    @ValidationRule(
            value = "!(has(self.secretRef) && has(self.certManager) && self.certManager.enabled)",
            message = "The TLS secretRef and certManager options are mutually exclusive."
    )
    private TLSSpec tls;

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private ConnectionPoolingSpec connectionPooling;

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    @ValidationRule(
            value = "!(has(self.s3) && has(self.pvc))",
            message = "The backup s3 and pvc targets are mutually exclusive."
    )
    private BackupSpec backup;

    /**
     * Prometheus metrics exporter. A missing block means monitoring is enabled with defaults.
     */
    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private MonitoringSpec monitoring;

    private ExtensionsSpec extensions = new ExtensionsSpec();

    /**
     * Additional postgresql.conf parameters, they take precedence over the generated defaults.
     */
    private Map<String, String> postgresConfig = new LinkedHashMap<>();

    @Pattern("^(ClusterIP|NodePort|LoadBalancer)$")
    private String serviceType = "ClusterIP";

    private Map<String, String> nodeSelector = new LinkedHashMap<>();

    private List<Toleration> tolerations = new ArrayList<>();

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private Affinity affinity;

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private PodSecurityContext podSecurityContext;

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private SecurityContext containerSecurityContext;

    @JsonIgnore
    public boolean isTlsEnabled() {
        return tls != null && tls.isEnabled();
    }

    @JsonIgnore
    public boolean isConnectionPoolingEnabled() {
        return connectionPooling != null && connectionPooling.isEnabled();
    }

    @JsonIgnore
    public boolean isBackupEnabled() {
        return backup != null && backup.isEnabled();
    }

    @JsonIgnore
    public boolean isMonitoringEnabled() {
        return monitoring == null || monitoring.isEnabled();
    }

    @JsonIgnore
    public MonitoringSpec getMonitoringOrDefault() {
        return monitoring != null ? monitoring : new MonitoringSpec();
    }
}
