package io.paradedb.operator.core;

import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Publishes core/v1 Events against a custom resource.
 * <p>
 * Events are an audit trail only, a failure to publish one is logged and never fails a reconciliation.
 */
@NullMarked
@Slf4j
@ApplicationScoped
@RequiredArgsConstructor
public class EventRecorder {
    public static final String REPORTING_COMPONENT = "paradedb-operator";

    public static final String TYPE_NORMAL = "Normal";
    public static final String TYPE_WARNING = "Warning";

    public static final String REASON_CREATING = "Creating";
    public static final String REASON_SECRET_CREATED = "SecretCreated";
    public static final String REASON_CONFIG_MAP_CREATED = "ConfigMapCreated";
    public static final String REASON_CERTIFICATE_CREATED = "CertificateCreated";
    public static final String REASON_STATEFUL_SET_CREATED = "StatefulSetCreated";
    public static final String REASON_SERVICE_CREATED = "ServiceCreated";
    public static final String REASON_POOLER_CREATED = "PoolerCreated";
    public static final String REASON_METRICS_SERVICE_CREATED = "MetricsServiceCreated";
    public static final String REASON_BACKUP_SCHEDULED = "BackupScheduled";
    public static final String REASON_RECONCILIATION_FAILED = "ReconciliationFailed";
    public static final String REASON_DELETED = "Deleted";

    private final KubernetesClient kubernetesClient;

    public void normal(
            HasMetadata resource,
            String reason,
            String message
    ) {
        record(resource, TYPE_NORMAL, reason, message);
    }

    public void warning(
            HasMetadata resource,
            String reason,
            String message
    ) {
        record(resource, TYPE_WARNING, reason, message);
    }

    private void record(
            HasMetadata resource,
            String type,
            String reason,
            String message
    ) {
        var metadata = resource.getMetadata();
        var timestamp = Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();

        var event = new EventBuilder()
                .withNewMetadata()
                .withNamespace(metadata.getNamespace())
                .withName("%s.%x".formatted(metadata.getName(), System.nanoTime()))
                .endMetadata()
                .withInvolvedObject(new ObjectReferenceBuilder()
                        .withApiVersion(resource.getApiVersion())
                        .withKind(resource.getKind())
                        .withNamespace(metadata.getNamespace())
                        .withName(metadata.getName())
                        .withUid(metadata.getUid())
                        .withResourceVersion(metadata.getResourceVersion())
                        .build()
                )
                .withType(type)
                .withReason(reason)
                .withMessage(message)
                .withFirstTimestamp(timestamp)
                .withLastTimestamp(timestamp)
                .withCount(1)
                .withNewSource()
                .withComponent(REPORTING_COMPONENT)
                .endSource()
                .withReportingComponent(REPORTING_COMPONENT)
                .build();

        try {
            kubernetesClient.v1()
                    .events()
                    .inNamespace(metadata.getNamespace())
                    .resource(event)
                    .create();
        } catch (KubernetesClientException e) {
            log.warn(
                    "Failed to record Event [resource={}/{}, type={}, reason={}]",
                    metadata.getNamespace(),
                    metadata.getName(),
                    type,
                    reason,
                    e
            );
        }
    }
}
