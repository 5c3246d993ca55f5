package io.paradedb.operator.crd.paradedb;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.javaoperatorsdk.operator.api.config.informer.InformerEventSourceConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceContext;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.processing.event.source.EventSource;
import io.javaoperatorsdk.operator.processing.event.source.SecondaryToPrimaryMapper;
import io.javaoperatorsdk.operator.processing.event.source.informer.InformerEventSource;
import io.paradedb.operator.core.BaseReconciler;
import io.paradedb.operator.core.CRPhase;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.core.OperatorConfig;
import io.paradedb.operator.crd.paradedb.status.StatusAggregator;
import io.paradedb.operator.crd.paradedb.sync.BackupCronJobSyncer;
import io.paradedb.operator.crd.paradedb.sync.BackupSyncer;
import io.paradedb.operator.crd.paradedb.sync.ConfigMapSyncer;
import io.paradedb.operator.crd.paradedb.sync.CredentialsSecretSyncer;
import io.paradedb.operator.crd.paradedb.sync.HeadlessServiceSyncer;
import io.paradedb.operator.crd.paradedb.sync.MetricsServiceSyncer;
import io.paradedb.operator.crd.paradedb.sync.MonitoringSyncer;
import io.paradedb.operator.crd.paradedb.sync.PoolerDeploymentSyncer;
import io.paradedb.operator.crd.paradedb.sync.PoolerSyncer;
import io.paradedb.operator.crd.paradedb.sync.PrimaryServiceSyncer;
import io.paradedb.operator.crd.paradedb.sync.StatefulSetSyncer;
import io.paradedb.operator.crd.paradedb.sync.SubResourceSyncer;
import io.paradedb.operator.crd.paradedb.sync.TlsCertificateSyncer;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Converges the objects backing a {@link ParadeDB} towards its spec and reports the observed state.
 * <p>
 * Each pass re-reads the resource, runs the sub-resource syncers in dependency order and stops at the first
 * failure. Owned objects are never deleted on this path.
 */
@NullMarked
@Slf4j
@ControllerConfiguration(
        name = "paradedb",
        finalizerName = ParadeDBReconciler.FINALIZER
)
public class ParadeDBReconciler
        extends BaseReconciler<ParadeDB, ParadeDBStatus>
        implements Reconciler<ParadeDB>, Cleaner<ParadeDB> {
    public static final String FINALIZER = "database.paradedb.io/finalizer";

    private final EventRecorder eventRecorder;
    private final OperatorConfig operatorConfig;
    private final KubernetesClient kubernetesClient;
    private final StatusAggregator statusAggregator;
    private final ParadeDBFinalizer paradeDBFinalizer;

    private final PoolerDeploymentSyncer poolerDeploymentSyncer;
    private final MetricsServiceSyncer metricsServiceSyncer;
    private final BackupCronJobSyncer backupCronJobSyncer;

    private final List<SyncStep> syncSteps;

    public ParadeDBReconciler(
            EventRecorder eventRecorder,
            OperatorConfig operatorConfig,
            KubernetesClient kubernetesClient,
            StatusAggregator statusAggregator,
            ParadeDBFinalizer paradeDBFinalizer,
            CredentialsSecretSyncer credentialsSecretSyncer,
            ConfigMapSyncer configMapSyncer,
            TlsCertificateSyncer tlsCertificateSyncer,
            StatefulSetSyncer statefulSetSyncer,
            PrimaryServiceSyncer primaryServiceSyncer,
            HeadlessServiceSyncer headlessServiceSyncer,
            PoolerSyncer poolerSyncer,
            MonitoringSyncer monitoringSyncer,
            BackupSyncer backupSyncer,
            PoolerDeploymentSyncer poolerDeploymentSyncer,
            MetricsServiceSyncer metricsServiceSyncer,
            BackupCronJobSyncer backupCronJobSyncer
    ) {
        this.eventRecorder = eventRecorder;
        this.operatorConfig = operatorConfig;

        this.kubernetesClient = kubernetesClient;
        this.statusAggregator = statusAggregator;
        this.paradeDBFinalizer = paradeDBFinalizer;
        this.poolerDeploymentSyncer = poolerDeploymentSyncer;
        this.metricsServiceSyncer = metricsServiceSyncer;
        this.backupCronJobSyncer = backupCronJobSyncer;

        this.syncSteps = List.of(
                new SyncStep("Credentials secret", spec -> true, credentialsSecretSyncer::sync),
                new SyncStep("ConfigMap", spec -> true, configMapSyncer::sync),
                new SyncStep("TLS certificate", ParadeDBSpec::isTlsEnabled, tlsCertificateSyncer::sync),
                new SyncStep("StatefulSet", spec -> true, statefulSetSyncer::sync),
                new SyncStep("Primary service", spec -> true, primaryServiceSyncer::sync),
                new SyncStep("Headless service", spec -> true, headlessServiceSyncer::sync),
                new SyncStep("Connection pooler", ParadeDBSpec::isConnectionPoolingEnabled, poolerSyncer::sync),
                new SyncStep("Monitoring", ParadeDBSpec::isMonitoringEnabled, monitoringSyncer::sync),
                new SyncStep("Backup", ParadeDBSpec::isBackupEnabled, backupSyncer::sync)
        );
    }

    @Override
    public UpdateControl<ParadeDB> reconcile(
            ParadeDB resource,
            Context<ParadeDB> context
    ) {
        var name = resource.getMetadata().getName();
        var namespace = resource.getMetadata().getNamespace();

        var current = kubernetesClient.resources(ParadeDB.class)
                .inNamespace(namespace)
                .withName(name)
                .get();

        //noinspection ConstantConditions
        if (current == null) {
            log.info(
                    "ParadeDB no longer exists, skipping [resource={}/{}]",
                    namespace,
                    name
            );

            return UpdateControl.noUpdate();
        }

        if (!current.hasFinalizer(FINALIZER)) {
            log.info(
                    "Adding finalizer to ParadeDB [resource={}/{}, finalizer={}]",
                    namespace,
                    name,
                    FINALIZER
            );

            kubernetesClient.resources(ParadeDB.class)
                    .inNamespace(namespace)
                    .withName(name)
                    .edit(paradeDB -> {
                        paradeDB.addFinalizer(FINALIZER);
                        return paradeDB;
                    });

            return UpdateControl.<ParadeDB>noUpdate()
                    .rescheduleAfter(Duration.ZERO);
        }

        //noinspection ConstantConditions
        if (current.getStatus() == null || current.getStatus().getPhase() == null) {
            var status = initializeStatus(current);

            log.info(
                    "Initializing ParadeDB status [resource={}/{}]",
                    namespace,
                    name
            );

            status.setPhase(CRPhase.PENDING)
                    .setMessage("Waiting for reconciliation");

            return UpdateControl.patchStatus(current)
                    .rescheduleAfter(Duration.ZERO);
        }

        var status = current.getStatus();

        log.info(
                "Reconciling ParadeDB [resource={}/{}, status.phase={}]",
                namespace,
                name,
                status.getPhase()
        );

        if (status.getPhase() == CRPhase.PENDING) {
            status.setPhase(CRPhase.CREATING)
                    .setMessage("Creating ParadeDB resources");

            try {
                var patched = kubernetesClient.resource(current).patchStatus();
                current.getMetadata().setResourceVersion(patched.getMetadata().getResourceVersion());
            } catch (KubernetesClientException e) {
                return handleError(current, status, "Status update", e);
            }

            eventRecorder.normal(
                    current,
                    EventRecorder.REASON_CREATING,
                    "Creating ParadeDB resources"
            );
        }

        var statusBefore = snapshot(status);

        for (var step : syncSteps) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn(
                        "Reconciliation interrupted [resource={}/{}, step={}]",
                        namespace,
                        name,
                        step.description()
                );

                return UpdateControl.<ParadeDB>noUpdate()
                        .rescheduleAfter(operatorConfig.requeue().error());
            }

            if (!step.enabled().test(current.getSpec())) {
                continue;
            }

            try {
                step.action().accept(current);
            } catch (Exception e) {
                return handleError(current, status, step.description(), e);
            }
        }

        try {
            statusAggregator.aggregate(current, status);
        } catch (Exception e) {
            return handleError(current, status, "Status aggregation", e);
        }

        warnAboutDisabledLeftovers(current);

        if (statusBefore.equals(snapshot(status))) {
            log.info(
                    "ParadeDB up-to-date [resource={}/{}, status.phase={}]",
                    namespace,
                    name,
                    status.getPhase()
            );

            return UpdateControl.<ParadeDB>noUpdate()
                    .rescheduleAfter(operatorConfig.requeue().success());
        }

        log.info(
                "ParadeDB reconciled [resource={}/{}, status.phase={}, status.readyReplicas={}]",
                namespace,
                name,
                status.getPhase(),
                status.getReadyReplicas()
        );

        return UpdateControl.patchStatus(current)
                .rescheduleAfter(operatorConfig.requeue().success());
    }

    @Override
    public DeleteControl cleanup(
            ParadeDB resource,
            Context<ParadeDB> context
    ) {
        var status = initializeStatus(resource);

        var name = resource.getMetadata().getName();
        var namespace = resource.getMetadata().getNamespace();

        log.info(
                "Deleting ParadeDB [resource={}/{}, status.phase={}]",
                namespace,
                name,
                status.getPhase()
        );

        if (status.getPhase() != CRPhase.DELETING) {
            status.setPhase(CRPhase.DELETING)
                    .setMessage("ParadeDB deletion in progress");

            try {
                kubernetesClient.resource(resource).patchStatus();
            } catch (KubernetesClientException e) {
                log.error(
                        "Failed to record deletion of ParadeDB [resource={}/{}]",
                        namespace,
                        name,
                        e
                );

                return DeleteControl.noFinalizerRemoval()
                        .rescheduleAfter(operatorConfig.requeue().error().toMillis());
            }
        }

        if (!paradeDBFinalizer.release(resource)) {
            return DeleteControl.noFinalizerRemoval()
                    .rescheduleAfter(operatorConfig.requeue().error().toMillis());
        }

        return DeleteControl.defaultDelete();
    }

    @Override
    public List<EventSource<?, ParadeDB>> prepareEventSources(EventSourceContext<ParadeDB> context) {
        return List.of(
                informer(context, StatefulSet.class, new OwnerReferenceMapper<>()),
                informer(context, Service.class, new OwnerReferenceMapper<>()),
                informer(context, Secret.class, new ReferencedSecretMapper(() -> context.getPrimaryCache().list())),
                informer(context, ConfigMap.class, new OwnerReferenceMapper<>()),
                informer(context, Deployment.class, new OwnerReferenceMapper<>()),
                informer(context, CronJob.class, new OwnerReferenceMapper<>()),
                informer(context, PersistentVolumeClaim.class, new OwnerReferenceMapper<>())
        );
    }

    @Override
    protected ParadeDBStatus newStatus() {
        return new ParadeDBStatus();
    }

    @Override
    protected EventRecorder eventRecorder() {
        return eventRecorder;
    }

    @Override
    protected OperatorConfig operatorConfig() {
        return operatorConfig;
    }

    private String snapshot(@Nullable ParadeDBStatus status) {
        return kubernetesClient.getKubernetesSerialization().asJson(status);
    }

    /**
     * Objects of a feature that has since been switched off are kept until the ParadeDB itself is deleted.
     */
    private void warnAboutDisabledLeftovers(ParadeDB paradeDB) {
        var spec = paradeDB.getSpec();
        var leftovers = new ArrayList<String>();

        collectLeftover(leftovers, !spec.isConnectionPoolingEnabled(), poolerDeploymentSyncer, paradeDB);
        collectLeftover(leftovers, !spec.isMonitoringEnabled(), metricsServiceSyncer, paradeDB);
        collectLeftover(leftovers, !spec.isBackupEnabled(), backupCronJobSyncer, paradeDB);

        if (!leftovers.isEmpty()) {
            log.warn(
                    "Objects of disabled features are retained, delete them manually if no longer needed [resource={}/{}, objects={}]",
                    paradeDB.getMetadata().getNamespace(),
                    paradeDB.getMetadata().getName(),
                    leftovers
            );
        }
    }

    private static void collectLeftover(
            List<String> leftovers,
            boolean disabled,
            SubResourceSyncer<? extends HasMetadata> syncer,
            ParadeDB paradeDB
    ) {
        if (disabled && syncer.get(paradeDB) != null) {
            leftovers.add(syncer.name(paradeDB));
        }
    }

    private static <R extends HasMetadata> InformerEventSource<R, ParadeDB> informer(
            EventSourceContext<ParadeDB> context,
            Class<R> resourceType,
            SecondaryToPrimaryMapper<R> mapper
    ) {
        var configuration = InformerEventSourceConfiguration.from(resourceType, ParadeDB.class)
                .withSecondaryToPrimaryMapper(mapper)
                .withNamespacesInheritedFromController()
                .build();

        return new InformerEventSource<>(configuration, context);
    }

    private record SyncStep(
            String description,
            Predicate<ParadeDBSpec> enabled,
            Consumer<ParadeDB> action
    ) {
    }
}
