package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Get-or-create-or-update of one object owned by a {@link ParadeDB}.
 * <p>
 * The object is looked up by its deterministic name. A missing object is created from {@link #desired(ParadeDB)}
 * with a controller owner reference. An existing object is only written when {@link #isUpToDate} reports drift,
 * and then only its mutable fields are overwritten, so server-assigned fields survive.
 *
 * @param <R> the Kubernetes kind
 */
@NullMarked
@Slf4j
public abstract class SubResourceSyncer<R extends HasMetadata> {
    protected final KubernetesClient kubernetesClient;
    protected final EventRecorder eventRecorder;

    /**
     * Only used by the CDI client proxy.
     */
    @SuppressWarnings("NullAway")
    protected SubResourceSyncer() {
        this.kubernetesClient = null;
        this.eventRecorder = null;
    }

    protected SubResourceSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        this.kubernetesClient = kubernetesClient;
        this.eventRecorder = eventRecorder;
    }

    public abstract String name(ParadeDB paradeDB);

    protected abstract Class<R> resourceType();

    protected abstract R desired(ParadeDB paradeDB);

    protected abstract boolean isUpToDate(
            R actual,
            R desired
    );

    protected abstract void applyMutableFields(
            R actual,
            R desired
    );

    /**
     * Objects that are created once and never updated afterward return {@code false}.
     */
    protected boolean isMutable() {
        return true;
    }

    /**
     * Reason of the Normal event emitted on creation, {@code null} for no event.
     */
    @Nullable
    protected String createdReason() {
        return null;
    }

    protected String createdMessage(ParadeDB paradeDB) {
        return "Created %s %s".formatted(resourceKind(), name(paradeDB));
    }

    protected NonNamespaceOperation<R, ? extends KubernetesResourceList<R>, Resource<R>> resources(String namespace) {
        return kubernetesClient.resources(resourceType()).inNamespace(namespace);
    }

    protected String resourceKind() {
        return resourceType().getSimpleName();
    }

    @Nullable
    public R get(ParadeDB paradeDB) {
        return resources(paradeDB.getMetadata().getNamespace())
                .withName(name(paradeDB))
                .get();
    }

    public SyncResult sync(ParadeDB paradeDB) {
        var namespace = paradeDB.getMetadata().getNamespace();
        var name = name(paradeDB);

        var actual = get(paradeDB);

        //noinspection ConstantConditions
        if (actual == null) {
            var desired = desired(paradeDB);
            setOwner(desired, paradeDB);

            log.info(
                    "Creating {} [resource={}/{}, name={}]",
                    resourceKind(),
                    namespace,
                    paradeDB.getMetadata().getName(),
                    name
            );

            resources(namespace).resource(desired).create();

            var reason = createdReason();
            if (reason != null) {
                eventRecorder.normal(paradeDB, reason, createdMessage(paradeDB));
            }

            return SyncResult.CREATED;
        }

        if (!isMutable()) {
            return SyncResult.UNCHANGED;
        }

        var desired = desired(paradeDB);

        if (isUpToDate(actual, desired)) {
            return SyncResult.UNCHANGED;
        }

        log.info(
                "Updating {} [resource={}/{}, name={}]",
                resourceKind(),
                namespace,
                paradeDB.getMetadata().getName(),
                name
        );

        applyMutableFields(actual, desired);

        resources(namespace).resource(actual).update();

        return SyncResult.UPDATED;
    }

    public static OwnerReference ownerReference(ParadeDB paradeDB) {
        return new OwnerReferenceBuilder()
                .withApiVersion(paradeDB.getApiVersion())
                .withKind(paradeDB.getKind())
                .withName(paradeDB.getMetadata().getName())
                .withUid(paradeDB.getMetadata().getUid())
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build();
    }

    /**
     * Whether the live object carries every label of the desired one.
     */
    protected static boolean hasLabels(
            HasMetadata actual,
            HasMetadata desired
    ) {
        var actualLabels = actual.getMetadata().getLabels();
        var desiredLabels = desired.getMetadata().getLabels();

        if (desiredLabels == null || desiredLabels.isEmpty()) {
            return true;
        }

        return actualLabels != null && actualLabels.entrySet().containsAll(desiredLabels.entrySet());
    }

    protected static void mergeLabels(
            HasMetadata actual,
            HasMetadata desired
    ) {
        var desiredLabels = desired.getMetadata().getLabels();

        if (desiredLabels == null) {
            return;
        }

        var labels = new LinkedHashMap<String, String>();
        if (actual.getMetadata().getLabels() != null) {
            labels.putAll(actual.getMetadata().getLabels());
        }
        labels.putAll(desiredLabels);

        actual.getMetadata().setLabels(labels);
    }

    private static void setOwner(
            HasMetadata resource,
            ParadeDB paradeDB
    ) {
        resource.getMetadata().setOwnerReferences(new ArrayList<>(List.of(ownerReference(paradeDB))));
    }
}
