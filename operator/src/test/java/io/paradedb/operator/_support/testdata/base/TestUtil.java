package io.paradedb.operator._support.testdata.base;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetStatusBuilder;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@NullMarked
public class TestUtil {
    private static final String CRD_NAME = "paradedbs.database.paradedb.io";

    /**
     * Register the ParadeDB CRD with the mock API server so that the status subresource is served.
     */
    public static void registerCustomResourceDefinition(KubernetesClient kubernetesClient) {
        var existing = kubernetesClient.apiextensions().v1()
                .customResourceDefinitions()
                .withName(CRD_NAME)
                .get();

        //noinspection ConstantConditions
        if (existing != null) {
            return;
        }

        var crd = new CustomResourceDefinitionBuilder()
                .withNewMetadata()
                .withName(CRD_NAME)
                .endMetadata()
                .withNewSpec()
                .withGroup(HasMetadata.getGroup(ParadeDB.class))
                .withScope("Namespaced")
                .withNewNames()
                .withKind(HasMetadata.getKind(ParadeDB.class))
                .withPlural(HasMetadata.getPlural(ParadeDB.class))
                .withSingular(HasMetadata.getSingular(ParadeDB.class))
                .withShortNames("pdb")
                .endNames()
                .addNewVersion()
                .withName(HasMetadata.getVersion(ParadeDB.class))
                .withServed(true)
                .withStorage(true)
                .withNewSubresources()
                .withNewStatus()
                .endStatus()
                .endSubresources()
                .endVersion()
                .endSpec()
                .build();

        kubernetesClient.apiextensions().v1()
                .customResourceDefinitions()
                .resource(crd)
                .create();
    }

    public static void resetEnvironment(KubernetesClient kubernetesClient) {
        for (var paradeDB : kubernetesClient.resources(ParadeDB.class).inAnyNamespace().list().getItems()) {
            // no operator is running in tests, nobody else would remove the finalizer
            if (!paradeDB.getFinalizers().isEmpty()) {
                paradeDB.getMetadata().setFinalizers(new ArrayList<>());
                kubernetesClient.resource(paradeDB).update();
            }
        }

        List<Class<? extends HasMetadata>> resourceTypes = List.of(
                ParadeDB.class,
                StatefulSet.class,
                Deployment.class,
                CronJob.class,
                Service.class,
                ConfigMap.class,
                Secret.class,
                PersistentVolumeClaim.class,
                Event.class
        );

        for (var resourceType : resourceTypes) {
            deleteResource(kubernetesClient, resourceType);
        }
    }

    public static void deleteResource(
            KubernetesClient kubernetesClient,
            Class<? extends HasMetadata> resourceClass
    ) {
        for (var item : kubernetesClient.resources(resourceClass).inAnyNamespace().list().getItems()) {
            kubernetesClient.resource(item).delete();
        }
    }

    /**
     * Persist the status the way the operator runtime does after {@code reconcile} returned, then re-read
     * the resource.
     */
    public static ParadeDB applyUpdateControl(
            KubernetesClient kubernetesClient,
            ParadeDB paradeDB,
            UpdateControl<ParadeDB> updateControl
    ) {
        if (updateControl.isPatchStatus()) {
            var resource = updateControl.getResource().orElseThrow();

            // replace the whole status, a merge patch on the mock server appends to the conditions list
            var current = fetch(kubernetesClient, paradeDB);
            current.setStatus(resource.getStatus());

            kubernetesClient.resource(current).updateStatus();
        }

        return fetch(kubernetesClient, paradeDB);
    }

    public static ParadeDB fetch(
            KubernetesClient kubernetesClient,
            ParadeDB paradeDB
    ) {
        return Objects.requireNonNull(kubernetesClient.resources(ParadeDB.class)
                .inNamespace(paradeDB.getMetadata().getNamespace())
                .withName(paradeDB.getMetadata().getName())
                .get());
    }

    /**
     * Stand in for the StatefulSet controller, which does not exist on the mock API server.
     */
    public static void markReplicasReady(
            KubernetesClient kubernetesClient,
            ParadeDB paradeDB,
            int readyReplicas
    ) {
        kubernetesClient.resources(StatefulSet.class)
                .inNamespace(paradeDB.getMetadata().getNamespace())
                .withName(ParadeDBNames.workload(paradeDB))
                .edit(statefulSet -> {
                    statefulSet.setStatus(new StatefulSetStatusBuilder()
                            .withReplicas(readyReplicas)
                            .withReadyReplicas(readyReplicas)
                            .build()
                    );
                    return statefulSet;
                });
    }

    public static List<Event> events(
            KubernetesClient kubernetesClient,
            ParadeDB paradeDB
    ) {
        return kubernetesClient.v1()
                .events()
                .inNamespace(paradeDB.getMetadata().getNamespace())
                .list()
                .getItems()
                .stream()
                .filter(event -> Objects.equals(event.getInvolvedObject().getName(), paradeDB.getMetadata().getName()))
                .toList();
    }

    private TestUtil() {
    }
}
