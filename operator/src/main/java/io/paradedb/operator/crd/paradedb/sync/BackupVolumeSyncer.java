package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.crd.paradedb.BackupSpec;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;

import java.util.Map;

/**
 * Volume that receives the dumps when backups are kept in-cluster. Created once, the claim is not resized.
 */
@NullMarked
@ApplicationScoped
public class BackupVolumeSyncer extends SubResourceSyncer<PersistentVolumeClaim> {
    public BackupVolumeSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder
    ) {
        super(kubernetesClient, eventRecorder);
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.backup(paradeDB);
    }

    @Override
    protected Class<PersistentVolumeClaim> resourceType() {
        return PersistentVolumeClaim.class;
    }

    @Override
    protected PersistentVolumeClaim desired(ParadeDB paradeDB) {
        //noinspection ConstantConditions
        var pvc = paradeDB.getSpec().getBackup().getPvc();
        if (pvc == null) {
            pvc = new BackupSpec.Pvc();
        }

        return new PersistentVolumeClaimBuilder()
                .withNewMetadata()
                .withName(name(paradeDB))
                .withNamespace(paradeDB.getMetadata().getNamespace())
                .withLabels(ParadeDBNames.labels(paradeDB, ParadeDBNames.COMPONENT_BACKUP))
                .endMetadata()
                .withNewSpec()
                .withAccessModes("ReadWriteOnce")
                .withNewResources()
                .withRequests(Map.of("storage", pvc.getSize()))
                .endResources()
                .withStorageClassName(pvc.getStorageClassName())
                .endSpec()
                .build();
    }

    @Override
    protected boolean isMutable() {
        return false;
    }

    @Override
    protected boolean isUpToDate(
            PersistentVolumeClaim actual,
            PersistentVolumeClaim desired
    ) {
        return true;
    }

    @Override
    protected void applyMutableFields(
            PersistentVolumeClaim actual,
            PersistentVolumeClaim desired
    ) {
        // claims are never resized by the operator
    }
}
