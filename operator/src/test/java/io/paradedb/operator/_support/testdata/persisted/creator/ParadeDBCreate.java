package io.paradedb.operator._support.testdata.persisted.creator;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator._support.testdata.base.TestDataCreator;
import io.paradedb.operator.core.CRPhase;
import io.paradedb.operator.core.SecretRef;
import io.paradedb.operator.crd.paradedb.AuthSpec;
import io.paradedb.operator.crd.paradedb.BackupSpec;
import io.paradedb.operator.crd.paradedb.ConnectionPoolingSpec;
import io.paradedb.operator.crd.paradedb.MonitoringSpec;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBReconciler;
import io.paradedb.operator.crd.paradedb.ParadeDBSpec;
import io.paradedb.operator.crd.paradedb.ParadeDBStatus;
import io.paradedb.operator.crd.paradedb.TLSSpec;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@NullMarked
public class ParadeDBCreate extends TestDataCreator<ParadeDB> {
    private final KubernetesClient kubernetesClient;

    @Nullable
    private String withNamespace;

    @Nullable
    private String withName;

    @Nullable
    private Integer withReplicas;

    @Nullable
    private String withImage;

    @Nullable
    private String withServiceType;

    @Nullable
    private SecretRef withSuperuserSecretRef;

    private final List<AuthSpec.DatabaseUser> withUsers = new ArrayList<>();

    private boolean withConnectionPooling = false;

    private boolean withoutMonitoring = false;

    @Nullable
    private Map<String, String> withServiceMonitorLabels;

    private boolean withVolumeBackup = false;

    @Nullable
    private SecretRef withS3Backup;

    @Nullable
    private SecretRef withTlsSecretRef;

    @Nullable
    private String withCertManagerIssuer;

    private boolean withoutFinalizer = false;

    @Nullable
    private CRPhase withPhase;

    public ParadeDBCreate(
            int numberOfItems,
            KubernetesClient kubernetesClient
    ) {
        super(numberOfItems);
        this.kubernetesClient = kubernetesClient;
    }

    public ParadeDBCreate withNamespace(String namespace) {
        withNamespace = namespace;
        return this;
    }

    public ParadeDBCreate withName(String name) {
        withName = name;
        return this;
    }

    public ParadeDBCreate withReplicas(int replicas) {
        withReplicas = replicas;
        return this;
    }

    @SuppressWarnings("unused")
    public ParadeDBCreate withImage(String image) {
        withImage = image;
        return this;
    }

    public ParadeDBCreate withServiceType(String serviceType) {
        withServiceType = serviceType;
        return this;
    }

    public ParadeDBCreate withSuperuserSecretRef(SecretRef secretRef) {
        withSuperuserSecretRef = secretRef;
        return this;
    }

    public ParadeDBCreate withUser(
            String name,
            SecretRef secretRef,
            List<String> databases,
            List<String> privileges
    ) {
        var user = new AuthSpec.DatabaseUser();
        user.setName(name);
        user.setSecretRef(secretRef);
        user.setDatabases(new ArrayList<>(databases));
        user.setPrivileges(new ArrayList<>(privileges));

        withUsers.add(user);
        return this;
    }

    public ParadeDBCreate withConnectionPooling() {
        withConnectionPooling = true;
        return this;
    }

    public ParadeDBCreate withoutMonitoring() {
        withoutMonitoring = true;
        return this;
    }

    public ParadeDBCreate withServiceMonitor(Map<String, String> labels) {
        withServiceMonitorLabels = labels;
        return this;
    }

    public ParadeDBCreate withVolumeBackup() {
        withVolumeBackup = true;
        return this;
    }

    public ParadeDBCreate withS3Backup(SecretRef credentials) {
        withS3Backup = credentials;
        return this;
    }

    public ParadeDBCreate withTlsSecretRef(SecretRef secretRef) {
        withTlsSecretRef = secretRef;
        return this;
    }

    public ParadeDBCreate withCertManager(String clusterIssuer) {
        withCertManagerIssuer = clusterIssuer;
        return this;
    }

    public ParadeDBCreate withoutFinalizer() {
        withoutFinalizer = true;
        return this;
    }

    /**
     * Persist a status with the given phase right after creation.
     */
    public ParadeDBCreate withPhase(CRPhase phase) {
        withPhase = phase;
        return this;
    }

    @Override
    protected ParadeDB create(int index) {
        var namespace = getNamespace();

        var spec = new ParadeDBSpec();

        if (withReplicas != null) {
            spec.setReplicas(withReplicas);
        }
        if (withImage != null) {
            spec.setImage(withImage);
        }
        if (withServiceType != null) {
            spec.setServiceType(withServiceType);
        }

        spec.getAuth().setDatabase(FAKER.regexify("[a-z]{10}"));
        spec.getAuth().setSuperuserSecretRef(withSuperuserSecretRef);
        spec.getAuth().setUsers(new ArrayList<>(withUsers));

        if (withConnectionPooling) {
            var pooling = new ConnectionPoolingSpec();
            pooling.setEnabled(true);
            spec.setConnectionPooling(pooling);
        }

        if (withoutMonitoring || withServiceMonitorLabels != null) {
            var monitoring = new MonitoringSpec();
            monitoring.setEnabled(!withoutMonitoring);

            if (withServiceMonitorLabels != null) {
                var serviceMonitor = new MonitoringSpec.ServiceMonitor();
                serviceMonitor.setEnabled(true);
                serviceMonitor.setLabels(withServiceMonitorLabels);
                monitoring.setServiceMonitor(serviceMonitor);
            }

            spec.setMonitoring(monitoring);
        }

        if (withVolumeBackup || withS3Backup != null) {
            var backup = new BackupSpec();
            backup.setEnabled(true);

            if (withS3Backup != null) {
                var s3 = new BackupSpec.S3();
                s3.setBucket(FAKER.regexify("[a-z]{12}"));
                s3.setRegion("eu-central-1");
                s3.setPath("paradedb/");
                s3.setSecretRef(withS3Backup);
                backup.setS3(s3);
            } else {
                backup.setPvc(new BackupSpec.Pvc());
            }

            spec.setBackup(backup);
        }

        if (withTlsSecretRef != null || withCertManagerIssuer != null) {
            var tls = new TLSSpec();
            tls.setEnabled(true);
            tls.setSecretRef(withTlsSecretRef);

            if (withCertManagerIssuer != null) {
                var certManager = new TLSSpec.CertManager();
                certManager.setEnabled(true);
                certManager.getIssuerRef().setName(withCertManagerIssuer);
                tls.setCertManager(certManager);
            }

            spec.setTls(tls);
        }

        var paradeDB = new ParadeDB();
        paradeDB.getMetadata().setNamespace(namespace);
        paradeDB.getMetadata().setName(getName(index));
        paradeDB.setSpec(spec);

        if (!withoutFinalizer) {
            paradeDB.addFinalizer(ParadeDBReconciler.FINALIZER);
        }

        var created = kubernetesClient.resources(ParadeDB.class)
                .inNamespace(namespace)
                .resource(paradeDB)
                .create();

        if (withPhase != null) {
            var status = new ParadeDBStatus();
            status.setPhase(withPhase);
            created.setStatus(status);

            created = kubernetesClient.resource(created).updateStatus();
        }

        return created;
    }

    private String getNamespace() {
        if (withNamespace != null) {
            return withNamespace;
        }

        return kubernetesClient.getNamespace();
    }

    private String getName(int index) {
        if (withName != null) {
            return numberOfItems == 1 ? withName : withName + "-" + index;
        }

        return randomKubernetesNameSuffix("test-pdb");
    }
}
