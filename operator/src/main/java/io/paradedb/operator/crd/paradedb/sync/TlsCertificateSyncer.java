package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.core.OperatorConfig;
import io.paradedb.operator.core.PreconditionMissingException;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;

import java.util.LinkedHashMap;
import java.util.List;

import static io.paradedb.operator.core.KubernetesUtil.getReferencedSecret;

/**
 * Server certificate of the database.
 * <p>
 * With cert-manager a {@code cert-manager.io/v1} Certificate is synced and cert-manager writes the key pair
 * into {@code <name>-tls}. A user provided secretRef is only verified to exist.
 */
@NullMarked
@ApplicationScoped
public class TlsCertificateSyncer extends SubResourceSyncer<GenericKubernetesResource> {
    public static final String API_VERSION = "cert-manager.io/v1";
    public static final String KIND = "Certificate";

    private static final ResourceDefinitionContext CERTIFICATE_CONTEXT = new ResourceDefinitionContext.Builder()
            .withGroup("cert-manager.io")
            .withVersion("v1")
            .withKind(KIND)
            .withPlural("certificates")
            .withNamespaced(true)
            .build();

    private final OperatorConfig operatorConfig;

    public TlsCertificateSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder,
            OperatorConfig operatorConfig
    ) {
        super(kubernetesClient, eventRecorder);
        this.operatorConfig = operatorConfig;
    }

    /**
     * Name of the Secret holding {@code tls.crt} and {@code tls.key}.
     */
    public static String tlsSecretName(ParadeDB paradeDB) {
        var tls = paradeDB.getSpec().getTls();

        if (tls != null && tls.getSecretRef() != null) {
            return tls.getSecretRef().getName();
        }

        return ParadeDBNames.tlsCertificate(paradeDB);
    }

    @Override
    public SyncResult sync(ParadeDB paradeDB) {
        var tls = paradeDB.getSpec().getTls();

        if (tls == null || !tls.isEnabled()) {
            return SyncResult.UNCHANGED;
        }

        var certManager = tls.getCertManager();

        if (certManager != null && certManager.isEnabled()) {
            return super.sync(paradeDB);
        }

        if (tls.getSecretRef() != null) {
            getReferencedSecret(
                    kubernetesClient,
                    paradeDB,
                    tls.getSecretRef(),
                    "TLS"
            );

            return SyncResult.UNCHANGED;
        }

        throw new PreconditionMissingException(
                "TLS is enabled but neither a secretRef nor certManager is configured [resource=%s/%s]".formatted(
                        paradeDB.getMetadata().getNamespace(),
                        paradeDB.getMetadata().getName()
                )
        );
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.tlsCertificate(paradeDB);
    }

    @Override
    protected Class<GenericKubernetesResource> resourceType() {
        return GenericKubernetesResource.class;
    }

    @Override
    protected String resourceKind() {
        return KIND;
    }

    @Override
    protected NonNamespaceOperation<GenericKubernetesResource, ? extends KubernetesResourceList<GenericKubernetesResource>, Resource<GenericKubernetesResource>> resources(String namespace) {
        return kubernetesClient.genericKubernetesResources(CERTIFICATE_CONTEXT).inNamespace(namespace);
    }

    @Override
    protected GenericKubernetesResource desired(ParadeDB paradeDB) {
        //noinspection ConstantConditions
        var issuerRef = paradeDB.getSpec().getTls().getCertManager().getIssuerRef();

        var name = paradeDB.getMetadata().getName();
        var namespace = paradeDB.getMetadata().getNamespace();

        var issuer = new LinkedHashMap<String, Object>();
        issuer.put("name", issuerRef.getName());
        issuer.put("kind", issuerRef.getKind());
        issuer.put("group", "cert-manager.io");

        var spec = new LinkedHashMap<String, Object>();
        spec.put("secretName", tlsSecretName(paradeDB));
        spec.put("commonName", "%s.%s.svc".formatted(name, namespace));
        spec.put("dnsNames", List.of(
                name,
                "%s.%s".formatted(name, namespace),
                "%s.%s.svc".formatted(name, namespace),
                "%s.%s.%s".formatted(name, namespace, operatorConfig.clusterDomain()),
                "*.%s.%s.%s".formatted(ParadeDBNames.headlessService(paradeDB), namespace, operatorConfig.clusterDomain())
        ));
        spec.put("usages", List.of("server auth", "digital signature", "key encipherment"));
        spec.put("issuerRef", issuer);

        var certificate = new GenericKubernetesResource();
        certificate.setApiVersion(API_VERSION);
        certificate.setKind(KIND);
        certificate.setMetadata(new ObjectMetaBuilder()
                .withName(name(paradeDB))
                .withNamespace(namespace)
                .withLabels(ParadeDBNames.labels(paradeDB))
                .build()
        );
        certificate.setAdditionalProperty("spec", spec);

        DesiredStateHash.stamp(certificate, spec);

        return certificate;
    }

    @Override
    protected boolean isUpToDate(
            GenericKubernetesResource actual,
            GenericKubernetesResource desired
    ) {
        return DesiredStateHash.matches(actual, desired);
    }

    @Override
    protected void applyMutableFields(
            GenericKubernetesResource actual,
            GenericKubernetesResource desired
    ) {
        actual.setAdditionalProperty("spec", desired.getAdditionalProperties().get("spec"));
        DesiredStateHash.copy(desired, actual);
        mergeLabels(actual, desired);
    }

    @Override
    protected String createdReason() {
        return EventRecorder.REASON_CERTIFICATE_CREATED;
    }
}
