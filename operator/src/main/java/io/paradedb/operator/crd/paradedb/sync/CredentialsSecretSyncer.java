package io.paradedb.operator.crd.paradedb.sync;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.EventRecorder;
import io.paradedb.operator.core.OperatorConfig;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBNames;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.RandomStringUtils;
import org.jspecify.annotations.NullMarked;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;

import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_DATABASE_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_PASSWORD_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_USERNAME_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_TYPE_OPAQUE;
import static io.paradedb.operator.core.KubernetesUtil.getReferencedSecret;

/**
 * Superuser credentials.
 * <p>
 * An external {@code superuserSecretRef} takes precedence and is only verified to exist. Otherwise a Secret
 * with a generated password is created once and never regenerated.
 */
@NullMarked
@ApplicationScoped
public class CredentialsSecretSyncer extends SubResourceSyncer<Secret> {
    public static final String SUPERUSER = "postgres";

    private final OperatorConfig operatorConfig;

    public CredentialsSecretSyncer(
            KubernetesClient kubernetesClient,
            EventRecorder eventRecorder,
            OperatorConfig operatorConfig
    ) {
        super(kubernetesClient, eventRecorder);
        this.operatorConfig = operatorConfig;
    }

    /**
     * Name of the Secret the workload reads its superuser credentials from.
     */
    public static String credentialsSecretName(ParadeDB paradeDB) {
        var externalRef = paradeDB.getSpec().getAuth().getSuperuserSecretRef();

        return externalRef != null
                ? externalRef.getName()
                : ParadeDBNames.credentialsSecret(paradeDB);
    }

    @Override
    public SyncResult sync(ParadeDB paradeDB) {
        var externalRef = paradeDB.getSpec().getAuth().getSuperuserSecretRef();

        if (externalRef != null) {
            getReferencedSecret(
                    kubernetesClient,
                    paradeDB,
                    externalRef,
                    "Superuser"
            );

            return SyncResult.UNCHANGED;
        }

        return super.sync(paradeDB);
    }

    @Override
    public String name(ParadeDB paradeDB) {
        return ParadeDBNames.credentialsSecret(paradeDB);
    }

    @Override
    protected Class<Secret> resourceType() {
        return Secret.class;
    }

    @Override
    protected Secret desired(ParadeDB paradeDB) {
        var data = new LinkedHashMap<String, String>();
        data.put(SECRET_DATA_USERNAME_KEY, encode(SUPERUSER));
        data.put(SECRET_DATA_PASSWORD_KEY, encode(
                RandomStringUtils.secure().nextAlphanumeric(operatorConfig.generatedPasswordLength())
        ));
        data.put(SECRET_DATA_DATABASE_KEY, encode(paradeDB.getSpec().getAuth().getDatabase()));

        return new SecretBuilder()
                .withNewMetadata()
                .withName(name(paradeDB))
                .withNamespace(paradeDB.getMetadata().getNamespace())
                .withLabels(ParadeDBNames.labels(paradeDB))
                .endMetadata()
                .withType(SECRET_TYPE_OPAQUE)
                .withData(data)
                .build();
    }

    @Override
    protected boolean isMutable() {
        return false;
    }

    @Override
    protected boolean isUpToDate(
            Secret actual,
            Secret desired
    ) {
        return true;
    }

    @Override
    protected void applyMutableFields(
            Secret actual,
            Secret desired
    ) {
        // generated credentials are never rotated
    }

    @Override
    protected String createdReason() {
        return EventRecorder.REASON_SECRET_CREATED;
    }

    private static String encode(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
