package io.paradedb.operator.core;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

@NullMarked
public final class KubernetesUtil {
    public static final String SECRET_TYPE_OPAQUE = "Opaque";
    public static final String SECRET_DATA_USERNAME_KEY = "username";
    public static final String SECRET_DATA_PASSWORD_KEY = "password";
    public static final String SECRET_DATA_DATABASE_KEY = "database";

    public static final String SECRET_DATA_S3_ACCESS_KEY_ID_KEY = "accessKeyId";
    public static final String SECRET_DATA_S3_SECRET_ACCESS_KEY_KEY = "secretAccessKey";

    public static String getNamespaceOrOwn(
            HasMetadata resource,
            @Nullable String namespace
    ) {
        if (namespace != null) {
            return namespace;
        }

        return resource.getMetadata().getNamespace();
    }

    /**
     * Fetch a Secret the resource refers to but does not own.
     *
     * @throws PreconditionMissingException if the Secret does not exist
     */
    public static Secret getReferencedSecret(
            KubernetesClient kubernetesClient,
            HasMetadata resource,
            SecretRef secretRef,
            String purpose
    ) {
        var secretNamespace = getNamespaceOrOwn(resource, secretRef.getNamespace());
        var secretName = secretRef.getName();

        var secret = kubernetesClient.secrets()
                .inNamespace(secretNamespace)
                .withName(secretName)
                .get();

        //noinspection ConstantConditions
        if (secret == null) {
            throw new PreconditionMissingException("%s SecretRef not found [resource=%s/%s, secret=%s/%s]".formatted(
                    purpose,
                    resource.getMetadata().getNamespace(),
                    resource.getMetadata().getName(),
                    secretNamespace,
                    secretName
            ));
        }

        return secret;
    }

    private KubernetesUtil() {
    }
}
