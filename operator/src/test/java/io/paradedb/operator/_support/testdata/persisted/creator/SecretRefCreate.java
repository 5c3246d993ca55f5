package io.paradedb.operator._support.testdata.persisted.creator;

import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator._support.testdata.base.TestDataCreator;
import io.paradedb.operator.core.SecretRef;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_PASSWORD_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_S3_ACCESS_KEY_ID_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_S3_SECRET_ACCESS_KEY_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_DATA_USERNAME_KEY;
import static io.paradedb.operator.core.KubernetesUtil.SECRET_TYPE_OPAQUE;

@NullMarked
public class SecretRefCreate extends TestDataCreator<SecretRef> {
    private final KubernetesClient kubernetesClient;

    @Nullable
    private String withNamespace;
    private boolean withoutNamespace = false;

    @Nullable
    private String withName;

    private boolean withS3Keys = false;

    public SecretRefCreate(
            int numberOfItems,
            KubernetesClient kubernetesClient
    ) {
        super(numberOfItems);
        this.kubernetesClient = kubernetesClient;
    }

    @SuppressWarnings("unused")
    public SecretRefCreate withNamespace(String namespace) {
        withNamespace = namespace;
        return this;
    }

    /**
     * Leave {@link SecretRef#getNamespace()} empty so that it resolves to the referencing resource's namespace.
     */
    @SuppressWarnings("unused")
    public SecretRefCreate withoutNamespace() {
        withoutNamespace = true;
        return this;
    }

    @SuppressWarnings("unused")
    public SecretRefCreate withName(String name) {
        withName = name;
        return this;
    }

    @SuppressWarnings("unused")
    public SecretRefCreate withS3Keys() {
        withS3Keys = true;
        return this;
    }

    @Override
    protected SecretRef create(int index) {
        var namespace = getNamespace();
        var name = getName();

        Map<String, String> data = new LinkedHashMap<>();
        if (withS3Keys) {
            data.put(SECRET_DATA_S3_ACCESS_KEY_ID_KEY, FAKER.regexify("[A-Z0-9]{20}"));
            data.put(SECRET_DATA_S3_SECRET_ACCESS_KEY_KEY, FAKER.regexify("[a-zA-Z0-9]{40}"));
        } else {
            data.put(SECRET_DATA_USERNAME_KEY, FAKER.credentials().username());
            data.put(SECRET_DATA_PASSWORD_KEY, FAKER.credentials().password());
        }

        var secret = new SecretBuilder()
                .withNewMetadata()
                .withNamespace(namespace)
                .withName(name)
                .endMetadata()
                .withType(SECRET_TYPE_OPAQUE)
                .withStringData(data)
                .build();

        kubernetesClient.secrets()
                .inNamespace(namespace)
                .resource(secret)
                .create();

        var secretRef = new SecretRef();
        secretRef.setName(name);
        secretRef.setNamespace(withoutNamespace ? null : namespace);

        return secretRef;
    }

    private String getNamespace() {
        if (withNamespace != null) {
            return withNamespace;
        }

        return kubernetesClient.getNamespace();
    }

    private String getName() {
        if (withName != null) {
            return withName;
        }

        return randomKubernetesNameSuffix("test-secret");
    }
}
