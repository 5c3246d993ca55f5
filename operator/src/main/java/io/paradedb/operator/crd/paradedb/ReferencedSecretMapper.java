package io.paradedb.operator.crd.paradedb;

import io.fabric8.kubernetes.api.model.Secret;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.paradedb.operator.core.KubernetesUtil;
import io.paradedb.operator.core.SecretRef;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Besides owned Secrets, a change to a Secret that a ParadeDB only references (superuser, user, TLS or backup
 * credentials) also triggers that ParadeDB. The candidates come from the controller's primary cache, so a
 * Secret event never hits the API server.
 */
@NullMarked
public class ReferencedSecretMapper extends OwnerReferenceMapper<Secret> {
    private final Supplier<Stream<ParadeDB>> paradeDBs;

    public ReferencedSecretMapper(Supplier<Stream<ParadeDB>> paradeDBs) {
        this.paradeDBs = paradeDBs;
    }

    @Override
    public Set<ResourceID> toPrimaryResourceIDs(Secret secret) {
        var result = super.toPrimaryResourceIDs(secret);

        var secretNamespace = secret.getMetadata().getNamespace();
        var secretName = secret.getMetadata().getName();

        paradeDBs.get()
                .filter(paradeDB -> references(paradeDB, secretNamespace, secretName))
                .map(ResourceID::fromResource)
                .forEach(result::add);

        return result;
    }

    private static boolean references(
            ParadeDB paradeDB,
            String secretNamespace,
            String secretName
    ) {
        return referencedSecrets(paradeDB).stream()
                .anyMatch(secretRef -> Objects.equals(secretRef.getName(), secretName)
                        && Objects.equals(
                        KubernetesUtil.getNamespaceOrOwn(paradeDB, secretRef.getNamespace()),
                        secretNamespace
                ));
    }

    static List<SecretRef> referencedSecrets(ParadeDB paradeDB) {
        var spec = paradeDB.getSpec();
        var result = new ArrayList<SecretRef>();

        addIfPresent(result, spec.getAuth().getSuperuserSecretRef());
        spec.getAuth().getUsers().forEach(user -> result.add(user.getSecretRef()));

        if (spec.getTls() != null) {
            addIfPresent(result, spec.getTls().getSecretRef());
        }
        if (spec.getBackup() != null && spec.getBackup().getS3() != null) {
            addIfPresent(result, spec.getBackup().getS3().getSecretRef());
        }

        return result;
    }

    private static void addIfPresent(
            List<SecretRef> secretRefs,
            @Nullable SecretRef secretRef
    ) {
        if (secretRef != null) {
            secretRefs.add(secretRef);
        }
    }
}
