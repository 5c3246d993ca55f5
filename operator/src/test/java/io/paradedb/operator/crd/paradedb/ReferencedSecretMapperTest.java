package io.paradedb.operator.crd.paradedb;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.paradedb.operator.core.SecretRef;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@NullMarked
class ReferencedSecretMapperTest {
    @Test
    @DisplayName("A referenced superuser secret maps to every ParadeDB using it")
    void toPrimaryResourceIDs_whenReferenced_shouldReturnReferencingResources() {
        // given
        var first = paradeDB("first");
        first.getSpec().getAuth().setSuperuserSecretRef(secretRef("shared", null));

        var second = paradeDB("second");
        second.getSpec().getAuth().setSuperuserSecretRef(secretRef("shared", "default"));

        var unrelated = paradeDB("unrelated");

        var mapper = new ReferencedSecretMapper(() -> Stream.of(first, second, unrelated));

        // when
        var result = mapper.toPrimaryResourceIDs(secret("shared", "default"));

        // then
        assertThat(result).containsExactlyInAnyOrder(
                new ResourceID("first", "default"),
                new ResourceID("second", "default")
        );
    }

    @Test
    @DisplayName("A secret of the same name in another namespace is not a reference")
    void toPrimaryResourceIDs_whenOtherNamespace_shouldReturnEmpty() {
        // given
        var paradeDB = paradeDB("search");
        paradeDB.getSpec().getAuth().setSuperuserSecretRef(secretRef("shared", null));

        var mapper = new ReferencedSecretMapper(() -> Stream.of(paradeDB));

        // when / then
        assertThat(mapper.toPrimaryResourceIDs(secret("shared", "other"))).isEmpty();
    }

    @Test
    @DisplayName("Backup credentials are treated as a reference too")
    void toPrimaryResourceIDs_whenBackupCredentials_shouldReturnReferencingResource() {
        // given
        var s3 = new BackupSpec.S3();
        s3.setBucket("backups");
        s3.setSecretRef(secretRef("s3-credentials", null));

        var backup = new BackupSpec();
        backup.setEnabled(true);
        backup.setS3(s3);

        var paradeDB = paradeDB("search");
        paradeDB.getSpec().setBackup(backup);

        var mapper = new ReferencedSecretMapper(() -> Stream.of(paradeDB));

        // when
        var result = mapper.toPrimaryResourceIDs(secret("s3-credentials", "default"));

        // then
        assertThat(result).containsExactly(new ResourceID("search", "default"));
    }

    @Test
    @DisplayName("Collects every kind of secret reference from the spec")
    void referencedSecrets_shouldCollectAllReferences() {
        // given
        var user = new AuthSpec.DatabaseUser();
        user.setName("app");
        user.setSecretRef(secretRef("app-credentials", null));

        var tls = new TLSSpec();
        tls.setEnabled(true);
        tls.setSecretRef(secretRef("search-tls", null));

        var paradeDB = paradeDB("search");
        paradeDB.getSpec().getAuth().setSuperuserSecretRef(secretRef("superuser", null));
        paradeDB.getSpec().getAuth().setUsers(new ArrayList<>(List.of(user)));
        paradeDB.getSpec().setTls(tls);

        // when
        var result = ReferencedSecretMapper.referencedSecrets(paradeDB);

        // then
        assertThat(result)
                .extracting(SecretRef::getName)
                .containsExactly("superuser", "app-credentials", "search-tls");
    }

    private static ParadeDB paradeDB(String name) {
        var paradeDB = ParadeDBNamesTest.paradeDB(name);
        paradeDB.setSpec(new ParadeDBSpec());

        return paradeDB;
    }

    private static SecretRef secretRef(
            String name,
            @Nullable String namespace
    ) {
        var secretRef = new SecretRef();
        secretRef.setName(name);
        secretRef.setNamespace(namespace);

        return secretRef;
    }

    private static Secret secret(
            String name,
            String namespace
    ) {
        return new SecretBuilder()
                .withNewMetadata()
                .withName(name)
                .withNamespace(namespace)
                .endMetadata()
                .build();
    }
}
