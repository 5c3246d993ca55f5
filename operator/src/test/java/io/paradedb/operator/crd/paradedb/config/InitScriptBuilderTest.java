package io.paradedb.operator.crd.paradedb.config;

import io.paradedb.operator.core.ParadeDBException;
import io.paradedb.operator.core.SecretRef;
import io.paradedb.operator.crd.paradedb.AuthSpec;
import io.paradedb.operator.crd.paradedb.ParadeDBSpec;
import org.jspecify.annotations.NullMarked;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@NullMarked
class InitScriptBuilderTest {
    @Test
    @DisplayName("Default extensions are search and analytics")
    void withDefaults_shouldCreateDefaultExtensions() {
        // given
        var spec = new ParadeDBSpec();

        // when
        var script = InitScriptBuilder.build(spec);

        // then
        assertThat(script)
                .contains("create extension if not exists \"pg_search\";")
                .contains("create extension if not exists \"pg_analytics\";")
                .doesNotContain("\"vector\"")
                .doesNotContain("create role");
    }

    @Test
    @DisplayName("Additional extensions are deduplicated and trimmed")
    void withAdditionalExtensions_shouldDeduplicate() {
        // given
        var spec = new ParadeDBSpec();
        spec.getExtensions().setPgVector(true);
        spec.getExtensions().setAdditional(new ArrayList<>(List.of("vector", " postgis ", "")));

        // when
        var extensions = InitScriptBuilder.extensions(spec);

        // then
        assertThat(extensions).containsExactly("pg_search", "pg_analytics", "vector", "postgis");
    }

    @Test
    @DisplayName("A user gets a login role, a password from the environment and database grants")
    void withUser_shouldRenderRoleAndGrants() {
        // given
        var spec = new ParadeDBSpec();
        spec.getAuth().setUsers(List.of(user("app", List.of("analytics"), List.of("select", "INSERT"))));

        // when
        var script = InitScriptBuilder.build(spec);

        // then
        assertThat(script)
                .contains("\\getenv user_password_0 PARADEDB_USER_0_PASSWORD\n")
                .contains("create role \"app\" with login;")
                .contains("alter role \"app\" with password :'user_password_0';")
                .contains("create database \"analytics\"")
                .contains("\\gexec\n")
                .contains("grant connect on database \"analytics\" to \"app\";")
                .contains("\\connect \"analytics\"\n")
                .contains("grant select, insert on all tables in schema public to \"app\";");
    }

    @Test
    @DisplayName("Without privileges only connect is granted")
    void withUserWithoutPrivileges_shouldOnlyGrantConnect() {
        // given
        var spec = new ParadeDBSpec();
        spec.getAuth().setUsers(List.of(user("reader", List.of("reports"), List.of())));

        // when
        var script = InitScriptBuilder.build(spec);

        // then
        assertThat(script)
                .contains("grant connect on database \"reports\" to \"reader\";")
                .doesNotContain("\\connect")
                .doesNotContain("on all tables");
    }

    @Test
    @DisplayName("Identifiers are quoted so names cannot break out of the statement")
    void withHostileName_shouldQuoteIdentifier() {
        // given
        var spec = new ParadeDBSpec();
        spec.getAuth().setUsers(List.of(user("bad\"; drop table x; --", List.of(), List.of())));

        // when
        var script = InitScriptBuilder.build(spec);

        // then
        assertThat(script).contains("create role \"bad\"\"; drop table x; --\" with login;");
    }

    @Test
    @DisplayName("Unknown privileges are rejected")
    void withUnknownPrivilege_shouldThrow() {
        // given
        var spec = new ParadeDBSpec();
        spec.getAuth().setUsers(List.of(user("app", List.of("analytics"), List.of("superuser"))));

        // when / then
        assertThatThrownBy(() -> InitScriptBuilder.build(spec))
                .isInstanceOf(ParadeDBException.class)
                .hasMessageContaining("privilege=superuser");
    }

    @Test
    @DisplayName("User password variables are indexed by position")
    void userPasswordEnv_shouldBeIndexed() {
        // given / when / then
        assertThat(InitScriptBuilder.userPasswordEnv(2)).isEqualTo("PARADEDB_USER_2_PASSWORD");
    }

    private static AuthSpec.DatabaseUser user(
            String name,
            List<String> databases,
            List<String> privileges
    ) {
        var secretRef = new SecretRef();
        secretRef.setName(name + "-password");

        var user = new AuthSpec.DatabaseUser();
        user.setName(name);
        user.setSecretRef(secretRef);
        user.setDatabases(new ArrayList<>(databases));
        user.setPrivileges(new ArrayList<>(privileges));

        return user;
    }
}
