package io.paradedb.operator.crd.paradedb.config;

import io.paradedb.operator.core.ParadeDBException;
import io.paradedb.operator.crd.paradedb.AuthSpec;
import io.paradedb.operator.crd.paradedb.ParadeDBSpec;
import org.jooq.DSLContext;
import org.jooq.Privilege;
import org.jooq.QueryPart;
import org.jooq.SQLDialect;
import org.jooq.conf.RenderQuotedNames;
import org.jooq.conf.Settings;
import org.jooq.impl.DSL;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static io.paradedb.operator.core.SQLUtil.commaSeparated;
import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.inline;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.privilege;
import static org.jooq.impl.DSL.query;
import static org.jooq.impl.DSL.quotedName;
import static org.jooq.impl.DSL.select;
import static org.jooq.impl.DSL.selectOne;
import static org.jooq.impl.DSL.table;

/**
 * Renders {@code init.sql}, executed by psql through the image entrypoint when the data directory is
 * initialized for the first time.
 * <p>
 * Passwords never appear in the script. Each user's password is exposed to the container as
 * {@code PARADEDB_USER_<index>_PASSWORD} and read with psql's {@code \getenv}.
 */
@NullMarked
public final class InitScriptBuilder {
    public static final String USER_PASSWORD_ENV_FORMAT = "PARADEDB_USER_%d_PASSWORD";

    private static final Set<String> ALLOWED_PRIVILEGES = Set.of(
            "SELECT",
            "INSERT",
            "UPDATE",
            "DELETE",
            "TRUNCATE",
            "REFERENCES",
            "TRIGGER",
            "ALL"
    );

    private static final DSLContext DSL_CONTEXT = DSL.using(
            SQLDialect.POSTGRES,
            new Settings().withRenderQuotedNames(RenderQuotedNames.EXPLICIT_DEFAULT_QUOTED)
    );

    public static String build(ParadeDBSpec spec) {
        var script = new StringBuilder("-- Generated by paradedb-operator. Do not edit.\n");

        for (var extension : extensions(spec)) {
            script.append(render(query(
                    "create extension if not exists {0}",
                    quotedName(extension)
            ))).append(";\n");
        }

        var users = spec.getAuth().getUsers();

        for (int index = 0; index < users.size(); index++) {
            appendUser(script, users.get(index), index);
        }

        return script.toString();
    }

    public static String userPasswordEnv(int index) {
        return USER_PASSWORD_ENV_FORMAT.formatted(index);
    }

    static List<String> extensions(ParadeDBSpec spec) {
        var extensions = new LinkedHashSet<String>();
        var toggles = spec.getExtensions();

        if (toggles.isPgSearch()) {
            extensions.add("pg_search");
        }
        if (toggles.isPgAnalytics()) {
            extensions.add("pg_analytics");
        }
        if (toggles.isPgVector()) {
            extensions.add("vector");
        }

        for (var extension : toggles.getAdditional()) {
            if (!extension.isBlank()) {
                extensions.add(extension.strip());
            }
        }

        return new ArrayList<>(extensions);
    }

    private static void appendUser(
            StringBuilder script,
            AuthSpec.DatabaseUser user,
            int index
    ) {
        var role = quotedName(user.getName());
        var passwordVariable = "user_password_%d".formatted(index);

        script.append('\n')
                .append("\\getenv ").append(passwordVariable).append(' ').append(userPasswordEnv(index)).append('\n');

        script.append(render(query("create role {0} with login", role))).append(";\n");

        // psql interpolates :'variable' as a quoted literal, jOOQ only renders the identifier
        script.append(render(query("alter role {0} with password", role)))
                .append(" :'").append(passwordVariable).append("';\n");

        var privileges = privileges(user);

        for (var database : user.getDatabases()) {
            // psql executes the result of the select, "create database" cannot run inside a DO block
            script.append(render(
                    select(inline("create database " + render(quotedName(database))))
                            .whereNotExists(selectOne()
                                    .from(table(name("pg_database")))
                                    .where(field(name("datname")).eq(inline(database))))
            )).append("\\gexec\n");

            script.append(render(query(
                    "grant connect on database {0} to {1}",
                    quotedName(database),
                    role
            ))).append(";\n");

            if (!privileges.isEmpty()) {
                script.append("\\connect ").append(render(quotedName(database))).append('\n');
                script.append(render(query(
                        "grant {0} on all tables in schema public to {1}",
                        commaSeparated(privileges),
                        role
                ))).append(";\n");
            }
        }
    }

    private static List<Privilege> privileges(AuthSpec.DatabaseUser user) {
        var privileges = new ArrayList<Privilege>();

        for (var value : user.getPrivileges()) {
            var normalized = value.strip().toUpperCase(Locale.ROOT);

            if (!ALLOWED_PRIVILEGES.contains(normalized)) {
                throw new ParadeDBException("Unsupported privilege [user=%s, privilege=%s]".formatted(
                        user.getName(),
                        value
                ));
            }

            privileges.add(privilege(normalized.toLowerCase(Locale.ROOT)));
        }

        return privileges;
    }

    private static String render(QueryPart queryPart) {
        return DSL_CONTEXT.renderInlined(queryPart);
    }

    private InitScriptBuilder() {
    }
}
