package io.paradedb.operator.crd.paradedb;

import io.fabric8.generator.annotation.Required;
import io.fabric8.generator.annotation.ValidationRule;
import io.paradedb.operator.core.SecretRef;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

@NullMarked
@Getter
@Setter
public class AuthSpec {
    /**
     * Externally managed superuser credentials. When absent the operator generates them.
     */
    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private SecretRef superuserSecretRef;

    @ValidationRule(
            value = "self.trim().size() > 0",
            message = "The database name must not be empty."
    )
    private String database = "paradedb";

    private List<DatabaseUser> users = new ArrayList<>();

    /**
     * Extra pg_hba.conf rules, inserted before the default rule.
     */
    private List<String> pgHBA = new ArrayList<>();

    @NullMarked
    @Getter
    @Setter
    public static class DatabaseUser {
        @Required
        private String name = "";

        /**
         * Secret holding the user's password under the {@code password} key.
         */
        @Required
        private SecretRef secretRef = new SecretRef();

        private List<String> databases = new ArrayList<>();

        private List<String> privileges = new ArrayList<>();
    }
}
