package io.paradedb.operator.crd.paradedb;

import io.fabric8.generator.annotation.Required;
import io.paradedb.operator.core.SecretRef;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

@NullMarked
@Getter
@Setter
public class TLSSpec {
    private boolean enabled = false;

    /**
     * Secret of type kubernetes.io/tls provided by the user.
     */
    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private SecretRef secretRef;

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private CertManager certManager;

    @NullMarked
    @Getter
    @Setter
    public static class CertManager {
        private boolean enabled = false;

        @Required
        private IssuerRef issuerRef = new IssuerRef();
    }

    @NullMarked
    @Getter
    @Setter
    public static class IssuerRef {
        @Required
        private String name = "";

        private String kind = "ClusterIssuer";
    }
}
