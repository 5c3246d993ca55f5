package io.paradedb.operator.core;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import org.jspecify.annotations.NullMarked;

import java.time.Duration;

@NullMarked
@ConfigMapping(prefix = "paradedb.operator")
public interface OperatorConfig {
    Requeue requeue();

    /**
     * DNS suffix appended to {@code <service>.<namespace>} when the connection endpoint is published.
     */
    @WithDefault("svc.cluster.local")
    String clusterDomain();

    @WithDefault("24")
    int generatedPasswordLength();

    interface Requeue {
        @WithDefault("60s")
        Duration success();

        @WithDefault("30s")
        Duration error();
    }
}
