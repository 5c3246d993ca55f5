package io.paradedb.operator.crd.paradedb;

import io.fabric8.generator.annotation.Min;
import io.fabric8.generator.annotation.Pattern;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

@NullMarked
@Getter
@Setter
public class ConnectionPoolingSpec {
    private boolean enabled = false;

    private String image = "bitnami/pgbouncer:latest";

    @Pattern("^(session|transaction|statement)$")
    private String poolMode = "transaction";

    @Min(1)
    private int maxClientConnections = 100;

    @Min(1)
    private int defaultPoolSize = 20;

    @Min(0)
    private int minPoolSize = 0;

    @Min(0)
    private int reservePoolSize = 5;

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private ResourceRequirements resources;
}
