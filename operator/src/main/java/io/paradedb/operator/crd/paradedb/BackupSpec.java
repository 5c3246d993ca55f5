package io.paradedb.operator.crd.paradedb;

import io.fabric8.generator.annotation.Min;
import io.fabric8.generator.annotation.Required;
import io.fabric8.kubernetes.api.model.Quantity;
import io.paradedb.operator.core.SecretRef;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

@NullMarked
@Getter
@Setter
public class BackupSpec {
    private boolean enabled = false;

    /**
     * Cron expression, evaluated by the CronJob controller.
     */
    private String schedule = "0 2 * * *";

    private RetentionPolicy retentionPolicy = new RetentionPolicy();

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private S3 s3;

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private Pvc pvc;

    /**
     * Image used to upload dumps to S3.
     */
    private String image = "amazon/aws-cli:latest";

    @NullMarked
    @Getter
    @Setter
    public static class RetentionPolicy {
        @Min(0)
        private int keepLast = 7;

        @Min(0)
        private int keepDaily = 7;

        @Min(0)
        private int keepWeekly = 4;
    }

    @NullMarked
    @Getter
    @Setter
    public static class S3 {
        @Nullable
        @io.fabric8.generator.annotation.Nullable
        private String endpoint;

        @Required
        private String bucket = "";

        @Nullable
        @io.fabric8.generator.annotation.Nullable
        private String region;

        /**
         * Secret with the {@code accessKeyId} and {@code secretAccessKey} keys.
         */
        @Required
        private SecretRef secretRef = new SecretRef();

        private String path = "";
    }

    @NullMarked
    @Getter
    @Setter
    public static class Pvc {
        private Quantity size = new Quantity("20Gi");

        @Nullable
        @io.fabric8.generator.annotation.Nullable
        private String storageClassName;
    }
}
