package io.paradedb.operator.crd.paradedb;

import io.fabric8.kubernetes.api.model.Quantity;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

@NullMarked
@Getter
@Setter
public class StorageSpec {
    private Quantity size = new Quantity("10Gi");

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private String storageClassName;

    private List<String> accessModes = new ArrayList<>(List.of("ReadWriteOnce"));

    /**
     * Dedicated volume for the write-ahead log.
     */
    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private WalStorage walStorage;

    @NullMarked
    @Getter
    @Setter
    public static class WalStorage {
        private Quantity size = new Quantity("5Gi");

        @Nullable
        @io.fabric8.generator.annotation.Nullable
        private String storageClassName;
    }
}
