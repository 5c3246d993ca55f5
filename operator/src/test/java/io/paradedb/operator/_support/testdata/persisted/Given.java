package io.paradedb.operator._support.testdata.persisted;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator._support.testdata.persisted.creator.ParadeDBCreate;
import io.paradedb.operator._support.testdata.persisted.creator.SecretRefCreate;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;

@NullMarked
@ApplicationScoped
@RequiredArgsConstructor
public class Given {
    private final KubernetesClient kubernetesClient;

    public One one() {
        return new One();
    }

    public Many many(int numberOfItems) {
        return new Many(numberOfItems);
    }

    public class One extends Item {
        One() {
            super(1);
        }
    }

    public class Many extends Item {
        Many(int numberOfItems) {
            super(numberOfItems);
        }
    }

    @RequiredArgsConstructor(access = AccessLevel.PACKAGE)
    public abstract class Item {
        private final int numberOfItems;

        @SuppressWarnings("unused")
        public Item describedAs(String description) {
            return this;
        }

        public SecretRefCreate secretRef() {
            return new SecretRefCreate(
                    numberOfItems,
                    kubernetesClient
            );
        }

        public ParadeDBCreate paradeDB() {
            return new ParadeDBCreate(
                    numberOfItems,
                    kubernetesClient
            );
        }
    }
}
