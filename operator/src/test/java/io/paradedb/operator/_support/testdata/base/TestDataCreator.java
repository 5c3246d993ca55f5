package io.paradedb.operator._support.testdata.base;

import net.datafaker.Faker;
import org.jspecify.annotations.NullMarked;

import java.util.ArrayList;
import java.util.List;

@NullMarked
public abstract class TestDataCreator<T> {
    protected static final Faker FAKER = new Faker();

    protected final int numberOfItems;

    protected TestDataCreator(int numberOfItems) {
        this.numberOfItems = numberOfItems;
    }

    public void apply() {
        create();
    }

    public T returnFirst() {
        return create().get(0);
    }

    public List<T> returnAll() {
        return create();
    }

    protected List<T> create() {
        var result = new ArrayList<T>();

        for (var index = 0; index < numberOfItems; index++) {
            result.add(
                    create(index)
            );
        }

        return result;
    }

    protected abstract T create(int index);

    /**
     * Random DNS-1123 label. The generated object names add suffixes such as {@code -pooler-config}, so the
     * result is kept well below the 63 character limit.
     */
    public static String randomKubernetesNameSuffix(String name) {
        var maxLength = 40;

        if (name.length() > maxLength - 3) {
            throw new IllegalArgumentException(
                    "The name is too long (must be <= %d to allow '-' + at least 2 random chars) [name=%s, length=%d]".formatted(
                            maxLength - 3,
                            name,
                            name.length()
                    )
            );
        }

        var separator = "-";
        var suffixLength = Math.min(8, maxLength - name.length() - separator.length());

        return name + separator + FAKER.regexify("[a-z0-9]{%d}".formatted(suffixLength));
    }
}
