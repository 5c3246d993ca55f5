package io.paradedb.operator.core;

import org.jooq.QueryPart;
import org.jspecify.annotations.NullMarked;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.jooq.impl.DSL.sql;

@NullMarked
public final class SQLUtil {
    /**
     * Render the parts as {@code a, b, c}. An empty list renders as an empty string.
     */
    public static QueryPart commaSeparated(List<? extends QueryPart> parts) {
        var template = IntStream.range(0, parts.size())
                .mapToObj(index -> "{" + index + "}")
                .collect(Collectors.joining(", "));

        return sql(template, parts.toArray(QueryPart[]::new));
    }

    private SQLUtil() {
    }
}
