package com.eduhub.schema;

import java.util.Objects;
import java.util.Set;

/**
 * Dot-joined paths of the fields a schema declares as {@code bsonType: "date"},
 * for example {@code "profile.joinedAt"}.
 *
 * <p>Immutable and safe to share between threads.
 */
public record DateFieldPaths(Set<String> paths) {

    public static final String SEPARATOR = ".";

    private static final DateFieldPaths EMPTY = new DateFieldPaths(Set.of());

    public DateFieldPaths {
        Objects.requireNonNull(paths, "paths must not be null");
        paths = Set.copyOf(paths);
    }

    public static DateFieldPaths empty() {
        return EMPTY;
    }

    public static DateFieldPaths of(String... paths) {
        return new DateFieldPaths(Set.of(paths));
    }

    public boolean contains(String path) {
        return paths.contains(path);
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }
}
