package com.eduhub.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects the paths of date-typed fields from a {@code $jsonSchema} validator.
 *
 * <p>A node contributes its path when its {@code bsonType} is {@code "date"}. A node carrying a
 * nested {@code properties} mapping is descended into whether or not it is itself a date.
 * Missing or non-mapping nodes contribute nothing.
 *
 * <p>Keys containing {@code '.'} cannot be told apart from nested paths. They are reported in the
 * log and otherwise joined like any other key.
 */
public final class DateFieldExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DateFieldExtractor.class);

    static final String PROPERTIES = "properties";
    static final String BSON_TYPE = "bsonType";
    static final String DATE_TYPE = "date";

    private DateFieldExtractor() {}

    /**
     * Extracts date paths from a schema root, i.e. the object holding the top-level
     * {@code properties} mapping.
     */
    public static DateFieldPaths extract(Map<String, ?> schema) {
        if (schema == null) {
            return DateFieldPaths.empty();
        }
        return extractFromProperties(schema.get(PROPERTIES));
    }

    /**
     * Extracts date paths from a {@code properties} mapping.
     */
    public static DateFieldPaths extractFromProperties(Object properties) {
        Set<String> paths = new HashSet<>();
        collect(properties, "", paths);
        return new DateFieldPaths(paths);
    }

    private static void collect(Object properties, String prefix, Set<String> paths) {
        if (!(properties instanceof Map<?, ?> map)) {
            return;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> node)) {
                continue;
            }
            String key = String.valueOf(entry.getKey());
            if (key.contains(DateFieldPaths.SEPARATOR)) {
                LOGGER.warn("Schema key '{}' under '{}' contains '{}'; its path is ambiguous",
                        key, prefix, DateFieldPaths.SEPARATOR);
            }
            if (DATE_TYPE.equals(node.get(BSON_TYPE))) {
                paths.add(prefix + key);
            }
            if (node.containsKey(PROPERTIES)) {
                collect(node.get(PROPERTIES), prefix + key + DateFieldPaths.SEPARATOR, paths);
            }
        }
    }
}
