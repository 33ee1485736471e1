package com.eduhub.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites ISO-8601 strings found at date paths into {@link Date} values so that they are stored
 * as native BSON dates.
 *
 * <p>Conversion is best-effort: a string at a date path that does not parse is left untouched.
 * Values that are not strings are never converted, so converting a document twice is a no-op.
 * Mutable containers are updated in place. A mapping or list that rejects modification is
 * replaced by a converted copy, so callers must use the returned value.
 *
 * <p>Instances hold only their immutable {@link DateFieldPaths} and may be shared between threads
 * as long as each call receives its own document.
 */
public final class DocumentDateConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentDateConverter.class);

    private final DateFieldPaths dateFields;

    public DocumentDateConverter(DateFieldPaths dateFields) {
        this.dateFields = Objects.requireNonNull(dateFields, "dateFields must not be null");
    }

    /**
     * Creates a converter for the date fields declared by a {@code $jsonSchema} root.
     */
    public static DocumentDateConverter forSchema(Map<String, ?> schema) {
        return new DocumentDateConverter(DateFieldExtractor.extract(schema));
    }

    public DateFieldPaths dateFields() {
        return dateFields;
    }

    /**
     * Converts a document from its root.
     *
     * @return the converted document; non-mapping values are returned unchanged
     */
    public <T> T convert(T record) {
        return convert(record, "");
    }

    /**
     * Converts a document whose fields live under {@code prefix} (empty, or ending in {@code '.'}).
     *
     * @return the same object converted in place, or a converted copy if it cannot be modified;
     *         non-mapping values are returned unchanged
     * @throws NullPointerException if {@code prefix} is null
     */
    @SuppressWarnings("unchecked")
    public <T> T convert(T record, String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        if (record instanceof Map<?, ?> map) {
            return (T) convertMap(map, prefix);
        }
        return record;
    }

    private Map<?, ?> convertMap(Map<?, ?> map, String prefix) {
        Map<Object, Object> replacements = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            Object value = entry.getValue();
            Object converted = convertValue(value, prefix + entry.getKey());
            if (converted != value) {
                replacements.put(entry.getKey(), converted);
            }
        }
        return replacements.isEmpty() ? map : replaceValues(map, replacements);
    }

    private Object convertValue(Object value, String fullKey) {
        if (value instanceof String text && dateFields.contains(fullKey)) {
            Optional<Date> parsed = IsoDateParser.parse(text);
            if (parsed.isEmpty()) {
                LOGGER.debug("Leaving unparseable date '{}' at '{}' unchanged", text, fullKey);
                return value;
            }
            return parsed.get();
        }
        if (value instanceof Map<?, ?> nested) {
            return convertMap(nested, fullKey + DateFieldPaths.SEPARATOR);
        }
        if (value instanceof List<?> list) {
            return convertList(list, fullKey + DateFieldPaths.SEPARATOR);
        }
        return value;
    }

    private List<?> convertList(List<?> list, String prefix) {
        Map<Integer, Object> replacements = new LinkedHashMap<>();
        int index = 0;
        for (Object element : list) {
            if (element instanceof Map<?, ?> nested) {
                Map<?, ?> converted = convertMap(nested, prefix);
                if (converted != nested) {
                    replacements.put(index, converted);
                }
            }
            index++;
        }
        return replacements.isEmpty() ? list : replaceElements(list, replacements);
    }

    @SuppressWarnings("unchecked")
    private static Map<?, ?> replaceValues(Map<?, ?> map, Map<Object, Object> replacements) {
        try {
            ((Map<Object, Object>) map).putAll(replacements);
            return map;
        } catch (UnsupportedOperationException | ClassCastException e) {
            LOGGER.trace("Copying {} that rejected converted values", map.getClass().getName());
            Map<Object, Object> copy = new LinkedHashMap<>(map);
            copy.putAll(replacements);
            return copy;
        }
    }

    @SuppressWarnings("unchecked")
    private static List<?> replaceElements(List<?> list, Map<Integer, Object> replacements) {
        try {
            replacements.forEach(((List<Object>) list)::set);
            return list;
        } catch (UnsupportedOperationException | ClassCastException e) {
            LOGGER.trace("Copying {} that rejected converted elements", list.getClass().getName());
            List<Object> copy = new ArrayList<>(list);
            replacements.forEach(copy::set);
            return copy;
        }
    }
}
