package com.eduhub.schema;

import com.eduhub.util.JsonResources;
import org.bson.Document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The collection validators of the EduHub database, keyed by collection name.
 *
 * <p>The backing file is a JSON object mapping each collection name to its validator, e.g.
 * <pre>{@code {"users": {"$jsonSchema": {"bsonType": "object", "properties": {...}}}}}</pre>
 */
public final class SchemaCatalog {

    public static final String DEFAULT_LOCATION = "data/schema_validation.json";

    static final String JSON_SCHEMA = "$jsonSchema";

    private final Map<String, Document> validators;
    private final Map<String, DocumentDateConverter> converters = new ConcurrentHashMap<>();

    public SchemaCatalog(Map<String, Document> validators) {
        Objects.requireNonNull(validators, "validators must not be null");
        this.validators = Collections.unmodifiableMap(new LinkedHashMap<>(validators));
    }

    /**
     * Loads the catalog from a filesystem path or classpath resource.
     *
     * @throws com.eduhub.adapter.spi.ConfigurationException if the file is missing or malformed
     */
    public static SchemaCatalog load(String location) {
        Document root = JsonResources.readDocument(location);
        Map<String, Document> validators = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : root.entrySet()) {
            if (entry.getValue() instanceof Document validator) {
                validators.put(entry.getKey(), validator);
            }
        }
        return new SchemaCatalog(validators);
    }

    public static SchemaCatalog loadDefault() {
        return load(DEFAULT_LOCATION);
    }

    public Set<String> collectionNames() {
        return validators.keySet();
    }

    public boolean contains(String collectionName) {
        return validators.containsKey(collectionName);
    }

    /**
     * The validator to pass when creating the collection.
     */
    public Optional<Document> validator(String collectionName) {
        return Optional.ofNullable(validators.get(collectionName));
    }

    /**
     * The {@code $jsonSchema} part of the validator.
     */
    public Optional<Document> jsonSchema(String collectionName) {
        return validator(collectionName)
                .map(v -> v.get(JSON_SCHEMA))
                .filter(Document.class::isInstance)
                .map(Document.class::cast);
    }

    /**
     * The date paths declared for a collection; empty for unknown collections.
     */
    public DateFieldPaths dateFields(String collectionName) {
        return converter(collectionName).dateFields();
    }

    /**
     * A date converter for a collection, built once and cached.
     */
    public DocumentDateConverter converter(String collectionName) {
        return converters.computeIfAbsent(collectionName,
                name -> new DocumentDateConverter(
                        jsonSchema(name).map(DateFieldExtractor::extract).orElse(DateFieldPaths.empty())));
    }
}
