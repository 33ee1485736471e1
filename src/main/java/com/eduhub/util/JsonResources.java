package com.eduhub.util;

import com.eduhub.adapter.spi.ConfigurationException;
import org.bson.BsonInvalidOperationException;
import org.bson.Document;
import org.bson.json.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads JSON objects from the filesystem or, failing that, from the classpath.
 */
public final class JsonResources {

    private JsonResources() {}

    /**
     * Parses the JSON object found at {@code location}.
     * The location is tried as a filesystem path first, then as a classpath resource.
     *
     * @throws ConfigurationException if nothing exists at the location or the content is not a JSON object
     */
    public static Document readDocument(String location) {
        String json = readText(location);
        try {
            return Document.parse(json);
        } catch (JsonParseException | BsonInvalidOperationException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid JSON in " + location + ": " + e.getMessage(), e);
        }
    }

    static String readText(String location) {
        Path path = Path.of(location);
        try {
            if (Files.isRegularFile(path)) {
                return Files.readString(path, StandardCharsets.UTF_8);
            }
            String resource = location.startsWith("/") ? location.substring(1) : location;
            try (InputStream in = JsonResources.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    throw new ConfigurationException("File not found: " + location);
                }
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read " + location, e);
        }
    }
}
