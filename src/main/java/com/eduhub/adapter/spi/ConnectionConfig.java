package com.eduhub.adapter.spi;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Connection settings for the EduHub database.
 *
 * <p>Recognised property keys when loading from {@link Properties}:
 * <ul>
 *   <li>{@code eduhub.mongodb.uri} - connection string, overridden by the {@code MONGODB_URI} environment variable</li>
 *   <li>{@code eduhub.mongodb.database} - database name (default {@value #DEFAULT_DATABASE})</li>
 *   <li>{@code eduhub.mongodb.option.*} - driver options such as {@code maxPoolSize}</li>
 * </ul>
 */
public final class ConnectionConfig {

    public static final String DEFAULT_URI = "mongodb://localhost:27017/";
    public static final String DEFAULT_DATABASE = "eduhub_db";
    public static final String DEFAULT_RESOURCE = "eduhub.properties";

    static final String URI_KEY = "eduhub.mongodb.uri";
    static final String DATABASE_KEY = "eduhub.mongodb.database";
    static final String OPTION_PREFIX = "eduhub.mongodb.option.";
    static final String URI_ENV = "MONGODB_URI";

    private final String uri;
    private final String database;
    private final Map<String, String> options;

    private ConnectionConfig(Builder builder) {
        this.uri = builder.uri;
        this.database = Objects.requireNonNull(builder.database, "database must not be null");
        this.options = Map.copyOf(builder.options);
    }

    public static ConnectionConfig fromUri(String uri) {
        return builder().uri(uri).build();
    }

    /**
     * Loads the configuration from {@value #DEFAULT_RESOURCE} on the classpath, falling back to
     * defaults when the resource is absent.
     */
    public static ConnectionConfig load() {
        Properties properties = new Properties();
        try (InputStream in = ConnectionConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read " + DEFAULT_RESOURCE, e);
        }
        return fromProperties(properties, System.getenv());
    }

    /**
     * Builds a configuration from properties, letting {@code MONGODB_URI} in {@code environment}
     * override the configured URI.
     */
    public static ConnectionConfig fromProperties(Properties properties, Map<String, String> environment) {
        Builder builder = builder()
                .uri(properties.getProperty(URI_KEY, DEFAULT_URI))
                .database(properties.getProperty(DATABASE_KEY, DEFAULT_DATABASE));

        String envUri = environment.get(URI_ENV);
        if (envUri != null && !envUri.isBlank()) {
            builder.uri(envUri);
        }

        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(OPTION_PREFIX)) {
                builder.option(key.substring(OPTION_PREFIX.length()), properties.getProperty(key));
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> uri() {
        return Optional.ofNullable(uri);
    }

    public String database() {
        return database;
    }

    public Map<String, String> options() {
        return options;
    }

    public Optional<String> getOption(String name) {
        return Optional.ofNullable(options.get(name));
    }

    /**
     * Returns the option parsed as an int, or {@code defaultValue} when absent.
     *
     * @throws ConfigurationException if the option is present but not an integer
     */
    public int getIntOption(String name, int defaultValue) {
        Optional<String> option = getOption(name);
        if (option.isEmpty()) {
            return defaultValue;
        }
        String value = option.get();
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    ValidationResult.failure(name, "expected an integer but was '" + value + "'"));
        }
    }

    @Override
    public String toString() {
        return "ConnectionConfig{database=" + database + ", options=" + options + "}";
    }

    public static final class Builder {
        private String uri;
        private String database = DEFAULT_DATABASE;
        private final Map<String, String> options = new HashMap<>();

        private Builder() {}

        public Builder uri(String uri) {
            this.uri = uri;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder option(String name, String value) {
            options.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
            return this;
        }

        public ConnectionConfig build() {
            return new ConnectionConfig(this);
        }
    }
}
