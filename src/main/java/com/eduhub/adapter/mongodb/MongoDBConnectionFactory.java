package com.eduhub.adapter.mongodb;

import com.eduhub.adapter.spi.ConnectionConfig;
import com.eduhub.adapter.spi.ConnectionException;
import com.eduhub.adapter.spi.ConfigurationException;
import com.eduhub.adapter.spi.EduHubConnection;
import com.eduhub.adapter.spi.ValidationResult;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Opens MongoDB connections to the EduHub database.
 */
public class MongoDBConnectionFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(MongoDBConnectionFactory.class);

    /**
     * Checks that the configuration carries a usable MongoDB connection string.
     */
    public ValidationResult validateConfig(ConnectionConfig config) {
        List<ValidationResult.ValidationError> errors = new ArrayList<>();

        Optional<String> uriOpt = config.uri();
        if (uriOpt.isEmpty() || uriOpt.get().isEmpty()) {
            errors.add(new ValidationResult.ValidationError("uri", "MongoDB URI is required"));
            return ValidationResult.failure(errors);
        }

        String uri = uriOpt.get();
        if (!uri.startsWith("mongodb://") && !uri.startsWith("mongodb+srv://")) {
            errors.add(new ValidationResult.ValidationError("uri",
                    "URI must start with mongodb:// or mongodb+srv://"));
        }
        if (config.database().isBlank()) {
            errors.add(new ValidationResult.ValidationError("database", "Database name is required"));
        }

        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    /**
     * Describes the driver options understood by {@link #connect(ConnectionConfig)}.
     */
    public Map<String, String> getConfigurationOptions() {
        return Map.of(
                "maxPoolSize", "Maximum connection pool size (default: 100)",
                "minPoolSize", "Minimum connection pool size (default: 0)",
                "connectTimeoutMs", "Connection timeout in milliseconds (default: 10000)"
        );
    }

    /**
     * Builds the driver settings for a validated configuration.
     *
     * @throws ConfigurationException if the configuration is invalid
     */
    public MongoClientSettings buildSettings(ConnectionConfig config) {
        ValidationResult validation = validateConfig(config);
        if (validation.isInvalid()) {
            throw new ConfigurationException(validation);
        }

        int maxPoolSize = config.getIntOption("maxPoolSize", 100);
        int minPoolSize = config.getIntOption("minPoolSize", 0);
        int connectTimeoutMs = config.getIntOption("connectTimeoutMs", 10000);

        return MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(config.uri().orElseThrow()))
                .applyToConnectionPoolSettings(builder -> builder
                        .maxSize(maxPoolSize)
                        .minSize(minPoolSize))
                .applyToSocketSettings(builder -> builder
                        .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS))
                .build();
    }

    /**
     * Opens a connection. The returned connection owns the client and must be closed.
     *
     * @throws ConfigurationException if the configuration is invalid
     * @throws ConnectionException    if the client cannot be created
     */
    public EduHubConnection connect(ConnectionConfig config) {
        MongoClientSettings settings = buildSettings(config);
        String uri = config.uri().orElseThrow();

        MongoClient client;
        try {
            client = MongoClients.create(settings);
        } catch (MongoException | IllegalArgumentException e) {
            throw new ConnectionException(uri, "Unable to create MongoDB client: " + e.getMessage(), e);
        }

        MongoDBEduHubConnection connection = new MongoDBEduHubConnection(client, config.database());
        LOGGER.info("Opened connection {} to database '{}'", connection.getConnectionId(), config.database());
        return connection;
    }
}
