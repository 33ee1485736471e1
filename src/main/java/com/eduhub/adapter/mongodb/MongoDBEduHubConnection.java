package com.eduhub.adapter.mongodb;

import com.eduhub.adapter.spi.EduHubConnection;
import com.eduhub.adapter.spi.SetupException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connection to the EduHub database backed by a MongoDB client.
 */
public class MongoDBEduHubConnection implements EduHubConnection {

    private final String connectionId;
    private final MongoClient client;
    private final String databaseName;
    private final AtomicBoolean closed;

    /**
     * Creates a new connection.
     *
     * @param client       the underlying MongoDB client, owned by this connection from now on
     * @param databaseName the database name
     */
    public MongoDBEduHubConnection(MongoClient client, String databaseName) {
        this.connectionId = UUID.randomUUID().toString();
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.databaseName = Objects.requireNonNull(databaseName, "databaseName must not be null");
        this.closed = new AtomicBoolean(false);
    }

    @Override
    public String getConnectionId() {
        return connectionId;
    }

    @Override
    public MongoDatabase getDatabase() {
        if (closed.get()) {
            throw new SetupException("Connection " + connectionId + " is closed");
        }
        return client.getDatabase(databaseName);
    }

    public String getDatabaseName() {
        return databaseName;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T unwrap(Class<T> type) {
        if (type.isInstance(client)) {
            return (T) client;
        }
        throw new ClassCastException("Cannot unwrap to " + type.getName());
    }

    @Override
    public boolean isValid() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            client.close();
        }
    }
}
