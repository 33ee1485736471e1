package com.eduhub.adapter.spi;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;

/**
 * An open connection to the EduHub database.
 * Owns the underlying client; closing the connection releases it.
 */
public interface EduHubConnection extends AutoCloseable {

    /**
     * Unique identifier for this connection, used in log messages.
     */
    String getConnectionId();

    /**
     * The EduHub database.
     *
     * @throws SetupException if the connection is closed
     */
    MongoDatabase getDatabase();

    /**
     * Shortcut for one of the EduHub collections.
     */
    default MongoCollection<Document> collection(EduHubCollection collection) {
        return getDatabase().getCollection(collection.collectionName());
    }

    boolean isValid();

    /**
     * Unwraps to the driver-specific client type.
     *
     * @throws ClassCastException if the client is not of the requested type
     */
    <T> T unwrap(Class<T> type);

    @Override
    void close();
}
