package com.eduhub.adapter.spi;

/**
 * Exception thrown when a database connection cannot be established.
 */
public class ConnectionException extends EduHubException {

    private final String uri;

    public ConnectionException(String uri, String message) {
        super(message);
        this.uri = uri;
    }

    public ConnectionException(String uri, String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }
}
