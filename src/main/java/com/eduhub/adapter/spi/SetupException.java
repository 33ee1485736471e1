package com.eduhub.adapter.spi;

/**
 * Exception thrown when building or seeding the database fails.
 */
public class SetupException extends EduHubException {

    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
