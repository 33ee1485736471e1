package com.eduhub.adapter.spi;

/**
 * Base exception for EduHub data-layer errors.
 */
public class EduHubException extends RuntimeException {

    public EduHubException(String message) {
        super(message);
    }

    public EduHubException(String message, Throwable cause) {
        super(message, cause);
    }
}
