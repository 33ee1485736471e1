package com.eduhub.adapter.spi;

/**
 * Kinds of repository operations, used to label failures in the log.
 */
public enum OperationType {
    INSERT,
    FIND,
    UPDATE,
    DELETE,
    AGGREGATE
}
