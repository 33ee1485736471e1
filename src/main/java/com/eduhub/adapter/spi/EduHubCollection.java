package com.eduhub.adapter.spi;

/**
 * The collections making up the EduHub database.
 */
public enum EduHubCollection {
    USERS("users"),
    COURSES("courses"),
    ENROLLMENTS("enrollments"),
    LESSONS("lessons"),
    ASSIGNMENTS("assignments"),
    SUBMISSIONS("submissions");

    private final String collectionName;

    EduHubCollection(String collectionName) {
        this.collectionName = collectionName;
    }

    public String collectionName() {
        return collectionName;
    }
}
