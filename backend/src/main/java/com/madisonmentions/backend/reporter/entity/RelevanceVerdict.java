package com.madisonmentions.backend.reporter.entity;

/**
 * Professional-services relevance. Once a record leaves {@link #UNKNOWN} it never changes.
 */
public enum RelevanceVerdict {
    UNKNOWN,
    RELEVANT,
    NOT_RELEVANT;

    public static RelevanceVerdict of(boolean relevant) {
        return relevant ? RELEVANT : NOT_RELEVANT;
    }

    public boolean isDecided() {
        return this != UNKNOWN;
    }
}
