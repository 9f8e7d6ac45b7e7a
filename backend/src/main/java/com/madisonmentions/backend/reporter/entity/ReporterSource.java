package com.madisonmentions.backend.reporter.entity;

/**
 * Which path created the reporter record.
 */
public enum ReporterSource {
    PROVIDER,
    MANUAL_IMPORT
}
