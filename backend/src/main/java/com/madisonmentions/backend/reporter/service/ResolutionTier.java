package com.madisonmentions.backend.reporter.service;

public enum ResolutionTier {
    /** Served from storage, no upstream calls. */
    FRESH_HIT,
    /** Known identity, top-up fetch since the newest stored article. */
    INCREMENTAL,
    /** Identity resolution plus full history fetch. */
    COLD_START
}
