package com.madisonmentions.backend.reporter.service;

/**
 * Picks the resolution strategy from the state of the stored record.
 */
public final class TierSelector {

    private TierSelector() {
    }

    public static ResolutionTier select(boolean recordPresent, boolean fresh, boolean forceRefresh,
                                        boolean hasArticles, boolean hasIdentity) {
        if (!recordPresent) {
            return ResolutionTier.COLD_START;
        }
        if (fresh && !forceRefresh && hasArticles) {
            return ResolutionTier.FRESH_HIT;
        }
        // Imported records carry no identity yet and need resolving first
        return hasIdentity ? ResolutionTier.INCREMENTAL : ResolutionTier.COLD_START;
    }
}
