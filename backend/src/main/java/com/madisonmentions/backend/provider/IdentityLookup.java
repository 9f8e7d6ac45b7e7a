package com.madisonmentions.backend.provider;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of resolving a name across providers. A miss caused by rate limiting is
 * reported separately so callers can avoid persisting a negative result.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IdentityLookup {

    private final ProviderIdentity identity;
    @Getter
    private final boolean rateLimited;

    public static IdentityLookup found(ProviderIdentity identity) {
        return new IdentityLookup(identity, false);
    }

    public static IdentityLookup notFound() {
        return new IdentityLookup(null, false);
    }

    public static IdentityLookup rateLimited() {
        return new IdentityLookup(null, true);
    }

    public Optional<ProviderIdentity> identity() {
        return Optional.ofNullable(identity);
    }

    public boolean isFound() {
        return identity != null;
    }
}
