package com.madisonmentions.backend.provider;

public class ProviderRateLimitedException extends RuntimeException {

    private final String provider;

    public ProviderRateLimitedException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
