package com.sportsdata.domain.ports;

/**
 * Raised by a provider when it cannot answer a call at all: transport or auth
 * failure, exhausted rate limit, or an upstream payload that cannot be read.
 *
 * <p>"Nothing found" is never reported through this exception.
 */
public class ProviderException extends Exception {

    public enum Kind {
        TRANSPORT,
        AUTH,
        RATE_LIMITED,
        MALFORMED_RESPONSE
    }

    private final String provider;
    private final Kind kind;

    public ProviderException(String provider, Kind kind, String message) {
        super(message);
        this.provider = provider;
        this.kind = kind;
    }

    public ProviderException(String provider, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public String getProvider() {
        return provider;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return "[" + provider + "/" + kind + "] " + super.getMessage();
    }
}
