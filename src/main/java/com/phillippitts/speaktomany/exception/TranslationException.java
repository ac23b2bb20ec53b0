package com.phillippitts.speaktomany.exception;

/**
 * Thrown when a translation request fails.
 * This may occur due to provider errors, timeouts, or an unparseable provider response.
 */
public class TranslationException extends SpeakToManyException {

    private final String provider;

    public TranslationException(String message) {
        super(message);
        this.provider = "unknown";
    }

    public TranslationException(String message, String provider) {
        super(message + " (provider: " + provider + ")");
        this.provider = provider;
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
        this.provider = "unknown";
    }

    public TranslationException(String message, String provider, Throwable cause) {
        super(message + " (provider: " + provider + ")", cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
