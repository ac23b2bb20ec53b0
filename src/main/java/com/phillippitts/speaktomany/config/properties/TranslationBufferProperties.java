package com.phillippitts.speaktomany.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the per-session translation buffer.
 */
@Validated
@ConfigurationProperties(prefix = "translation.buffer")
public class TranslationBufferProperties {

    /** Upper bound between first submission of a segment and its dispatch. */
    @Positive(message = "Max delay must be positive")
    private final long maxDelayMs;

    /** Confidence above which a non-final segment is dispatched immediately. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double highConfidenceThreshold;

    /** How often the drain loop sweeps for segments older than the max delay. */
    @Positive(message = "Poll interval must be positive")
    private final long pollIntervalMs;

    /** How long a finished segment stays inspectable before it is discarded. */
    @Min(0)
    private final long cleanupGraceMs;

    @ConstructorBinding
    public TranslationBufferProperties(Long maxDelayMs,
                                       Double highConfidenceThreshold,
                                       Long pollIntervalMs,
                                       Long cleanupGraceMs) {
        this.maxDelayMs = maxDelayMs == null ? 500 : maxDelayMs;
        this.highConfidenceThreshold = highConfidenceThreshold == null ? 0.8 : highConfidenceThreshold;
        this.pollIntervalMs = pollIntervalMs == null ? 50 : pollIntervalMs;
        this.cleanupGraceMs = cleanupGraceMs == null ? 2000 : cleanupGraceMs;
    }

    /**
     * Defaults with a custom max delay; convenient for tests.
     */
    public TranslationBufferProperties(long maxDelayMs) {
        this(maxDelayMs, null, Math.min(50, maxDelayMs), null);
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public long getCleanupGraceMs() {
        return cleanupGraceMs;
    }

    @AssertTrue(message = "Poll interval must not exceed max delay")
    public boolean isPollIntervalWithinMaxDelay() {
        return pollIntervalMs <= maxDelayMs;
    }
}
