package com.phillippitts.speaktomany.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for streaming speech recognition.
 */
@ConfigurationProperties(prefix = "recognition")
@Validated
public class RecognitionProperties {

    /** Interim results at or below this confidence are not forwarded to the buffer. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.7;

    /** Forward interim (non-final) transcripts at all. */
    private boolean enableInterimResults = true;

    /** Gap between recognizer events that starts a new utterance. 0 disables gap detection. */
    @Min(0)
    private long silenceGapMs = 1200;

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public boolean isEnableInterimResults() {
        return enableInterimResults;
    }

    public void setEnableInterimResults(boolean enableInterimResults) {
        this.enableInterimResults = enableInterimResults;
    }

    public long getSilenceGapMs() {
        return silenceGapMs;
    }

    public void setSilenceGapMs(long silenceGapMs) {
        this.silenceGapMs = silenceGapMs;
    }
}
