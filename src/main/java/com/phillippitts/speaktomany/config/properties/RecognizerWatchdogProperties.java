package com.phillippitts.speaktomany.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the recognizer stream watchdog.
 */
@ConfigurationProperties(prefix = "recognition.watchdog")
@Validated
public class RecognizerWatchdogProperties {

    /** Enable/disable automatic recognizer restarts. */
    private boolean enabled = true;

    /** Sliding window size for the restart budget, in minutes. */
    @Positive(message = "Window minutes must be positive")
    private int windowMinutes = 10;

    /** Maximum restarts permitted per recognizer within the window. */
    @Positive(message = "Max restarts per window must be positive")
    private int maxRestartsPerWindow = 3;

    /** Cooldown after disabling a recognizer before restarts are attempted again. */
    @Positive(message = "Cooldown minutes must be positive")
    private int cooldownMinutes = 5;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    public void setWindowMinutes(int windowMinutes) {
        this.windowMinutes = windowMinutes;
    }

    public int getMaxRestartsPerWindow() {
        return maxRestartsPerWindow;
    }

    public void setMaxRestartsPerWindow(int maxRestartsPerWindow) {
        this.maxRestartsPerWindow = maxRestartsPerWindow;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }
}
