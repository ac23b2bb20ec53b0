package com.phillippitts.speaktomany.service.health;

import com.phillippitts.speaktomany.service.recognition.RecognizerWatchdog;
import com.phillippitts.speaktomany.service.recognition.RecognizerWatchdog.RecognizerState;
import com.phillippitts.speaktomany.service.session.SessionRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for live translation sessions and their recognizer streams.
 *
 * <ul>
 *   <li>UP: no watched stream is disabled</li>
 *   <li>DEGRADED: at least one stream is DEGRADED or DISABLED but others are healthy</li>
 *   <li>DOWN: every watched stream is DISABLED</li>
 * </ul>
 */
@Component
public class TranslationSessionHealthIndicator implements HealthIndicator {

    private final SessionRegistry registry;
    private final ObjectProvider<RecognizerWatchdog> watchdog;

    public TranslationSessionHealthIndicator(SessionRegistry registry, ObjectProvider<RecognizerWatchdog> watchdog) {
        this.registry = registry;
        this.watchdog = watchdog;
    }

    @Override
    public Health health() {
        RecognizerWatchdog wd = watchdog.getIfAvailable();
        Map<String, RecognizerState> states = wd == null ? Map.of() : wd.states();
        long disabled = states.values().stream().filter(s -> s == RecognizerState.DISABLED).count();
        long degraded = states.values().stream().filter(s -> s == RecognizerState.DEGRADED).count();

        Health.Builder builder;
        if (!states.isEmpty() && disabled == states.size()) {
            builder = Health.down().withDetail("status", "All recognizer streams disabled");
        } else if (disabled > 0 || degraded > 0) {
            builder = Health.status("DEGRADED").withDetail("status", "Some recognizer streams unhealthy");
        } else {
            builder = Health.up().withDetail("status", "Sessions operational");
        }
        return builder
                .withDetail("activeSessions", registry.activeSessions())
                .withDetail("watchdog", wd == null ? "disabled" : "enabled")
                .withDetail("recognizers", states)
                .build();
    }
}
