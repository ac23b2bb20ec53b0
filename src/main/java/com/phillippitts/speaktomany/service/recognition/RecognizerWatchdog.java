package com.phillippitts.speaktomany.service.recognition;

import com.phillippitts.speaktomany.config.properties.RecognizerWatchdogProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event-driven watchdog that restarts failed recognizer streams within a bounded budget.
 *
 * Detection model:
 * - Adapters publish {@link RecognizerFailureEvent} when a stream disconnects or errors.
 * - The watchdog tracks restarts per stream in a sliding time window and restarts within budget.
 * - On exceeding budget the stream is marked DISABLED until the cooldown elapses.
 *
 * Streams are registered by the agent that owns them and unregistered when it stops recognizing
 * that speaker. Failures for unknown keys are ignored.
 */
@Component
@ConditionalOnProperty(prefix = "recognition.watchdog", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RecognizerWatchdog {

    private static final Logger LOG = LogManager.getLogger(RecognizerWatchdog.class);

    public enum RecognizerState { HEALTHY, DEGRADED, DISABLED }

    private final RecognizerWatchdogProperties props;
    private final ApplicationEventPublisher publisher;

    private final Map<String, SpeechRecognizer> recognizers = new ConcurrentHashMap<>();

    // Sliding window of restart attempts per stream
    private final ConcurrentMap<String, Deque<Instant>> restartWindow = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RecognizerState> state = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> disabledUntil = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> restartLocks = new ConcurrentHashMap<>();

    public RecognizerWatchdog(RecognizerWatchdogProperties props, ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    public void register(String key, SpeechRecognizer recognizer) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(recognizer, "recognizer");
        recognizers.put(key, recognizer);
        state.put(key, RecognizerState.HEALTHY);
        restartLocks.putIfAbsent(key, new ReentrantLock());
        restartWindow.putIfAbsent(key, new ArrayDeque<>());
        LOG.debug("Watching recognizer {}", key);
    }

    public void unregister(String key) {
        if (recognizers.remove(key) != null) {
            state.remove(key);
            restartWindow.remove(key);
            disabledUntil.remove(key);
            restartLocks.remove(key);
            LOG.debug("Stopped watching recognizer {}", key);
        }
    }

    /** Visible for tests */
    RecognizerState getState(String key) {
        return state.get(key);
    }

    /**
     * Snapshot of every watched stream's state, keyed by stream key.
     */
    public Map<String, RecognizerState> states() {
        return new TreeMap<>(state);
    }

    /**
     * Checks if a stream is currently enabled (not disabled or in cooldown).
     *
     * @param key stream key
     * @return true if the stream is watched, enabled and not in cooldown
     */
    public boolean isRecognizerEnabled(String key) {
        return state.containsKey(key) && !isDisabledByCooldown(key);
    }

    @EventListener
    public void onFailure(RecognizerFailureEvent event) {
        String key = event.recognizerKey();
        if (!recognizers.containsKey(key)) {
            LOG.debug("RecognizerFailureEvent for unwatched stream: {}", key);
            return;
        }

        LOG.warn("Recognizer failure: stream={}, msg={}", key, event.message());
        if (!isRecognizerEnabled(key)) {
            LOG.warn("Recognizer {} currently disabled until {}", key, disabledUntil.get(key));
            return;
        }

        state.put(key, RecognizerState.DEGRADED);
        attemptRestart(key);
    }

    @EventListener
    public void onRecovered(RecognizerRecoveredEvent event) {
        String key = event.recognizerKey();
        if (!recognizers.containsKey(key)) {
            return;
        }
        state.put(key, RecognizerState.HEALTHY);
        Deque<Instant> window = restartWindow.get(key);
        if (window != null) {
            synchronized (window) {
                window.clear();
            }
        }
        disabledUntil.remove(key);
        LOG.info("Recognizer recovered: {}", key);
    }

    @Scheduled(fixedRate = 60_000)
    void logHealthSummary() {
        if (state.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder("Recognizer states: ");
        states().forEach((name, st) -> sb.append(name).append('=').append(st).append(' '));
        LOG.info(sb.toString().trim());
    }

    private void attemptRestart(String key) {
        withRestartLock(key, () -> {
            if (isDisabledByCooldown(key)) {
                LOG.warn("Recognizer {} is in cooldown until {}", key, disabledUntil.get(key));
                return;
            }
            if (!budgetAllowsRestart(key)) {
                disable(key);
                return;
            }
            recordRestartAttempt(key);
            if (tryRestart(key)) {
                // onRecovered() moves the stream back to HEALTHY and clears the window
                publisher.publishEvent(new RecognizerRecoveredEvent(key, Instant.now()));
                LOG.info("Recognizer {} restarted", key);
            } else {
                state.computeIfPresent(key, (k, s) -> RecognizerState.DEGRADED);
                LOG.warn("Recognizer {} restart failed; remaining DEGRADED", key);
            }
        });
    }

    /** Guard restart with a per-stream lock to avoid concurrent restarts. */
    private void withRestartLock(String key, Runnable action) {
        ReentrantLock lock = restartLocks.get(key);
        if (lock == null) {
            return;
        }
        if (!lock.tryLock()) {
            LOG.debug("Restart already in progress for {}", key);
            return;
        }
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    private boolean isDisabledByCooldown(String key) {
        Instant until = disabledUntil.get(key);
        return until != null && Instant.now().isBefore(until);
    }

    private boolean budgetAllowsRestart(String key) {
        Deque<Instant> window = restartWindow.get(key);
        if (window == null) {
            return false;
        }
        synchronized (window) {
            Instant cutoff = Instant.now().minus(Duration.ofMinutes(props.getWindowMinutes()));
            while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
                window.removeFirst();
            }
            return window.size() < props.getMaxRestartsPerWindow();
        }
    }

    private void recordRestartAttempt(String key) {
        Deque<Instant> window = restartWindow.get(key);
        if (window != null) {
            synchronized (window) {
                window.addLast(Instant.now());
            }
        }
    }

    private void disable(String key) {
        state.computeIfPresent(key, (k, s) -> RecognizerState.DISABLED);
        Instant until = Instant.now().plus(Duration.ofMinutes(props.getCooldownMinutes()));
        disabledUntil.put(key, until);
        LOG.error("Recognizer {} disabled after {} restarts within {}m; cooldown until {}",
                key, props.getMaxRestartsPerWindow(), props.getWindowMinutes(), until);
    }

    private boolean tryRestart(String key) {
        SpeechRecognizer recognizer = recognizers.get(key);
        if (recognizer == null) {
            return false;
        }
        try {
            LOG.warn("Restarting recognizer {}", key);
            recognizer.restart();
            return true;
        } catch (RuntimeException ex) {
            LOG.error("Recognizer {} failed to restart: {}", key, ex.toString());
            return false;
        }
    }
}
