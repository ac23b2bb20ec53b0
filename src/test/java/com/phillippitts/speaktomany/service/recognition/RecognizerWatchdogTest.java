package com.phillippitts.speaktomany.service.recognition;

import com.phillippitts.speaktomany.config.properties.RecognizerWatchdogProperties;
import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.testutil.FakeRecognizerFactory.FakeRecognizer;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RecognizerWatchdogTest {

    private static RecognizerWatchdogProperties props(int maxRestarts) {
        RecognizerWatchdogProperties props = new RecognizerWatchdogProperties();
        props.setWindowMinutes(60);
        props.setMaxRestartsPerWindow(maxRestarts);
        props.setCooldownMinutes(1);
        return props;
    }

    private static RecognizerFailureEvent failure(String key, String msg) {
        return new RecognizerFailureEvent(key, "alice", Instant.now(), msg, Map.of());
    }

    @Test
    void shouldRestartRecognizerOnFailureWithinBudget() {
        FakeRecognizer recognizer = new FakeRecognizer("alice", "t1", Language.EN);
        List<Object> publishedEvents = new ArrayList<>();
        ApplicationEventPublisher publisher = publishedEvents::add;
        RecognizerWatchdog watchdog = new RecognizerWatchdog(props(3), publisher);
        watchdog.register("s1/alice", recognizer);

        watchdog.onFailure(failure("s1/alice", "disconnected"));

        // Deliver the recovery event the watchdog published
        Optional<RecognizerRecoveredEvent> recovery = publishedEvents.stream()
                .filter(e -> e instanceof RecognizerRecoveredEvent)
                .map(e -> (RecognizerRecoveredEvent) e)
                .findFirst();
        assertThat(recovery).isPresent();
        watchdog.onRecovered(recovery.get());

        assertThat(recognizer.restartCount).isEqualTo(1);
        assertThat(watchdog.getState("s1/alice")).isEqualTo(RecognizerWatchdog.RecognizerState.HEALTHY);
        assertThat(watchdog.isRecognizerEnabled("s1/alice")).isTrue();
    }

    @Test
    void shouldDisableRecognizerAfterExceedingBudget() {
        FakeRecognizer recognizer = new FakeRecognizer("alice", "t1", Language.EN);
        ApplicationEventPublisher publisher = (event) -> { /* recovery not delivered */ };
        RecognizerWatchdog watchdog = new RecognizerWatchdog(props(1), publisher);
        watchdog.register("s1/alice", recognizer);

        watchdog.onFailure(failure("s1/alice", "fail1"));
        watchdog.onFailure(failure("s1/alice", "fail2"));

        assertThat(watchdog.getState("s1/alice")).isEqualTo(RecognizerWatchdog.RecognizerState.DISABLED);
        assertThat(watchdog.isRecognizerEnabled("s1/alice")).isFalse();
        int restartsAfterDisable = recognizer.restartCount;
        watchdog.onFailure(failure("s1/alice", "fail3"));
        assertThat(recognizer.restartCount).isEqualTo(restartsAfterDisable);
    }

    @Test
    void failedRestartLeavesRecognizerDegraded() {
        FakeRecognizer recognizer = new FakeRecognizer("alice", "t1", Language.EN);
        recognizer.setFailOnRestart(true);
        List<Object> publishedEvents = new ArrayList<>();
        RecognizerWatchdog watchdog = new RecognizerWatchdog(props(3), publishedEvents::add);
        watchdog.register("s1/alice", recognizer);

        watchdog.onFailure(failure("s1/alice", "boom"));

        assertThat(watchdog.getState("s1/alice")).isEqualTo(RecognizerWatchdog.RecognizerState.DEGRADED);
        assertThat(publishedEvents).isEmpty();
    }

    @Test
    void ignoresFailuresForUnwatchedStreams() {
        RecognizerWatchdog watchdog = new RecognizerWatchdog(props(3), e -> { });

        watchdog.onFailure(failure("s1/nobody", "boom"));

        assertThat(watchdog.getState("s1/nobody")).isNull();
        assertThat(watchdog.states()).isEmpty();
    }

    @Test
    void unregisterForgetsStream() {
        FakeRecognizer recognizer = new FakeRecognizer("alice", "t1", Language.EN);
        RecognizerWatchdog watchdog = new RecognizerWatchdog(props(3), e -> { });
        watchdog.register("s1/alice", recognizer);

        watchdog.unregister("s1/alice");
        watchdog.onFailure(failure("s1/alice", "late failure"));

        assertThat(recognizer.restartCount).isZero();
        assertThat(watchdog.isRecognizerEnabled("s1/alice")).isFalse();
    }
}
