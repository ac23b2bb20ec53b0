package com.phillippitts.speaktomany.service.session;

import com.phillippitts.speaktomany.config.ThreadPoolConfig;
import com.phillippitts.speaktomany.config.properties.ThreadPoolProperties;
import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.SegmentSnapshot;
import com.phillippitts.speaktomany.domain.SegmentState;
import com.phillippitts.speaktomany.domain.TranslationResult;
import com.phillippitts.speaktomany.exception.TranslationException;
import com.phillippitts.speaktomany.testutil.FakeTranslationService;
import com.phillippitts.speaktomany.testutil.FakeTranslationService.Call;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SessionCoordinatorTest {

    private final ExecutorService exec = Executors.newFixedThreadPool(4);
    private final FakeTranslationService translator = new FakeTranslationService();

    @AfterEach
    void tearDown() {
        exec.shutdownNow();
    }

    private SessionCoordinator coordinator(long timeoutMs) {
        return new SessionCoordinator("s1", translator, exec, null, timeoutMs);
    }

    private static SegmentSnapshot segment(String speakerId, String text, Language language) {
        long now = System.nanoTime();
        return new SegmentSnapshot("seg-1", speakerId, text, language, now, true, 0.95,
                SegmentState.TRANSLATING, now, 0);
    }

    @Test
    void translatesOnlyForOtherLanguageListeners() {
        SessionCoordinator c = coordinator(1000);
        c.register(new StubParticipant("x", Language.EN));
        c.register(new StubParticipant("y", Language.ES));
        c.register(new StubParticipant("z", Language.FR));
        c.register(new StubParticipant("w", Language.EN));

        Map<String, TranslationResult> results = c.coordinate("x", segment("x", "hello", Language.EN));

        assertThat(results).containsOnlyKeys("y", "z");
        assertThat(results.get("y").translatedText()).isEqualTo("[es] hello");
        assertThat(results.get("y").speakerId()).isEqualTo("x");
        assertThat(results.get("y").listenerId()).isEqualTo("y");
        assertThat(results.get("z").targetLanguage()).isEqualTo(Language.FR);
        assertThat(translator.calls()).extracting(Call::target).containsExactlyInAnyOrder(Language.ES, Language.FR);
    }

    @Test
    void sameLanguageSessionIssuesNoRequests() {
        SessionCoordinator c = coordinator(1000);
        c.register(new StubParticipant("x", Language.EN));
        c.register(new StubParticipant("y", Language.EN));

        Map<String, TranslationResult> results = c.coordinate("x", segment("x", "hello", Language.EN));

        assertThat(results).isEmpty();
        assertThat(translator.calls()).isEmpty();
    }

    @Test
    void neverTranslatesForTheSpeaker() {
        SessionCoordinator c = coordinator(1000);
        c.register(new StubParticipant("x", Language.EN));

        // Segment recognized as Spanish but spoken by x: x still gets nothing
        Map<String, TranslationResult> results = c.coordinate("x", segment("x", "hola", Language.ES));

        assertThat(results).isEmpty();
    }

    @Test
    void failedListenerIsAbsentOthersSucceed() {
        translator.failFor(Language.FR);
        SessionCoordinator c = coordinator(1000);
        c.register(new StubParticipant("x", Language.EN));
        c.register(new StubParticipant("y", Language.ES));
        c.register(new StubParticipant("z", Language.FR));

        Map<String, TranslationResult> results = c.coordinate("x", segment("x", "hello", Language.EN));

        assertThat(results).containsOnlyKeys("y");
    }

    @Test
    void slowListenerTimesOutWithoutDelayingOthers() {
        translator.delayFor(Language.FR, 1_000);
        SessionCoordinator c = coordinator(150);
        c.register(new StubParticipant("x", Language.EN));
        c.register(new StubParticipant("y", Language.ES));
        c.register(new StubParticipant("z", Language.FR));

        long t0 = System.nanoTime();
        Map<String, TranslationResult> results = c.coordinate("x", segment("x", "hello", Language.EN));
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;

        assertThat(results).containsOnlyKeys("y");
        assertThat(elapsedMs).isLessThan(800);
    }

    @Test
    void dispatchDeliversEachResultToItsListener() {
        SessionCoordinator c = coordinator(1000);
        StubParticipant y = new StubParticipant("y", Language.ES);
        StubParticipant z = new StubParticipant("z", Language.FR);
        c.register(new StubParticipant("x", Language.EN));
        c.register(y);
        c.register(z);

        c.onSegmentReady(segment("x", "good night", Language.EN));

        await().atMost(Duration.ofSeconds(1)).until(() -> y.delivered.size() == 1 && z.delivered.size() == 1);
        assertThat(y.delivered.get(0).translatedText()).isEqualTo("[es] good night");
        assertThat(z.delivered.get(0).translatedText()).isEqualTo("[fr] good night");
    }

    @Test
    void deliveryFailureIsIsolated() {
        SessionCoordinator c = coordinator(1000);
        StubParticipant y = new StubParticipant("y", Language.ES);
        StubParticipant z = new StubParticipant("z", Language.FR);
        y.failOnDeliver = true;
        c.register(new StubParticipant("x", Language.EN));
        c.register(y);
        c.register(z);

        c.onSegmentReady(segment("x", "still works", Language.EN));

        await().atMost(Duration.ofSeconds(1)).until(() -> z.delivered.size() == 1);
    }

    @Test
    void dispatchFailsWhenEveryTranslationFails() {
        translator.failFor(Language.ES).failFor(Language.FR);
        SessionCoordinator c = coordinator(1000);
        c.register(new StubParticipant("x", Language.EN));
        c.register(new StubParticipant("y", Language.ES));
        c.register(new StubParticipant("z", Language.FR));

        assertThatThrownBy(() -> c.onSegmentReady(segment("x", "lost", Language.EN)))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("All translations failed");
    }

    @Test
    void dispatchWithNothingToTranslateSucceeds() {
        SessionCoordinator c = coordinator(1000);
        c.register(new StubParticipant("x", Language.EN));
        c.register(new StubParticipant("y", Language.EN));

        c.onSegmentReady(segment("x", "hi", Language.EN));

        assertThat(translator.calls()).isEmpty();
    }

    @Test
    void unregisteredParticipantGetsNothing() {
        SessionCoordinator c = coordinator(1000);
        c.register(new StubParticipant("x", Language.EN));
        c.register(new StubParticipant("y", Language.ES));
        c.unregister("y");

        assertThat(c.coordinate("x", segment("x", "hello", Language.EN))).isEmpty();
        assertThat(c.participants()).extracting(SessionParticipant::participantId).containsExactly("x");
    }

    @Test
    void resultsCarryNonNegativeLatencies() {
        SessionCoordinator c = coordinator(1000);
        c.register(new StubParticipant("x", Language.EN));
        c.register(new StubParticipant("y", Language.IG));

        TranslationResult r = c.coordinate("x", segment("x", "welcome", Language.EN)).get("y");

        assertThat(r.translationLatencyMs()).isNotNegative();
        assertThat(r.totalLatencyMs()).isGreaterThanOrEqualTo(r.translationLatencyMs());
        assertThat(r.originalText()).isEqualTo("welcome");
        assertThat(r.segmentId()).isEqualTo("seg-1");
    }

    @Test
    void saturatedTranslationPoolRejectsInsteadOfRunningOnCaller() {
        ThreadPoolProperties pools = new ThreadPoolProperties();
        pools.getTranslation().setCorePoolSize(1);
        pools.getTranslation().setMaxPoolSize(1);
        pools.getTranslation().setQueueCapacity(0);
        ThreadPoolTaskExecutor translationPool =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(pools).translationExecutor();
        translator.delayFor(Language.ES, 1000).delayFor(Language.FR, 1000).delayFor(Language.YO, 1000);
        SessionCoordinator c = new SessionCoordinator("s1", translator, translationPool, null, 300);
        c.register(new StubParticipant("x", Language.EN));
        c.register(new StubParticipant("y", Language.ES));
        c.register(new StubParticipant("z", Language.FR));
        c.register(new StubParticipant("w", Language.YO));
        try {
            long start = System.nanoTime();

            Map<String, TranslationResult> results = c.coordinate("x", segment("x", "hello", Language.EN));

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertThat(results).isEmpty();
            assertThat(elapsedMs).isLessThan(800);
            assertThat(translator.calls()).hasSize(1);
        } finally {
            translationPool.shutdown();
        }
    }
}
