package com.phillippitts.speaktomany.service.agent;

import com.phillippitts.speaktomany.config.properties.RecognitionProperties;
import com.phillippitts.speaktomany.config.properties.RecognizerWatchdogProperties;
import com.phillippitts.speaktomany.config.properties.TranslationBufferProperties;
import com.phillippitts.speaktomany.config.properties.TranslationServiceProperties;
import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.ParticipantProfile;
import com.phillippitts.speaktomany.domain.StreamType;
import com.phillippitts.speaktomany.domain.TranslationResult;
import com.phillippitts.speaktomany.exception.SessionException;
import com.phillippitts.speaktomany.exception.SpeakToManyException;
import com.phillippitts.speaktomany.service.buffer.TranslationBufferFactory;
import com.phillippitts.speaktomany.service.metrics.TranslationMetricsPublisher;
import com.phillippitts.speaktomany.service.recognition.RecognizerWatchdog;
import com.phillippitts.speaktomany.service.session.SessionRegistry;
import com.phillippitts.speaktomany.service.session.TranslationSession;
import com.phillippitts.speaktomany.testutil.EventCapturingPublisher;
import com.phillippitts.speaktomany.testutil.FakeAudioTransport;
import com.phillippitts.speaktomany.testutil.FakeAudioTransport.Playback;
import com.phillippitts.speaktomany.testutil.FakeRecognizerFactory;
import com.phillippitts.speaktomany.testutil.FakeRecognizerFactory.FakeRecognizer;
import com.phillippitts.speaktomany.testutil.FakeSpeechSynthesizer;
import com.phillippitts.speaktomany.testutil.FakeTranslationService;
import com.phillippitts.speaktomany.testutil.FakeTranslationService.Call;
import com.phillippitts.speaktomany.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class TranslationAgentTest {

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final FakeTranslationService translator = new FakeTranslationService();
    private final FakeSpeechSynthesizer synthesizer = new FakeSpeechSynthesizer();
    private final FakeAudioTransport transport = new FakeAudioTransport();
    private final FakeRecognizerFactory recognizers = new FakeRecognizerFactory();
    private final List<TranslationAgent> agents = new ArrayList<>();

    private SessionRegistry registry;
    private RecognizerWatchdog watchdog;
    private TranslationAgentFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(
                new TranslationBufferFactory(new TranslationBufferProperties(300), new SyncExecutor(), publisher,
                        TranslationMetricsPublisher.NOOP),
                translator, new SyncExecutor(), TranslationMetricsPublisher.NOOP, new TranslationServiceProperties());
        watchdog = new RecognizerWatchdog(new RecognizerWatchdogProperties(), publisher);
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("recognizerWatchdog", watchdog);
        factory = new TranslationAgentFactory(registry, synthesizer, new RecognitionProperties(), publisher,
                beans.getBeanProvider(RecognizerWatchdog.class));
    }

    @AfterEach
    void tearDown() {
        agents.forEach(TranslationAgent::stop);
        registry.shutdown();
    }

    private TranslationAgent join(String id, Language language) {
        TranslationAgent agent = factory.join("s1", ParticipantProfile.of(id, language), transport, recognizers);
        agents.add(agent);
        return agent;
    }

    /** Simulates the transport announcing every participant and its tracks to every agent. */
    private void announceAll() {
        for (TranslationAgent listener : agents) {
            for (TranslationAgent other : agents) {
                listener.onRemoteParticipantJoined(other.participantId(), other.language());
            }
        }
        for (TranslationAgent listener : agents) {
            for (TranslationAgent other : agents) {
                listener.onTrackPublished(other.participantId(), "mic-" + other.participantId());
                listener.onTrackPublished(other.participantId(), "translation-" + other.participantId());
            }
        }
    }

    private FakeRecognizer recognizerFor(String speakerId) {
        return recognizers.forSpeaker(speakerId).orElseThrow();
    }

    private TranslationSession session() {
        return registry.find("s1").orElseThrow();
    }

    @Test
    void differentLanguageListenerHearsTranslation() {
        join("x", Language.EN);
        join("y", Language.ES);
        announceAll();

        recognizerFor("x").finalResult("hello", 0.95);

        await().atMost(Duration.ofSeconds(1)).until(() -> transport.playbacksFor("y").size() == 1);
        assertThat(transport.playbacksFor("y").get(0).text()).isEqualTo("[es] hello");
        assertThat(transport.playbacksFor("x")).isEmpty();
        assertThat(translator.calls()).extracting(Call::target).containsExactly(Language.ES);
        assertThat(session().routing().getConfig("y").orElseThrow().mute()).contains("x");
        assertThat(session().routing().getConfig("y").orElseThrow().hearOriginal()).doesNotContain("x");
    }

    @Test
    void sameLanguageListenerHearsOriginalOnlyWhileSpeaking() throws Exception {
        TranslationAgent x = join("x", Language.EN);
        TranslationAgent y = join("y", Language.EN);
        announceAll();

        recognizerFor("x").finalResult("hello", 0.95);
        x.onSpeakingStarted("x");

        assertThat(transport.isAudible("y", "x")).contains(true);
        assertThat(session().routing().getConfig("y").orElseThrow().hearOriginal()).containsExactly("x");

        y.onSpeakingStopped("x");
        assertThat(transport.isAudible("y", "x")).contains(false);

        Thread.sleep(100);
        assertThat(translator.calls()).isEmpty();
        assertThat(transport.playbacks()).isEmpty();
    }

    @Test
    void translationTracksAreNeverRecognized() {
        join("x", Language.EN);
        join("y", Language.ES);
        announceAll();

        assertThat(recognizers.created()).extracting(FakeRecognizer::trackId)
                .containsExactlyInAnyOrder("mic-x", "mic-y");
        assertThat(transport.published()).containsExactlyInAnyOrder("translation-x", "translation-y");
    }

    @Test
    void eachSpeakerIsRecognizedByExactlyOneAgent() {
        join("x", Language.EN);
        join("y", Language.ES);
        join("z", Language.FR);
        announceAll();

        assertThat(recognizers.created()).extracting(FakeRecognizer::participantId)
                .containsExactlyInAnyOrder("x", "y", "z");
        assertThat(watchdog.states()).containsOnlyKeys("s1/x", "s1/y", "s1/z");
    }

    @Test
    void everyOtherLanguageListenerGetsItsOwnTranslation() {
        join("x", Language.EN);
        join("y", Language.ES);
        join("z", Language.FR);
        join("w", Language.EN);
        announceAll();

        recognizerFor("x").finalResult("good evening", 0.9);

        await().atMost(Duration.ofSeconds(1)).until(() -> transport.playbacks().size() == 2);
        assertThat(transport.playbacks()).extracting(Playback::listenerId).containsExactlyInAnyOrder("y", "z");
        assertThat(transport.playbacksFor("z").get(0).text()).isEqualTo("[fr] good evening");
    }

    @Test
    void pausedTranslationRouteIsNotPlayed() throws Exception {
        TranslationAgent y = join("y", Language.ES);
        join("x", Language.EN);
        announceAll();
        session().routing().pauseRoute("x", "y", StreamType.TRANSLATED);

        recognizerFor("x").finalResult("hello", 0.95);

        await().atMost(Duration.ofSeconds(1)).until(() -> y.stats().deliveriesDropped() == 1);
        assertThat(transport.playbacks()).isEmpty();
    }

    @Test
    void synthesisFailureMeansSilence() {
        TranslationAgent y = join("y", Language.ES);
        join("x", Language.EN);
        announceAll();
        synthesizer.setFailing(true);

        recognizerFor("x").finalResult("hello", 0.95);

        await().atMost(Duration.ofSeconds(1)).until(() -> y.stats().deliveriesDropped() == 1);
        assertThat(transport.playbacks()).isEmpty();
        assertThat(y.stats().deliveriesPlayed()).isZero();
    }

    @Test
    void ignoresResultsForOtherListenersAndOwnSpeech() {
        TranslationAgent y = join("y", Language.ES);
        join("x", Language.EN);
        announceAll();

        y.deliver(new TranslationResult("seg", "x", "z", "hi", "salut", Language.EN, Language.FR, 1, 1));
        y.deliver(new TranslationResult("seg", "y", "y", "hola", "hola", Language.ES, Language.ES, 1, 1));

        assertThat(transport.playbacks()).isEmpty();
        assertThat(y.stats().deliveriesDropped()).isEqualTo(2);
    }

    @Test
    void stopDetachesBeforeReleasingResources() {
        join("x", Language.EN);
        TranslationAgent y = join("y", Language.ES);
        announceAll();
        FakeRecognizer xRecognizer = recognizerFor("x");

        y.stop();

        assertThat(session().routing().languageOf("y")).isEmpty();
        assertThat(session().coordinator().participants()).extracting(p -> p.participantId()).containsExactly("x");
        assertThat(xRecognizer.isClosed()).isTrue();
        assertThat(watchdog.states()).doesNotContainKey("s1/x");
        assertThat(transport.unpublished()).containsExactly("translation-y");
        assertThat(y.isRunning()).isFalse();
    }

    @Test
    void recognitionIsHandedOverWhenOwnerLeaves() {
        join("x", Language.EN);
        TranslationAgent y = join("y", Language.ES);
        TranslationAgent z = join("z", Language.FR);
        announceAll();
        assertThat(session().recognitionOwner("x")).contains("y");

        y.stop();

        assertThat(session().recognitionOwner("x")).contains("z");
        FakeRecognizer replacement = recognizerFor("x");
        assertThat(replacement.isClosed()).isFalse();
        assertThat(z.stats().recognizedSpeakers()).contains("x");

        replacement.finalResult("still here", 0.95);
        await().atMost(Duration.ofSeconds(1)).until(() -> transport.playbacksFor("z").size() == 1);
        assertThat(transport.playbacksFor("y")).isEmpty();
    }

    @Test
    void remoteLeaveClosesItsRecognizer() {
        TranslationAgent x = join("x", Language.EN);
        TranslationAgent y = join("y", Language.ES);
        announceAll();
        FakeRecognizer xRecognizer = recognizerFor("x");

        y.onRemoteParticipantLeft("x");
        x.stop();

        assertThat(xRecognizer.isClosed()).isTrue();
        assertThat(session().recognitionOwner("x")).isEmpty();
        assertThat(y.stats().remoteParticipants()).isZero();
    }

    @Test
    void lastAgentLeavingDestroysSession() {
        TranslationAgent x = join("x", Language.EN);
        TranslationAgent y = join("y", Language.ES);

        x.stop();
        y.stop();

        assertThat(registry.find("s1")).isEmpty();
    }

    @Test
    void startingTwiceFails() {
        TranslationAgent x = join("x", Language.EN);

        assertThatThrownBy(() -> x.start(session())).isInstanceOf(SessionException.class);
    }

    @Test
    void duplicateParticipantCannotJoin() {
        join("x", Language.EN);

        assertThatThrownBy(() -> join("x", Language.EN)).isInstanceOf(SessionException.class);
    }

    @Test
    void failedRecognizerStartIsLoggedNotFatal() {
        join("x", Language.EN);
        TranslationAgent y = join("y", Language.ES);
        FakeRecognizerFactory failing = new FakeRecognizerFactory() {
            @Override
            public com.phillippitts.speaktomany.service.recognition.SpeechRecognizer create(
                    String participantId, String trackId, Language language) {
                FakeRecognizer r = (FakeRecognizer) super.create(participantId, trackId, language);
                r.setFailOnStart(true);
                return r;
            }
        };
        TranslationAgent z = factory.join("s1", ParticipantProfile.of("z", Language.FR), transport, failing);
        agents.add(z);

        z.onRemoteParticipantJoined("q", Language.HA);
        z.onTrackPublished("q", "mic-q");

        assertThat(z.stats().recognizedSpeakers()).isEmpty();
        assertThat(y.isRunning()).isTrue();
    }

    @Test
    void failedTrackPublishDetachesAgent() {
        TranslationAgent x = join("x", Language.EN);
        transport.setFailPublish(true);

        assertThatThrownBy(() -> factory.join("s1", ParticipantProfile.of("y", Language.ES), transport, recognizers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("transport down");

        assertThat(session().agentCount()).isEqualTo(1);
        assertThat(session().agents()).containsExactly(x);
        assertThat(session().routing().snapshot().roster()).containsOnlyKeys("x");
        assertThat(session().coordinator().participants())
                .extracting(p -> p.participantId())
                .containsExactly("x");
    }

    @Test
    void failedStartOfOnlyAgentDestroysSession() {
        transport.setFailPublish(true);

        assertThatThrownBy(() -> factory.join("s1", ParticipantProfile.of("x", Language.EN), transport, recognizers))
                .isInstanceOf(IllegalStateException.class);

        assertThat(registry.find("s1")).isEmpty();
    }

    @Test
    void joinsFromTransportMetadata() {
        TranslationAgent y = factory.join("s1", "y",
                "{\"language\":\"es\",\"preferences\":{\"formal_tone\":true}}", transport, recognizers);
        agents.add(y);

        assertThat(y.language()).isEqualTo(Language.ES);
        assertThat(y.preferences().formalTone()).isTrue();
        assertThat(session().agents()).containsExactly(y);
    }

    @Test
    void unsupportedMetadataLanguageNeverOpensSession() {
        assertThatThrownBy(() -> factory.join("s1", "y", "{\"language\":\"de\"}", transport, recognizers))
                .isInstanceOf(SpeakToManyException.class);

        assertThat(registry.find("s1")).isEmpty();
    }
}
