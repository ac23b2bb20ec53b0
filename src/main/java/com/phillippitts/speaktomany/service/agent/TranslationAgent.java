package com.phillippitts.speaktomany.service.agent;

import com.phillippitts.speaktomany.config.properties.RecognitionProperties;
import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.ParticipantAudioConfig;
import com.phillippitts.speaktomany.domain.ParticipantProfile;
import com.phillippitts.speaktomany.domain.TranslationPreferences;
import com.phillippitts.speaktomany.domain.TranslationResult;
import com.phillippitts.speaktomany.exception.SessionException;
import com.phillippitts.speaktomany.service.recognition.RecognizerFactory;
import com.phillippitts.speaktomany.service.recognition.RecognizerWatchdog;
import com.phillippitts.speaktomany.service.recognition.SpeechRecognizer;
import com.phillippitts.speaktomany.service.recognition.StreamingTranscriptAdapter;
import com.phillippitts.speaktomany.service.routing.AudioRoutingPolicy;
import com.phillippitts.speaktomany.service.routing.RoutingTable;
import com.phillippitts.speaktomany.service.routing.RoutingTableListener;
import com.phillippitts.speaktomany.service.session.SessionParticipant;
import com.phillippitts.speaktomany.service.session.TranslationSession;
import com.phillippitts.speaktomany.service.translation.SpeechSynthesizer;
import com.phillippitts.speaktomany.service.transport.AudioTransport;
import com.phillippitts.speaktomany.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-user translation agent: one instance per participant, parameterized by that participant's
 * language.
 *
 * <p><b>Inbound:</b> tracks which remote participants are in the call, registers them with the
 * session's routing policy and, for the speakers it owns, feeds their audio through a
 * {@link StreamingTranscriptAdapter} into the session buffer. The agent's own outbound
 * translation track, and any other agent's, is never recognized.
 *
 * <p><b>Outbound:</b> receives finished translations addressed to its participant from the
 * coordinator, synthesizes them with the participant's voice and plays them. Results for an
 * inactive translation route are dropped. Synthesis failure means silence for that segment.
 *
 * <p><b>Routing:</b> subscribes to routing tables and applies the raw-stream mute/unmute
 * decisions for its participant to the transport, sending only changes.
 */
public class TranslationAgent implements SessionParticipant {

    private static final Logger LOG = LogManager.getLogger(TranslationAgent.class);

    private final ParticipantProfile profile;
    private final AudioTransport transport;
    private final RecognizerFactory recognizerFactory;
    private final SpeechSynthesizer synthesizer;
    private final RecognitionProperties recognitionProps;
    private final ApplicationEventPublisher publisher;
    private final RecognizerWatchdog watchdog;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile TranslationSession session;
    private volatile String outboundTrackId;

    private final Map<String, Language> remotes = new ConcurrentHashMap<>();
    private final Map<String, String> remoteTracks = new ConcurrentHashMap<>();
    private final Map<String, StreamingTranscriptAdapter> adapters = new ConcurrentHashMap<>();
    private final Lock adapterLock = new ReentrantLock();
    private final Lock playbackLock = new ReentrantLock();

    private final Map<String, Boolean> appliedAudibility = new HashMap<>();
    private final RoutingTableListener routingListener = this::applyRouting;

    private final AtomicLong played = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    /**
     * @param watchdog may be null when recognizer supervision is disabled
     */
    public TranslationAgent(ParticipantProfile profile,
                            AudioTransport transport,
                            RecognizerFactory recognizerFactory,
                            SpeechSynthesizer synthesizer,
                            RecognitionProperties recognitionProps,
                            ApplicationEventPublisher publisher,
                            RecognizerWatchdog watchdog) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.recognizerFactory = Objects.requireNonNull(recognizerFactory, "recognizerFactory");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.recognitionProps = Objects.requireNonNull(recognitionProps, "recognitionProps");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.watchdog = watchdog;
    }

    @Override
    public String participantId() {
        return profile.participantId();
    }

    @Override
    public Language language() {
        return profile.language();
    }

    @Override
    public TranslationPreferences preferences() {
        return profile.preferences();
    }

    public ParticipantProfile profile() {
        return profile;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Attaches to {@code session}, publishes the outbound translation track and subscribes to
     * routing changes. If publishing or subscribing fails the agent is detached again before the
     * exception propagates.
     *
     * @throws SessionException if the agent is already running or the session is closed
     */
    public void start(TranslationSession session) {
        Objects.requireNonNull(session, "session");
        if (running.get()) {
            throw new SessionException("Agent for " + participantId() + " already started", session.id());
        }
        session.attach(this);
        this.session = session;
        running.set(true);

        try {
            String trackId = transport.publishTranslationTrack(participantId());
            outboundTrackId = trackId;
            session.markTranslationTrack(trackId);
            session.routing().subscribe(routingListener);
        } catch (RuntimeException e) {
            LOG.error("Agent start failed for {} in session {}; detaching", participantId(), session.id(), e);
            stop();
            throw e;
        }
        LOG.info("Agent started: participant={}, language={}, session={}", participantId(), language(),
                session.id());
    }

    /**
     * Detaches from routing and the coordinator first, then closes recognizers and withdraws the
     * outbound track. Idempotent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        TranslationSession s = session;
        s.routing().unsubscribe(routingListener);
        s.detach(this);

        adapterLock.lock();
        try {
            for (String speakerId : new ArrayList<>(adapters.keySet())) {
                closeRecognition(speakerId);
            }
        } finally {
            adapterLock.unlock();
        }

        String trackId = outboundTrackId;
        outboundTrackId = null;
        if (trackId != null) {
            s.unmarkTranslationTrack(trackId);
            try {
                transport.unpublishTrack(trackId);
            } catch (RuntimeException e) {
                LOG.warn("Failed to unpublish translation track {} for {}: {}", trackId, participantId(), e.toString());
            }
        }
        remotes.clear();
        remoteTracks.clear();
        synchronized (appliedAudibility) {
            appliedAudibility.clear();
        }
        LOG.info("Agent stopped: participant={}, played={}, dropped={}", participantId(), played.get(), dropped.get());
    }

    /**
     * A participant joined the call. Registers them with routing and claims their recognition if
     * no other agent has.
     */
    public void onRemoteParticipantJoined(String remoteId, Language remoteLanguage) {
        if (!running.get()) {
            return;
        }
        if (participantId().equals(remoteId)) {
            LOG.debug("Ignoring join event for own participant {}", remoteId);
            return;
        }
        remotes.put(remoteId, remoteLanguage);
        session.routing().register(remoteId, remoteLanguage);
        if (session.claimRecognition(remoteId, participantId())) {
            openRecognitionIfTrackKnown(remoteId);
        }
    }

    /**
     * A participant left. Unregisters them from routing and closes their recognizer if owned.
     */
    public void onRemoteParticipantLeft(String remoteId) {
        if (!running.get() || participantId().equals(remoteId)) {
            return;
        }
        remotes.remove(remoteId);
        remoteTracks.remove(remoteId);
        session.routing().unregister(remoteId);
        adapterLock.lock();
        try {
            closeRecognition(remoteId);
        } finally {
            adapterLock.unlock();
        }
        session.releaseRecognition(remoteId, participantId());
    }

    /**
     * A track was published. Translation tracks are excluded from recognition; a remote
     * speaker's audio track starts recognition if this agent owns the speaker.
     */
    public void onTrackPublished(String publisherId, String trackId) {
        if (!running.get()) {
            return;
        }
        if (Objects.equals(trackId, outboundTrackId) || session.isTranslationTrack(trackId)) {
            LOG.debug("Not recognizing translation track {}", trackId);
            return;
        }
        if (participantId().equals(publisherId)) {
            return;
        }
        remoteTracks.put(publisherId, trackId);
        if (remotes.containsKey(publisherId) && session.isRecognitionOwner(publisherId, participantId())) {
            openRecognitionIfTrackKnown(publisherId);
        }
    }

    public void onSpeakingStarted(String speakerId) {
        if (!running.get()) {
            return;
        }
        AudioRoutingPolicy routing = session.routing();
        if (routing.languageOf(speakerId).isEmpty()) {
            LOG.debug("Speaking signal for unknown participant {}", speakerId);
            return;
        }
        routing.setCurrentSpeaker(speakerId);
    }

    public void onSpeakingStopped(String speakerId) {
        if (!running.get()) {
            return;
        }
        session.routing().clearCurrentSpeakerIf(speakerId);
    }

    @Override
    public boolean hasRemote(String speakerId) {
        return remotes.containsKey(speakerId);
    }

    @Override
    public void takeOverRecognition(String speakerId) {
        if (running.get() && remotes.containsKey(speakerId)) {
            openRecognitionIfTrackKnown(speakerId);
        }
    }

    /**
     * Synthesizes and plays a finished translation for this agent's participant. Results not
     * addressed here, results of the participant's own speech and results whose translation route
     * is paused or gone are dropped.
     */
    @Override
    public void deliver(TranslationResult result) {
        Objects.requireNonNull(result, "result");
        if (!running.get()) {
            drop(result, "agent not running");
            return;
        }
        if (!participantId().equals(result.listenerId())) {
            drop(result, "addressed to " + result.listenerId());
            return;
        }
        if (participantId().equals(result.speakerId())) {
            drop(result, "own speech");
            return;
        }
        if (!session.routing().isTranslationActive(result.speakerId(), participantId())) {
            drop(result, "translation route inactive");
            return;
        }
        if (result.translatedText().isBlank()) {
            drop(result, "empty translation");
            return;
        }

        ThreadContext.put("participantId", participantId());
        ThreadContext.put("segmentId", result.segmentId());
        playbackLock.lock();
        try {
            byte[] audio;
            try {
                audio = synthesizer.synthesize(result.translatedText(), language(), profile.voice());
            } catch (RuntimeException e) {
                LOG.warn("Synthesis failed for segment {}; listener {} hears silence: {}",
                        result.segmentId(), participantId(), e.getMessage());
                dropped.incrementAndGet();
                return;
            }
            transport.play(participantId(), audio);
            played.incrementAndGet();
            LOG.info("Played translation {}->{} for segment {} (translation={}ms, total={}ms): '{}'",
                    result.sourceLanguage(), result.targetLanguage(), result.segmentId(),
                    result.translationLatencyMs(), result.totalLatencyMs(),
                    LogSanitizer.preview(result.translatedText()));
        } finally {
            playbackLock.unlock();
            ThreadContext.remove("participantId");
            ThreadContext.remove("segmentId");
        }
    }

    private void drop(TranslationResult result, String reason) {
        dropped.incrementAndGet();
        LOG.debug("Dropping result for segment {} at {}: {}", result.segmentId(), participantId(), reason);
    }

    public AgentStats stats() {
        return new AgentStats(participantId(), language(), running.get(), remotes.size(),
                new ArrayList<>(new TreeSet<>(adapters.keySet())), played.get(), dropped.get());
    }

    private void openRecognitionIfTrackKnown(String speakerId) {
        String trackId = remoteTracks.get(speakerId);
        Language speakerLanguage = remotes.get(speakerId);
        if (trackId == null || speakerLanguage == null) {
            return;
        }
        adapterLock.lock();
        try {
            if (!running.get() || adapters.containsKey(speakerId)) {
                return;
            }
            SpeechRecognizer recognizer = recognizerFactory.create(speakerId, trackId, speakerLanguage);
            StreamingTranscriptAdapter adapter = new StreamingTranscriptAdapter(session.id(), recognizer,
                    session.buffer(), recognitionProps, publisher);
            try {
                adapter.start();
            } catch (RuntimeException e) {
                LOG.error("Could not start recognition for {} ({}): {}", speakerId, speakerLanguage, e.toString());
                recognizer.close();
                return;
            }
            adapters.put(speakerId, adapter);
            if (watchdog != null) {
                watchdog.register(adapter.key(), recognizer);
            }
            LOG.info("Agent {} recognizing {} ({}) on track {}", participantId(), speakerId, speakerLanguage, trackId);
        } finally {
            adapterLock.unlock();
        }
    }

    // Caller holds adapterLock
    private void closeRecognition(String speakerId) {
        StreamingTranscriptAdapter adapter = adapters.remove(speakerId);
        if (adapter == null) {
            return;
        }
        if (watchdog != null) {
            watchdog.unregister(adapter.key());
        }
        adapter.close();
    }

    private void applyRouting(RoutingTable table) {
        ParticipantAudioConfig config = table.config(participantId()).orElse(null);
        if (config == null) {
            return;
        }
        Set<String> sources = new HashSet<>(config.hearOriginal());
        sources.addAll(config.hearTranslated());
        Map<String, Boolean> changes = new LinkedHashMap<>();
        synchronized (appliedAudibility) {
            appliedAudibility.keySet().retainAll(sources);
            for (String source : sources) {
                boolean audible = table.isOriginalAudible(participantId(), source);
                Boolean previous = appliedAudibility.put(source, audible);
                if (previous == null || previous != audible) {
                    changes.put(source, audible);
                }
            }
        }
        changes.forEach((source, audible) -> {
            try {
                transport.setOriginalAudible(participantId(), source, audible);
            } catch (RuntimeException e) {
                LOG.warn("Transport rejected audibility change for {} <- {}: {}", participantId(), source,
                        e.toString());
            }
        });
    }
}
