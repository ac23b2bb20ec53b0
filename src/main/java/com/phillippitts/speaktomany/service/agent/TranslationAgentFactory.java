package com.phillippitts.speaktomany.service.agent;

import com.phillippitts.speaktomany.config.properties.RecognitionProperties;
import com.phillippitts.speaktomany.domain.ParticipantProfile;
import com.phillippitts.speaktomany.exception.SessionException;
import com.phillippitts.speaktomany.service.recognition.RecognizerFactory;
import com.phillippitts.speaktomany.service.recognition.RecognizerWatchdog;
import com.phillippitts.speaktomany.service.session.SessionRegistry;
import com.phillippitts.speaktomany.service.session.TranslationSession;
import com.phillippitts.speaktomany.service.translation.SpeechSynthesizer;
import com.phillippitts.speaktomany.service.transport.AudioTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Builds agents with the application's synthesizer, recognition settings and watchdog, and joins
 * them to sessions.
 */
@Component
public class TranslationAgentFactory {

    private static final Logger LOG = LogManager.getLogger(TranslationAgentFactory.class);
    private static final int MAX_JOIN_ATTEMPTS = 3;

    private final SessionRegistry registry;
    private final SpeechSynthesizer synthesizer;
    private final RecognitionProperties recognitionProps;
    private final ApplicationEventPublisher publisher;
    private final ObjectProvider<RecognizerWatchdog> watchdog;

    public TranslationAgentFactory(SessionRegistry registry,
                                   SpeechSynthesizer synthesizer,
                                   RecognitionProperties recognitionProps,
                                   ApplicationEventPublisher publisher,
                                   ObjectProvider<RecognizerWatchdog> watchdog) {
        this.registry = registry;
        this.synthesizer = synthesizer;
        this.recognitionProps = recognitionProps;
        this.publisher = publisher;
        this.watchdog = watchdog;
    }

    public TranslationAgent create(ParticipantProfile profile, AudioTransport transport, RecognizerFactory recognizers) {
        return new TranslationAgent(profile, transport, recognizers, synthesizer, recognitionProps, publisher,
                watchdog.getIfAvailable());
    }

    /**
     * Joins a participant described by the JSON metadata it published on the transport.
     *
     * @throws com.phillippitts.speaktomany.exception.SpeakToManyException if the metadata is
     *         malformed or names no supported language; no session is touched in that case
     * @see ParticipantMetadataParser
     */
    public TranslationAgent join(String sessionId, String participantId, String metadataJson,
                                 AudioTransport transport, RecognizerFactory recognizers) {
        ParticipantProfile profile = ParticipantMetadataParser.parse(participantId, metadataJson);
        LOG.debug("Resolved participant {} to language {}", participantId, profile.language());
        return join(sessionId, profile, transport, recognizers);
    }

    /**
     * Creates an agent and starts it in the session with this id, creating the session if needed.
     * Retries when the session was torn down between lookup and attach.
     *
     * @throws SessionException if the participant already has an agent in the session
     */
    public TranslationAgent join(String sessionId, ParticipantProfile profile, AudioTransport transport,
                                 RecognizerFactory recognizers) {
        TranslationAgent agent = create(profile, transport, recognizers);
        for (int attempt = 1; attempt <= MAX_JOIN_ATTEMPTS; attempt++) {
            TranslationSession session = registry.open(sessionId);
            try {
                agent.start(session);
                return agent;
            } catch (SessionException e) {
                if (!session.isClosed()) {
                    throw e;
                }
                LOG.debug("Session {} closed during join of {}; retrying ({}/{})", sessionId,
                        profile.participantId(), attempt, MAX_JOIN_ATTEMPTS);
            }
        }
        throw new SessionException("Could not join " + profile.participantId() + " after "
                + MAX_JOIN_ATTEMPTS + " attempts", sessionId);
    }
}
