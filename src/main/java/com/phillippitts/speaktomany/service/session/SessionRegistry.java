package com.phillippitts.speaktomany.service.session;

import com.phillippitts.speaktomany.config.properties.TranslationServiceProperties;
import com.phillippitts.speaktomany.service.buffer.TranslationBufferFactory;
import com.phillippitts.speaktomany.service.metrics.TranslationMetricsPublisher;
import com.phillippitts.speaktomany.service.routing.AudioRoutingPolicy;
import com.phillippitts.speaktomany.service.translation.TranslationService;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live sessions by id. A session is created when the first agent opens it and destroyed when the
 * last agent detaches.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final TranslationBufferFactory bufferFactory;
    private final TranslationService translationService;
    private final Executor translationExecutor;
    private final TranslationMetricsPublisher metrics;
    private final long requestTimeoutMs;

    private final Map<String, TranslationSession> sessions = new ConcurrentHashMap<>();
    private final Lock lock = new ReentrantLock();

    public SessionRegistry(TranslationBufferFactory bufferFactory,
                           TranslationService translationService,
                           @Qualifier("translationExecutor") Executor translationExecutor,
                           TranslationMetricsPublisher metrics,
                           TranslationServiceProperties translationProps) {
        this.bufferFactory = Objects.requireNonNull(bufferFactory, "bufferFactory");
        this.translationService = Objects.requireNonNull(translationService, "translationService");
        this.translationExecutor = Objects.requireNonNull(translationExecutor, "translationExecutor");
        this.metrics = metrics == null ? TranslationMetricsPublisher.NOOP : metrics;
        this.requestTimeoutMs = translationProps.getRequestTimeoutMs();
    }

    /**
     * Returns the live session with this id, creating and starting it if none exists.
     */
    public TranslationSession open(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        lock.lock();
        try {
            TranslationSession existing = sessions.get(sessionId);
            if (existing != null && !existing.isClosed()) {
                return existing;
            }
            TranslationSession session = new TranslationSession(sessionId,
                    bufferFactory.create(sessionId),
                    new AudioRoutingPolicy(sessionId),
                    new SessionCoordinator(sessionId, translationService, translationExecutor, metrics,
                            requestTimeoutMs),
                    this::onSessionEmpty);
            session.start();
            sessions.put(sessionId, session);
            LOG.info("Session {} created; active sessions={}", sessionId, sessions.size());
            return session;
        } finally {
            lock.unlock();
        }
    }

    public Optional<TranslationSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int activeSessions() {
        return sessions.size();
    }

    public List<TranslationSession> sessions() {
        return new ArrayList<>(sessions.values());
    }

    void onSessionEmpty(TranslationSession session) {
        lock.lock();
        try {
            if (session.closeIfEmpty()) {
                sessions.remove(session.id(), session);
                LOG.info("Session {} destroyed; active sessions={}", session.id(), sessions.size());
            }
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            for (TranslationSession session : sessions.values()) {
                session.close();
            }
            sessions.clear();
        } finally {
            lock.unlock();
        }
    }
}
