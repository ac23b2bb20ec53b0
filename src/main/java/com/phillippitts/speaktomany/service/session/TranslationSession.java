package com.phillippitts.speaktomany.service.session;

import com.phillippitts.speaktomany.exception.SessionException;
import com.phillippitts.speaktomany.service.buffer.TranslationBuffer;
import com.phillippitts.speaktomany.service.routing.AudioRoutingPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Shared state of one call: the translation buffer, the routing policy, the coordinator and
 * the set of attached agents.
 *
 * <p><b>Recognition ownership:</b> each remote speaker is recognized by exactly one agent. The
 * first agent to claim a speaker owns it; when that agent detaches, ownership passes to another
 * attached agent that knows the speaker.
 *
 * <p><b>Outbound tracks:</b> every track an agent publishes for translated speech is recorded
 * here so no agent ever feeds translated audio back into recognition.
 *
 * <p>The session closes itself (through its owner callback) when the last agent detaches.
 */
public final class TranslationSession {

    private static final Logger LOG = LogManager.getLogger(TranslationSession.class);

    private final String id;
    private final TranslationBuffer buffer;
    private final AudioRoutingPolicy routing;
    private final SessionCoordinator coordinator;
    private final Consumer<TranslationSession> onEmpty;

    private final Lock lock = new ReentrantLock();
    private final Map<String, SessionParticipant> agents = new LinkedHashMap<>();
    private final Map<String, String> recognitionOwners = new ConcurrentHashMap<>();
    private final Set<String> translationTracks = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    public TranslationSession(String id,
                              TranslationBuffer buffer,
                              AudioRoutingPolicy routing,
                              SessionCoordinator coordinator,
                              Consumer<TranslationSession> onEmpty) {
        this.id = Objects.requireNonNull(id, "id");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.routing = Objects.requireNonNull(routing, "routing");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.onEmpty = onEmpty == null ? s -> { } : onEmpty;
    }

    public String id() {
        return id;
    }

    public TranslationBuffer buffer() {
        return buffer;
    }

    public AudioRoutingPolicy routing() {
        return routing;
    }

    public SessionCoordinator coordinator() {
        return coordinator;
    }

    String coordinatorListenerId() {
        return "coordinator:" + id;
    }

    /** Wires the coordinator to the buffer and starts the buffer. */
    public void start() {
        buffer.registerListener(coordinatorListenerId(), coordinator);
        buffer.start();
        LOG.info("Session {} started", id);
    }

    /**
     * Adds an agent: registers its participant with the routing policy and the coordinator.
     *
     * @throws SessionException if the session is closed or the participant is already attached
     */
    public void attach(SessionParticipant agent) {
        Objects.requireNonNull(agent, "agent");
        lock.lock();
        try {
            if (closed) {
                throw new SessionException("Session is closed", id);
            }
            if (agents.containsKey(agent.participantId())) {
                throw new SessionException("Participant " + agent.participantId() + " already has an agent", id);
            }
            agents.put(agent.participantId(), agent);
            routing.register(agent.participantId(), agent.language());
            coordinator.register(agent);
        } finally {
            lock.unlock();
        }
        LOG.info("Agent for {} ({}) attached to session {}", agent.participantId(), agent.language(), id);
    }

    /**
     * Removes an agent from the routing policy and the coordinator, then hands its recognition
     * claims to the remaining agents. Closes the session through the owner callback when it was
     * the last agent.
     */
    public void detach(SessionParticipant agent) {
        String agentId = agent.participantId();
        List<SessionParticipant> remaining;
        boolean empty;
        lock.lock();
        try {
            if (agents.remove(agentId) == null) {
                return;
            }
            coordinator.unregister(agentId);
            routing.unregister(agentId);
            remaining = new ArrayList<>(agents.values());
            empty = agents.isEmpty();
        } finally {
            lock.unlock();
        }
        LOG.info("Agent for {} detached from session {}; {} agent(s) left", agentId, id, remaining.size());

        for (String speakerId : releaseAll(agentId)) {
            handOver(speakerId, remaining);
        }
        if (empty) {
            onEmpty.accept(this);
        }
    }

    private List<String> releaseAll(String agentId) {
        List<String> released = new ArrayList<>();
        recognitionOwners.forEach((speaker, owner) -> {
            if (owner.equals(agentId) && recognitionOwners.remove(speaker, owner)) {
                released.add(speaker);
            }
        });
        return released;
    }

    private void handOver(String speakerId, List<SessionParticipant> candidates) {
        for (SessionParticipant candidate : candidates) {
            if (candidate.participantId().equals(speakerId) || !candidate.hasRemote(speakerId)) {
                continue;
            }
            if (claimRecognition(speakerId, candidate.participantId())) {
                LOG.info("Recognition of {} handed over to agent {}", speakerId, candidate.participantId());
                candidate.takeOverRecognition(speakerId);
                return;
            }
        }
        LOG.debug("No agent left to recognize {}", speakerId);
    }

    /**
     * Claims recognition of {@code speakerId} for {@code agentId}.
     *
     * @return true if {@code agentId} now owns (or already owned) the speaker
     */
    public boolean claimRecognition(String speakerId, String agentId) {
        String owner = recognitionOwners.putIfAbsent(speakerId, agentId);
        return owner == null || owner.equals(agentId);
    }

    public boolean isRecognitionOwner(String speakerId, String agentId) {
        return agentId.equals(recognitionOwners.get(speakerId));
    }

    /** Drops the claim without handing it over, for a speaker who left the call. */
    public void releaseRecognition(String speakerId, String agentId) {
        recognitionOwners.remove(speakerId, agentId);
    }

    public Optional<String> recognitionOwner(String speakerId) {
        return Optional.ofNullable(recognitionOwners.get(speakerId));
    }

    public void markTranslationTrack(String trackId) {
        if (trackId != null) {
            translationTracks.add(trackId);
        }
    }

    public void unmarkTranslationTrack(String trackId) {
        if (trackId != null) {
            translationTracks.remove(trackId);
        }
    }

    public boolean isTranslationTrack(String trackId) {
        return trackId != null && translationTracks.contains(trackId);
    }

    public Collection<SessionParticipant> agents() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(agents.values()));
        } finally {
            lock.unlock();
        }
    }

    public int agentCount() {
        lock.lock();
        try {
            return agents.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the session if no agent is attached. Stops the buffer.
     *
     * @return true if this call closed the session
     */
    public boolean closeIfEmpty() {
        lock.lock();
        try {
            if (closed || !agents.isEmpty()) {
                return false;
            }
            closed = true;
        } finally {
            lock.unlock();
        }
        shutdown();
        return true;
    }

    /** Closes the session unconditionally. */
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            lock.unlock();
        }
        shutdown();
    }

    private void shutdown() {
        buffer.unregisterListener(coordinatorListenerId());
        buffer.stop();
        recognitionOwners.clear();
        translationTracks.clear();
        LOG.info("Session {} closed", id);
    }
}
