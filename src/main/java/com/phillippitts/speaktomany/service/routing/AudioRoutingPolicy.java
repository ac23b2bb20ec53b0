package com.phillippitts.speaktomany.service.routing;

import com.phillippitts.speaktomany.domain.AudioRoute;
import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.ParticipantAudioConfig;
import com.phillippitts.speaktomany.domain.StreamType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session-wide audio routing policy: who hears whose original stream, whose translation,
 * and whose raw stream is muted.
 *
 * <p><b>Consistency:</b> the entire state is one immutable {@link RoutingTable}. Every mutation
 * (join, leave, speaker change, pause/resume) takes the policy lock, recomputes a complete new
 * table from the current inputs and swaps it in. Readers use the latest published table without
 * locking and never see a half-applied change.
 *
 * <p><b>Current speaker:</b> a listener hears a same-language source's raw stream only while that
 * source is the current speaker. Different-language sources stay muted regardless; their
 * translation is played instead. If translation fails the listener hears silence.
 *
 * <p>Each new table is pushed to subscribed {@link RoutingTableListener}s, which translate it
 * into transport mute/unmute calls.
 */
public final class AudioRoutingPolicy {

    private static final Logger LOG = LogManager.getLogger(AudioRoutingPolicy.class);

    private final String sessionId;
    private final Lock lock = new ReentrantLock();
    private final List<RoutingTableListener> subscribers = new CopyOnWriteArrayList<>();
    private volatile RoutingTable table = RoutingTable.empty();

    public AudioRoutingPolicy(String sessionId) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    }

    /**
     * Adds or re-languages a participant and recomputes the table. Registering an id again with
     * the same language is a no-op.
     */
    public void register(String participantId, Language language) {
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(language, "language");
        lock.lock();
        try {
            RoutingTable current = table;
            if (language == current.roster().get(participantId)) {
                return;
            }
            Map<String, Language> roster = new LinkedHashMap<>(current.roster());
            roster.put(participantId, language);
            publish(RoutingTable.compute(current.version() + 1, roster,
                    current.currentSpeaker().orElse(null), current.pausedRouteIds()));
            LOG.info("Routing: registered {} ({}) in session {}; participants={}",
                    participantId, language, sessionId, roster.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a participant and recomputes the table. Routes touching the participant disappear
     * and a current speaker equal to the participant is cleared.
     */
    public void unregister(String participantId) {
        lock.lock();
        try {
            RoutingTable current = table;
            if (!current.roster().containsKey(participantId)) {
                return;
            }
            Map<String, Language> roster = new LinkedHashMap<>(current.roster());
            roster.remove(participantId);
            publish(RoutingTable.compute(current.version() + 1, roster,
                    current.currentSpeaker().orElse(null), current.pausedRouteIds()));
            LOG.info("Routing: unregistered {} from session {}; participants={}",
                    participantId, sessionId, roster.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the current speaker, or clears it when {@code participantId} is null. Unknown
     * participants are ignored.
     */
    public void setCurrentSpeaker(String participantId) {
        lock.lock();
        try {
            RoutingTable current = table;
            if (participantId != null && !current.roster().containsKey(participantId)) {
                LOG.warn("Routing: ignoring speaker {} not registered in session {}", participantId, sessionId);
                return;
            }
            if (Objects.equals(participantId, current.currentSpeaker().orElse(null))) {
                return;
            }
            publish(RoutingTable.compute(current.version() + 1, current.roster(),
                    participantId, current.pausedRouteIds()));
            LOG.debug("Routing: current speaker {} in session {}", participantId == null ? "none" : participantId,
                    sessionId);
        } finally {
            lock.unlock();
        }
    }

    public void clearCurrentSpeaker() {
        setCurrentSpeaker(null);
    }

    /**
     * Clears the current speaker only if it is still {@code participantId}, so a late "stopped"
     * signal cannot silence a newer speaker.
     */
    public void clearCurrentSpeakerIf(String participantId) {
        lock.lock();
        try {
            if (table.currentSpeaker().filter(s -> s.equals(participantId)).isPresent()) {
                setCurrentSpeaker(null);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pauses one route. A paused route stays paused across recomputes until resumed or until
     * either endpoint leaves.
     *
     * @return true if the route exists and was active
     */
    public boolean pauseRoute(String sourceId, String targetId, StreamType type) {
        return setRouteActive(sourceId, targetId, type, false);
    }

    /**
     * @return true if the route exists and was paused
     */
    public boolean resumeRoute(String sourceId, String targetId, StreamType type) {
        return setRouteActive(sourceId, targetId, type, true);
    }

    private boolean setRouteActive(String sourceId, String targetId, StreamType type, boolean active) {
        lock.lock();
        try {
            RoutingTable current = table;
            Optional<AudioRoute> route = current.route(sourceId, targetId, type);
            if (route.isEmpty() || route.get().active() == active) {
                return false;
            }
            Set<String> paused = new TreeSet<>(current.pausedRouteIds());
            if (active) {
                paused.remove(route.get().routeId());
            } else {
                paused.add(route.get().routeId());
            }
            publish(RoutingTable.compute(current.version() + 1, current.roster(),
                    current.currentSpeaker().orElse(null), paused));
            LOG.info("Routing: {} route {}", active ? "resumed" : "paused", route.get().routeId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void publish(RoutingTable next) {
        table = next;
        for (RoutingTableListener subscriber : subscribers) {
            try {
                subscriber.onRoutingChanged(next);
            } catch (RuntimeException e) {
                LOG.warn("Routing subscriber failed on table v{}: {}", next.version(), e.toString());
            }
        }
    }

    /**
     * Subscribes to table changes and immediately delivers the current table.
     */
    public void subscribe(RoutingTableListener listener) {
        Objects.requireNonNull(listener, "listener");
        lock.lock();
        try {
            subscribers.add(listener);
            listener.onRoutingChanged(table);
        } finally {
            lock.unlock();
        }
    }

    public void unsubscribe(RoutingTableListener listener) {
        subscribers.remove(listener);
    }

    public RoutingTable snapshot() {
        return table;
    }

    public Optional<ParticipantAudioConfig> getConfig(String participantId) {
        return table.config(participantId);
    }

    public Optional<Language> languageOf(String participantId) {
        return Optional.ofNullable(table.roster().get(participantId));
    }

    public Optional<String> currentSpeaker() {
        return table.currentSpeaker();
    }

    public List<AudioRoute> routes() {
        return table.routes();
    }

    public List<AudioRoute> activeRoutesTo(String listenerId) {
        return table.activeRoutesTo(listenerId);
    }

    public boolean isOriginalAudible(String listenerId, String sourceId) {
        return table.isOriginalAudible(listenerId, sourceId);
    }

    public boolean isTranslationActive(String sourceId, String listenerId) {
        return table.isTranslationActive(sourceId, listenerId);
    }

    public RoutingInfo routingInfo() {
        return table.info();
    }
}
