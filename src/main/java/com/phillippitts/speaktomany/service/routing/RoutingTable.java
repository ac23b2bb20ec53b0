package com.phillippitts.speaktomany.service.routing;

import com.phillippitts.speaktomany.domain.AudioRoute;
import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.ParticipantAudioConfig;
import com.phillippitts.speaktomany.domain.StreamType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable routing decision for a whole session at one point in time.
 *
 * <p>A table is always computed in full from the roster, the current speaker and the set of
 * paused route ids; it is never patched. Paused ids and the current speaker are pruned against
 * the roster during computation, so stale references cannot survive a recompute.
 */
public final class RoutingTable {

    private static final RoutingTable EMPTY = new RoutingTable(0, Map.of(), null, Set.of(), Map.of(), Map.of());

    private final long version;
    private final Map<String, Language> roster;
    private final String currentSpeaker;
    private final Set<String> pausedRouteIds;
    private final Map<String, ParticipantAudioConfig> configs;
    private final Map<String, AudioRoute> routes;

    private RoutingTable(long version,
                         Map<String, Language> roster,
                         String currentSpeaker,
                         Set<String> pausedRouteIds,
                         Map<String, ParticipantAudioConfig> configs,
                         Map<String, AudioRoute> routes) {
        this.version = version;
        this.roster = roster;
        this.currentSpeaker = currentSpeaker;
        this.pausedRouteIds = pausedRouteIds;
        this.configs = configs;
        this.routes = routes;
    }

    public static RoutingTable empty() {
        return EMPTY;
    }

    /**
     * Derives configs and routes for every ordered pair of distinct participants.
     *
     * <p>Same language: the source goes to the listener's hear-original set and gets an
     * ORIGINAL route. Different language: the source goes to hear-translated and mute and gets
     * a TRANSLATED route.
     */
    static RoutingTable compute(long version,
                                Map<String, Language> roster,
                                String currentSpeaker,
                                Set<String> pausedRouteIds) {
        Map<String, Language> members = Collections.unmodifiableMap(new LinkedHashMap<>(roster));
        String speaker = currentSpeaker != null && members.containsKey(currentSpeaker) ? currentSpeaker : null;

        Map<String, ParticipantAudioConfig> configs = new LinkedHashMap<>();
        Map<String, AudioRoute> routes = new LinkedHashMap<>();
        Set<String> livePaused = new TreeSet<>();

        for (Map.Entry<String, Language> listener : members.entrySet()) {
            Set<String> hearOriginal = new TreeSet<>();
            Set<String> hearTranslated = new TreeSet<>();
            Set<String> mute = new TreeSet<>();

            for (Map.Entry<String, Language> source : members.entrySet()) {
                if (source.getKey().equals(listener.getKey())) {
                    continue;
                }
                StreamType type;
                if (source.getValue() == listener.getValue()) {
                    hearOriginal.add(source.getKey());
                    type = StreamType.ORIGINAL;
                } else {
                    hearTranslated.add(source.getKey());
                    mute.add(source.getKey());
                    type = StreamType.TRANSLATED;
                }
                String routeId = AudioRoute.routeId(source.getKey(), listener.getKey(), type);
                boolean paused = pausedRouteIds.contains(routeId);
                if (paused) {
                    livePaused.add(routeId);
                }
                routes.put(routeId, new AudioRoute(source.getKey(), listener.getKey(),
                        source.getValue(), listener.getValue(), type, !paused));
            }
            configs.put(listener.getKey(), new ParticipantAudioConfig(listener.getKey(), listener.getValue(),
                    hearOriginal, hearTranslated, mute));
        }

        return new RoutingTable(version, members, speaker, Collections.unmodifiableSet(livePaused),
                Collections.unmodifiableMap(configs), Collections.unmodifiableMap(routes));
    }

    public long version() {
        return version;
    }

    public Map<String, Language> roster() {
        return roster;
    }

    public Optional<String> currentSpeaker() {
        return Optional.ofNullable(currentSpeaker);
    }

    Set<String> pausedRouteIds() {
        return pausedRouteIds;
    }

    public Optional<ParticipantAudioConfig> config(String participantId) {
        return Optional.ofNullable(configs.get(participantId));
    }

    public Map<String, ParticipantAudioConfig> configs() {
        return configs;
    }

    public List<AudioRoute> routes() {
        return List.copyOf(routes.values());
    }

    public Optional<AudioRoute> route(String sourceId, String targetId, StreamType type) {
        return Optional.ofNullable(routes.get(AudioRoute.routeId(sourceId, targetId, type)));
    }

    /** Active routes delivering audio to {@code listenerId}. */
    public List<AudioRoute> activeRoutesTo(String listenerId) {
        return routes.values().stream()
                .filter(r -> r.targetId().equals(listenerId) && r.active())
                .collect(Collectors.toList());
    }

    /**
     * Whether {@code listenerId} should currently hear {@code sourceId}'s raw stream: the source
     * must share the listener's language, be the current speaker, and its route must not be paused.
     */
    public boolean isOriginalAudible(String listenerId, String sourceId) {
        if (currentSpeaker == null || !currentSpeaker.equals(sourceId)) {
            return false;
        }
        ParticipantAudioConfig config = configs.get(listenerId);
        if (config == null || !config.shouldHearOriginal(sourceId)) {
            return false;
        }
        return route(sourceId, listenerId, StreamType.ORIGINAL).map(AudioRoute::active).orElse(false);
    }

    /** Whether translated audio from {@code sourceId} should be played to {@code listenerId}. */
    public boolean isTranslationActive(String sourceId, String listenerId) {
        return route(sourceId, listenerId, StreamType.TRANSLATED).map(AudioRoute::active).orElse(false);
    }

    public RoutingInfo info() {
        int active = (int) routes.values().stream().filter(AudioRoute::active).count();
        return new RoutingInfo(version, roster, currentSpeaker, routes.size(), active, Set.copyOf(pausedRouteIds));
    }
}
