package com.phillippitts.speaktomany.service.routing;

import com.phillippitts.speaktomany.domain.Language;

import java.util.Map;
import java.util.Set;

/**
 * Summary of a session's routing state for diagnostics.
 *
 * @param version        monotonically increasing table version
 * @param participants   registered participants and their languages
 * @param currentSpeaker current speaker, or null when nobody is speaking
 * @param totalRoutes    number of materialized routes
 * @param activeRoutes   routes not paused
 * @param pausedRoutes   ids of paused routes
 */
public record RoutingInfo(
        long version,
        Map<String, Language> participants,
        String currentSpeaker,
        int totalRoutes,
        int activeRoutes,
        Set<String> pausedRoutes
) {
}
