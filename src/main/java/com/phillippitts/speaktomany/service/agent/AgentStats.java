package com.phillippitts.speaktomany.service.agent;

import com.phillippitts.speaktomany.domain.Language;

import java.util.List;

/**
 * Point-in-time counters for one agent.
 *
 * @param participantId      participant the agent serves
 * @param language           participant's language
 * @param running            whether the agent is attached to a session
 * @param remoteParticipants remote participants currently known to the agent
 * @param recognizedSpeakers speakers whose audio this agent is recognizing
 * @param deliveriesPlayed   translations synthesized and played
 * @param deliveriesDropped  translations discarded (inactive route, synthesis failure, not addressed here)
 */
public record AgentStats(
        String participantId,
        Language language,
        boolean running,
        int remoteParticipants,
        List<String> recognizedSpeakers,
        long deliveriesPlayed,
        long deliveriesDropped
) {

    public AgentStats {
        recognizedSpeakers = List.copyOf(recognizedSpeakers);
    }
}
