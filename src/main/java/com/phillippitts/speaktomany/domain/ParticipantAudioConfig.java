package com.phillippitts.speaktomany.domain;

import java.util.Objects;
import java.util.Set;

/**
 * Routing decisions for one listener, recomputed from the roster on every change.
 *
 * <p>Every other participant is in exactly one of {@code hearOriginal} and
 * {@code hearTranslated}. {@code mute} lists sources whose raw stream is muted for this
 * listener; it contains every translated source and never intersects {@code hearOriginal}.
 *
 * @param participantId  listener id
 * @param nativeLanguage listener language
 * @param hearOriginal   sources in the same language, passed through while speaking
 * @param hearTranslated sources in a different language, replaced by synthesized speech
 * @param mute           sources whose raw stream is muted
 */
public record ParticipantAudioConfig(
        String participantId,
        Language nativeLanguage,
        Set<String> hearOriginal,
        Set<String> hearTranslated,
        Set<String> mute
) {

    public ParticipantAudioConfig {
        Objects.requireNonNull(participantId, "participantId must not be null");
        Objects.requireNonNull(nativeLanguage, "nativeLanguage must not be null");
        hearOriginal = Set.copyOf(hearOriginal);
        hearTranslated = Set.copyOf(hearTranslated);
        mute = Set.copyOf(mute);
    }

    public boolean shouldHearOriginal(String sourceId) {
        return hearOriginal.contains(sourceId);
    }

    public boolean shouldHearTranslated(String sourceId) {
        return hearTranslated.contains(sourceId);
    }

    public boolean isMuted(String sourceId) {
        return mute.contains(sourceId);
    }
}
