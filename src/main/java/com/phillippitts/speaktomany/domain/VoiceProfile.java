package com.phillippitts.speaktomany.domain;

import java.util.Objects;

/**
 * Synthesis voice selection.
 *
 * @param voiceId  provider-specific voice identifier
 * @param provider synthesis provider name (e.g., "deepgram", "spitch")
 * @param model    provider model name
 */
public record VoiceProfile(String voiceId, String provider, String model) {

    public VoiceProfile {
        Objects.requireNonNull(voiceId, "voiceId must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(model, "model must not be null");
    }
}
