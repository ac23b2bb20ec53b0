package com.phillippitts.speaktomany.domain;

import java.util.Objects;

/**
 * Resolved profile of one participant, as supplied at join time.
 *
 * @param participantId transport-level participant identity
 * @param language      native language; drives routing and translation targets
 * @param preferences   translation style applied to text this participant hears
 * @param voice         synthesis voice used for this participant's translated audio
 */
public record ParticipantProfile(
        String participantId,
        Language language,
        TranslationPreferences preferences,
        VoiceProfile voice
) {

    public ParticipantProfile {
        if (participantId == null || participantId.isBlank()) {
            throw new IllegalArgumentException("participantId must not be blank");
        }
        Objects.requireNonNull(language, "language must not be null");
        if (preferences == null) {
            preferences = TranslationPreferences.DEFAULT;
        }
        if (voice == null) {
            voice = language.defaultVoice();
        }
    }

    public static ParticipantProfile of(String participantId, Language language) {
        return new ParticipantProfile(participantId, language, null, null);
    }
}
