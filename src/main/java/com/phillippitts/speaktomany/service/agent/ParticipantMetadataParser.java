package com.phillippitts.speaktomany.service.agent;

import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.ParticipantProfile;
import com.phillippitts.speaktomany.domain.TranslationPreferences;
import com.phillippitts.speaktomany.domain.VoiceProfile;
import com.phillippitts.speaktomany.exception.SpeakToManyException;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses the JSON metadata a participant publishes when joining.
 *
 * <p>Expected format:
 * <pre>
 * {
 *   "language": "es",
 *   "preferences": { "formal_tone": false, "preserve_emotion": true },
 *   "voice": { "id": "aura-2-celeste-es", "provider": "deepgram", "model": "aura-2-celeste-es" }
 * }
 * </pre>
 * Only {@code language} is required. A missing voice falls back to the language default.
 */
public final class ParticipantMetadataParser {

    private ParticipantMetadataParser() {
    }

    /**
     * @throws SpeakToManyException if the JSON is malformed or names no supported language
     */
    public static ParticipantProfile parse(String participantId, String metadataJson) {
        if (metadataJson == null || metadataJson.isBlank()) {
            throw new SpeakToManyException("Participant " + participantId + " has no metadata");
        }
        JSONObject json;
        try {
            json = new JSONObject(metadataJson);
        } catch (JSONException e) {
            throw new SpeakToManyException("Malformed metadata for participant " + participantId, e);
        }

        String code = json.optString("language", "");
        Language language = Language.fromCode(code)
                .orElseThrow(() -> new SpeakToManyException(
                        "Unsupported language '" + code + "' for participant " + participantId));

        TranslationPreferences preferences = TranslationPreferences.DEFAULT;
        JSONObject prefs = json.optJSONObject("preferences");
        if (prefs != null) {
            preferences = new TranslationPreferences(
                    prefs.optBoolean("formal_tone", TranslationPreferences.DEFAULT.formalTone()),
                    prefs.optBoolean("preserve_emotion", TranslationPreferences.DEFAULT.preserveEmotion()));
        }

        VoiceProfile voice = null;
        JSONObject v = json.optJSONObject("voice");
        if (v != null && !v.optString("id", "").isBlank()) {
            VoiceProfile fallback = language.defaultVoice();
            voice = new VoiceProfile(v.getString("id"),
                    v.optString("provider", fallback.provider()),
                    v.optString("model", fallback.model()));
        }
        return new ParticipantProfile(participantId, language, preferences, voice);
    }
}
