package com.phillippitts.speaktomany.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Languages a participant may speak, with the per-language settings needed by recognition
 * and synthesis.
 *
 * <p>Each constant carries its display name, the locale requested from the streaming
 * recognizer, and the default synthesis voice. Agents are parameterized by this enum
 * instead of having one agent type per language.
 */
public enum Language {

    EN("en", "English", "en-US", new VoiceProfile("aura-2-thalia-en", "deepgram", "aura-2-thalia-en")),
    ES("es", "Spanish", "es-US", new VoiceProfile("aura-2-celeste-es", "deepgram", "aura-2-celeste-es")),
    FR("fr", "French", "fr-FR", new VoiceProfile("aura-2-pandora-en", "deepgram", "aura-2-pandora-en")),
    IG("ig", "Igbo", "ig-NG", new VoiceProfile("Obinna", "spitch", "spitch-tts")),
    YO("yo", "Yoruba", "yo-NG", new VoiceProfile("Sade", "spitch", "spitch-tts")),
    HA("ha", "Hausa", "ha-NG", new VoiceProfile("Hasan", "spitch", "spitch-tts"));

    private final String code;
    private final String displayName;
    private final String recognizerLocale;
    private final VoiceProfile defaultVoice;

    Language(String code, String displayName, String recognizerLocale, VoiceProfile defaultVoice) {
        this.code = code;
        this.displayName = displayName;
        this.recognizerLocale = recognizerLocale;
        this.defaultVoice = defaultVoice;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public String recognizerLocale() {
        return recognizerLocale;
    }

    public VoiceProfile defaultVoice() {
        return defaultVoice;
    }

    /**
     * Resolves a language from its ISO code ("es") or a locale tag ("es-US"), ignoring case.
     *
     * @param value code or locale tag, may be null
     * @return matching language, or empty when the value is blank or unsupported
     */
    public static Optional<Language> fromCode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        int dash = normalized.indexOf('-');
        if (dash > 0) {
            normalized = normalized.substring(0, dash);
        }
        for (Language language : values()) {
            if (language.code.equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
