package com.phillippitts.speaktomany.domain;

/**
 * Per-listener translation style.
 *
 * @param formalTone      prefer formal register over conversational
 * @param preserveEmotion keep the speaker's emotional tone rather than neutral phrasing
 */
public record TranslationPreferences(boolean formalTone, boolean preserveEmotion) {

    public static final TranslationPreferences DEFAULT = new TranslationPreferences(false, true);
}
