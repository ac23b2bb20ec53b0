package com.phillippitts.speaktomany.service.translation;

import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.TranslationPreferences;

/**
 * Builds the system prompt for real-time interpretation from listener preferences.
 */
final class TranslationPrompts {

    private TranslationPrompts() {}

    static String systemPrompt(Language source, Language target, TranslationPreferences preferences) {
        String tone = preferences.formalTone() ? "formal and professional" : "natural and conversational";
        String emotion = preferences.preserveEmotion() ? "preserve the emotional tone and intensity" : "maintain clarity";
        return "You are a real-time interpreter translating spoken " + source.displayName()
                + " into " + target.displayName() + ".\n"
                + "Guidelines:\n"
                + "- Use a " + tone + " tone\n"
                + "- " + emotion + "\n"
                + "- Keep the translation concise; it will be spoken aloud immediately\n"
                + "- The input may be an incomplete sentence; translate what is there without completing it\n"
                + "- For informal speech, use appropriate colloquialisms in " + target.displayName() + "\n"
                + "Respond with the translation only, no quotes or explanations.";
    }
}
