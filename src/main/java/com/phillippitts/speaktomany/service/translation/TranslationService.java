package com.phillippitts.speaktomany.service.translation;

import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.TranslationPreferences;

/**
 * Text translation provider.
 */
public interface TranslationService {

    /**
     * Translates {@code text}. Returns the input unchanged when source equals target.
     *
     * @throws com.phillippitts.speaktomany.exception.TranslationException on provider failure
     */
    String translate(String text, Language source, Language target, TranslationPreferences preferences);

    /** Provider name used in logs, metrics and exceptions. */
    String providerName();
}
