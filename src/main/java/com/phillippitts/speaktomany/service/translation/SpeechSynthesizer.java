package com.phillippitts.speaktomany.service.translation;

import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.VoiceProfile;

/**
 * Text-to-speech provider for translated text.
 */
public interface SpeechSynthesizer {

    /**
     * @return playable audio bytes in the provider's configured format
     * @throws com.phillippitts.speaktomany.exception.SpeakToManyException on provider failure
     */
    byte[] synthesize(String text, Language language, VoiceProfile voice);
}
