package com.phillippitts.speaktomany.service.recognition;

import com.phillippitts.speaktomany.domain.Language;

/**
 * Opens recognizer streams for remote participants' audio tracks.
 */
@FunctionalInterface
public interface RecognizerFactory {

    /**
     * @param participantId speaker whose audio the track carries
     * @param trackId       transport track to recognize
     * @param language      speaker's language; selects the recognizer locale
     * @return an unstarted recognizer
     */
    SpeechRecognizer create(String participantId, String trackId, Language language);
}
