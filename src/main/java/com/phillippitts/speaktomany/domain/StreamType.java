package com.phillippitts.speaktomany.domain;

/** Kind of audio carried by a route. */
public enum StreamType {
    /** The speaker's raw microphone stream. */
    ORIGINAL,
    /** Synthesized speech in the listener's language. */
    TRANSLATED
}
