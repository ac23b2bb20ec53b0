package com.phillippitts.speaktomany.service.transport;

/**
 * Commands this core issues to the audio transport (the real-time media session layer).
 *
 * <p>Implemented by the deployment. Routing decisions reach the transport only through
 * {@link #setOriginalAudible(String, String, boolean)}; translated speech only through
 * {@link #play(String, byte[])}.
 */
public interface AudioTransport {

    /**
     * Plays synthesized audio to one listener on that listener's translation track.
     */
    void play(String listenerId, byte[] audio);

    /**
     * Subscribes ({@code true}) or mutes ({@code false}) a source's raw stream for a listener.
     */
    void setOriginalAudible(String listenerId, String sourceId, boolean audible);

    /**
     * Publishes the outbound track that carries translated speech for {@code participantId}.
     *
     * @return transport id of the published track
     */
    String publishTranslationTrack(String participantId);

    /**
     * Withdraws a track published by {@link #publishTranslationTrack(String)}.
     */
    void unpublishTrack(String trackId);
}
