package com.teamsbot.transcription;

/**
 * One open streaming connection to a transcription backend.
 */
public interface BackendConnection {

    /**
     * Sends linear16 audio.
     *
     * @throws com.teamsbot.exception.StreamFailureException if the connection is no longer usable
     */
    void sendAudio(byte[] pcm);

    boolean isOpen();

    /**
     * Asks the backend to flush and end the stream. Idempotent.
     */
    void close();
}
