package com.teamsbot.transcription;

import com.teamsbot.exception.StreamFailureException;

/**
 * A streaming speech-to-text service.
 */
public interface TranscriptionBackend {

    /**
     * Opens one streaming connection and blocks until the handshake completed.
     *
     * @param listener receives results and the disconnect notification for this connection only
     * @throws StreamFailureException if the connection could not be established
     */
    BackendConnection connect(StreamOptions options, BackendListener listener);
}
