package com.teamsbot.transcription;

public interface BackendListener {

    void onResult(BackendResult result);

    /**
     * The connection ended without {@link BackendConnection#close()} being called.
     *
     * @param cause transport error, or null when the backend closed the stream cleanly
     */
    void onDisconnect(Throwable cause);
}
