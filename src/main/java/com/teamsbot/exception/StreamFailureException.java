package com.teamsbot.exception;

/**
 * Problem with the streaming connection to the transcription backend, either a failed
 * handshake or a lost stream whose reconnect budget is exhausted.
 */
public class StreamFailureException extends BotException {

    public StreamFailureException(String message) {
        super(message);
    }

    public StreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
