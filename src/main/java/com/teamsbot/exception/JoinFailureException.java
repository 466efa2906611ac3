package com.teamsbot.exception;

/**
 * The meeting adapter could not get the bot into the meeting. Terminal for the session.
 */
public class JoinFailureException extends BotException {

    public JoinFailureException(String message) {
        super(message);
    }

    public JoinFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
