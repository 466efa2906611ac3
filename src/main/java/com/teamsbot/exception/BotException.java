package com.teamsbot.exception;

/**
 * Base class for all errors raised by the bot service.
 */
public class BotException extends RuntimeException {

    public BotException(String message) {
        super(message);
    }

    public BotException(String message, Throwable cause) {
        super(message, cause);
    }
}
