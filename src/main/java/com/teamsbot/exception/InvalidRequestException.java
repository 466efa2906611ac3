package com.teamsbot.exception;

/**
 * Malformed client input. Surfaced as HTTP 400 and never retried.
 */
public class InvalidRequestException extends BotException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
