package com.teamsbot.exception;

/**
 * A setting the service cannot work without is missing. Surfaced as HTTP 500.
 */
public class ServiceNotConfiguredException extends BotException {

    public ServiceNotConfiguredException(String message) {
        super(message);
    }
}
