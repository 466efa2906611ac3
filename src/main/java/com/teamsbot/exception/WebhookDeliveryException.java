package com.teamsbot.exception;

import lombok.Getter;

/**
 * Outcome of a failed webhook attempt. Only used inside the delivery pipeline to decide
 * whether another attempt is worth making.
 */
@Getter
public class WebhookDeliveryException extends BotException {

    private final Integer statusCode;
    private final boolean retryable;

    private WebhookDeliveryException(String message, Integer statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    /**
     * 5xx and 429 are worth retrying, every other non-2xx status is final.
     */
    public static WebhookDeliveryException forStatus(int statusCode) {
        boolean retryable = statusCode >= 500 || statusCode == 429;
        return new WebhookDeliveryException("HTTP " + statusCode, statusCode, retryable, null);
    }

    /**
     * Connection refused, reset, DNS failure or attempt timeout.
     */
    public static WebhookDeliveryException transport(Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new WebhookDeliveryException("Transport error: " + detail, null, true, cause);
    }

    public static boolean isRetryable(Throwable error) {
        return error instanceof WebhookDeliveryException && ((WebhookDeliveryException) error).isRetryable();
    }
}
