package com.teamsbot.webhook;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of one logical webhook delivery, possibly spanning several HTTP attempts.
 */
@Value
@Builder
public class DeliveryResult {

    public enum Outcome {
        DELIVERED,
        // every attempt failed with a retryable error
        RETRIES_EXHAUSTED,
        // rejected by the destination or never attempted
        PERMANENT_FAILURE
    }

    Outcome outcome;
    int attempts;
    Duration elapsed;
    Integer statusCode;
    String error;

    public boolean isDelivered() {
        return outcome == Outcome.DELIVERED;
    }
}
