package com.teamsbot.config;

import com.teamsbot.exception.WebhookDeliveryException;
import com.teamsbot.retry.BackoffPolicy;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

@Getter
@Builder
public class WebhookSettings {

    // Bound on a single HTTP attempt
    private final Duration timeout;

    // Total attempts per event, first one included
    private final int retryCount;

    private final Duration backoffBase;

    private final Duration backoffMax;

    private final boolean allowInsecure;

    private final boolean allowPrivateHosts;

    private final int queueCapacity;

    public BackoffPolicy backoffPolicy() {
        return BackoffPolicy.builder()
                .maxAttempts(retryCount)
                .baseDelay(backoffBase)
                .maxDelay(backoffMax)
                .retryable(WebhookDeliveryException::isRetryable)
                .build();
    }
}
