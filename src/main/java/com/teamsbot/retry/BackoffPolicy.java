package com.teamsbot.retry;

import lombok.Builder;
import lombok.Getter;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Exponential backoff shared by webhook delivery and transcription reconnects.
 *
 * <p>{@code maxAttempts} counts every attempt including the first one, so a policy with
 * {@code maxAttempts = 3} allows two retries. The delay before retry {@code n} (1-based) is
 * {@code baseDelay * factor^(n-1)}, capped at {@code maxDelay} when one is set.
 */
@Getter
@Builder(toBuilder = true)
public class BackoffPolicy {

    private final int maxAttempts;

    private final Duration baseDelay;

    @Builder.Default
    private final double factor = 2.0;

    private final Duration maxDelay;

    @Builder.Default
    private final Predicate<Throwable> retryable = error -> true;

    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry must be >= 1, got " + retry);
        }
        double millis = baseDelay.toMillis() * Math.pow(factor, retry - 1);
        long delay = (long) Math.min(millis, Long.MAX_VALUE);
        if (maxDelay != null) {
            delay = Math.min(delay, maxDelay.toMillis());
        }
        return Duration.ofMillis(delay);
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    /**
     * Whether another attempt is allowed after {@code attemptsMade} attempts failed with {@code error}.
     */
    public boolean shouldRetry(int attemptsMade, Throwable error) {
        return attemptsMade < maxAttempts && isRetryable(error);
    }

    public Retry toReactorRetry() {
        return toReactorRetry(signal -> { });
    }

    /**
     * Adapts the policy to Reactor's {@code retryWhen}. Non-retryable errors and the error of the
     * last allowed attempt are propagated unchanged.
     *
     * @param beforeRetry invoked before each retry is scheduled
     */
    public Retry toReactorRetry(Consumer<Retry.RetrySignal> beforeRetry) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            int attemptsMade = (int) signal.totalRetries() + 1;
            if (!shouldRetry(attemptsMade, failure)) {
                return Mono.error(failure);
            }
            beforeRetry.accept(signal.copy());
            return Mono.delay(delayBeforeRetry(attemptsMade));
        }));
    }
}
