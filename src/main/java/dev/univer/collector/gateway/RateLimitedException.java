package dev.univer.collector.gateway;

import lombok.Getter;

import java.time.Duration;

/** Remote asked us to wait {@link #getRetryAfter()} before issuing the same call again. */
@Getter
public class RateLimitedException extends ChatAccessException {

    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter) {
        this(retryAfter, null);
    }

    public RateLimitedException(Duration retryAfter, Throwable cause) {
        super("Rate limited, retry after " + retryAfter.toSeconds() + "s", cause);
        this.retryAfter = retryAfter;
    }
}
