package dev.univer.collector.service;

import dev.univer.collector.gateway.ChatAccessException;
import dev.univer.collector.gateway.RateLimitedException;
import dev.univer.collector.gateway.RemoteCall;
import dev.univer.collector.gateway.TransientNetworkException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Runs remote reads for one credential and absorbs rate limit waits.
 *
 * <p>A {@link RateLimitedException} makes the fetcher sleep for exactly the requested
 * duration and repeat the call, with no cap on the number of waits. Waits are cut short by
 * the caller's {@link CancellationSignal}. A
 * {@link TransientNetworkException} is retried with doubling delay until
 * {@code transientAttempts} calls have failed, then rethrown. Every other failure reaches the
 * caller unchanged.
 *
 * <p>Holds no mutable state, so independent callers can share an instance.
 */
@Slf4j
public class RateLimitedFetcher {

    // longest stretch a wait sleeps before looking at the cancellation signal again
    private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final String credentialId;
    private final int transientAttempts;
    private final Duration transientDelay;

    public RateLimitedFetcher(String credentialId, int transientAttempts, Duration transientDelay) {
        if (transientAttempts < 1) throw new IllegalArgumentException("transientAttempts must be >= 1");
        this.credentialId = credentialId;
        this.transientAttempts = transientAttempts;
        this.transientDelay = transientDelay;
    }

    public <T> T call(RemoteCall<T> fn) throws ChatAccessException {
        return call(fn, new CancellationSignal());
    }

    /** Like {@link #call(RemoteCall)}, giving up with {@link CancellationException} once {@code signal} is set. */
    public <T> T call(RemoteCall<T> fn, CancellationSignal signal) throws ChatAccessException {
        int transientFailures = 0;
        Duration backoff = transientDelay;
        while (true) {
            try {
                return fn.call();
            } catch (RateLimitedException e) {
                log.warn("[{}] Rate limited, waiting {} ms", credentialId, e.getRetryAfter().toMillis());
                pause(e.getRetryAfter(), signal);
            } catch (TransientNetworkException e) {
                transientFailures++;
                if (transientFailures >= transientAttempts) {
                    log.warn("[{}] All {} attempts failed: {}", credentialId, transientAttempts, e.getMessage());
                    throw e;
                }
                log.info("[{}] Attempt {}/{} failed: {}. Retrying in {} ms",
                         credentialId, transientFailures, transientAttempts, e.getMessage(), backoff.toMillis());
                pause(backoff, signal);
                backoff = backoff.multipliedBy(2);
            }
        }
    }

    private static void pause(Duration duration, CancellationSignal signal) {
        long deadline = System.nanoTime() + duration.toNanos();
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            signal.throwIfCancelled();
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, WAIT_SLICE_NANOS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                CancellationException cancelled = new CancellationException("Interrupted while waiting to retry");
                cancelled.initCause(e);
                throw cancelled;
            }
        }
        signal.throwIfCancelled();
    }
}
