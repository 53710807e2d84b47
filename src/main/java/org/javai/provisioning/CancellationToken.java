package org.javai.provisioning;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A thread-safe, one-way cancellation signal threaded through retry loops.
 *
 * <p>Retry backoff waits on the token, so {@link #cancel()} wakes a sleeping
 * retrier immediately instead of after its current delay.</p>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason;

    /**
     * A token that is never cancelled by anyone holding a reference to it.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancel("cancelled by caller");
    }

    /**
     * Cancels the token. Only the first reason is kept; later calls are no-ops.
     *
     * @param reason why the work was cancelled, recorded on the resulting CANCELLED failure
     */
    public void cancel(String reason) {
        Objects.requireNonNull(reason, "reason");
        if (this == NONE) {
            throw new UnsupportedOperationException("the shared none() token cannot be cancelled");
        }
        synchronized (cancelled) {
            if (this.reason == null) {
                this.reason = reason;
            }
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public String reason() {
        return reason;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the token was cancelled before the timeout elapsed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
