/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package oracle.columnar.driver;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Carries the cancellation signal and optional deadline of a query. A
 * context is passed to every query and on to the transport, which must
 * stop waiting for the service once the context is cancelled or its
 * deadline has passed.
 * <p>
 * When a context has a deadline the timeout sent to the service is the
 * time remaining until the deadline plus a small margin, so that the
 * transport fails with a timeout of its own before the caller gives up.
 * Without a deadline the query timeout of the {@link ColumnarConfig} is
 * used.
 * <p>
 * Instances are thread-safe. A context can be cancelled from any thread.
 * <pre>
 * RequestContext ctx = RequestContext.withTimeout(Duration.ofSeconds(30));
 * try (QueryResult result = client.query(ctx, "SELECT 1", null)) {
 *     ...
 * }
 * </pre>
 */
public class RequestContext {

    /*
     * Bound on the distance to a deadline, about 73 years. Larger timeouts
     * are clamped so deadline arithmetic on System.nanoTime() cannot
     * overflow.
     */
    static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE / 4;

    /* deadline in System.nanoTime() units, valid if hasDeadline */
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> cancelListeners =
        new CopyOnWriteArrayList<>();

    private RequestContext(boolean hasDeadline, long deadlineNanos) {
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Creates a context without a deadline. It ends only if cancelled.
     *
     * @return the context
     */
    public static RequestContext create() {
        return new RequestContext(false, 0);
    }

    /**
     * Creates a context whose deadline is the given amount of time from
     * now. Timeouts longer than about 73 years, in either direction, are
     * clamped to that bound.
     *
     * @param timeout the time until the deadline
     *
     * @return the context
     */
    public static RequestContext withTimeout(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException(
                "RequestContext.withTimeout: timeout must be non-null");
        }
        return new RequestContext(true,
                                  System.nanoTime() + clampedNanos(timeout));
    }

    static long clampedNanos(Duration timeout) {
        if (timeout.compareTo(Duration.ofNanos(MAX_TIMEOUT_NANOS)) > 0) {
            return MAX_TIMEOUT_NANOS;
        }
        if (timeout.compareTo(Duration.ofNanos(-MAX_TIMEOUT_NANOS)) < 0) {
            return -MAX_TIMEOUT_NANOS;
        }
        return timeout.toNanos();
    }

    /**
     * Creates a context with the given deadline.
     *
     * @param deadline the deadline
     *
     * @return the context
     */
    public static RequestContext withDeadline(Instant deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException(
                "RequestContext.withDeadline: deadline must be non-null");
        }
        return withTimeout(Duration.between(Instant.now(), deadline));
    }

    /**
     * Returns whether this context has a deadline.
     *
     * @return true if there is a deadline
     */
    public boolean hasDeadline() {
        return hasDeadline;
    }

    /**
     * Returns the time remaining until the deadline. The result is negative
     * once the deadline has passed.
     *
     * @return the remaining time, or null if there is no deadline
     */
    public Duration getTimeRemaining() {
        if (!hasDeadline) {
            return null;
        }
        return Duration.ofNanos(deadlineNanos - System.nanoTime());
    }

    /**
     * Cancels this context and runs the registered cancel listeners. Only
     * the first call has an effect.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        RuntimeException first = null;
        for (Runnable listener : cancelListeners) {
            /* a listener runs once, here or in addCancelListener */
            if (!cancelListeners.remove(listener)) {
                continue;
            }
            try {
                listener.run();
            } catch (RuntimeException re) {
                if (first == null) {
                    first = re;
                } else {
                    first.addSuppressed(re);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /**
     * Returns whether this context was cancelled.
     *
     * @return true if cancelled
     */
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Returns whether the deadline of this context has passed.
     *
     * @return true if there is a deadline and it has passed
     */
    public boolean isDeadlineExceeded() {
        return hasDeadline && deadlineNanos - System.nanoTime() <= 0;
    }

    /**
     * Returns whether this context has ended, by cancellation or because
     * its deadline passed.
     *
     * @return true if the context has ended
     */
    public boolean isDone() {
        return isCancelled() || isDeadlineExceeded();
    }

    /**
     * Throws if this context has ended. Cancellation is checked first.
     *
     * @throws CancellationException if the context was cancelled
     * @throws DeadlineExceededException if the deadline has passed
     */
    public void checkActive() {
        if (isCancelled()) {
            throw new CancellationException("context was cancelled");
        }
        if (isDeadlineExceeded()) {
            throw new DeadlineExceededException("context deadline exceeded");
        }
    }

    /**
     * Registers a listener run when this context is cancelled. Transports
     * use this to abort blocked reads. If the context is already cancelled
     * the listener runs immediately.
     *
     * @param listener the listener
     */
    public void addCancelListener(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException(
                "RequestContext.addCancelListener: listener must be non-null");
        }
        cancelListeners.add(listener);
        if (isCancelled() && cancelListeners.remove(listener)) {
            listener.run();
        }
    }

    /**
     * Removes a listener added with {@link #addCancelListener}.
     *
     * @param listener the listener
     */
    public void removeCancelListener(Runnable listener) {
        cancelListeners.remove(listener);
    }
}
