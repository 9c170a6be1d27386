package com.genserver.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-use channel carrying the outcome of one call from the worker back to its caller.
 *
 * <p>Written at most once by the worker and read once by the caller. A caller that times out
 * abandons the slot; the worker's later write is then dropped. The answered/abandoned race is
 * settled by a single compare-and-set, so a reply that wins the race is still returned.
 *
 * @param <R> The type of the response
 */
public final class ReplySlot<R> {
    private static final Logger logger = LoggerFactory.getLogger(ReplySlot.class);

    private static final int PENDING = 0;
    private static final int ANSWERED = 1;
    private static final int ABANDONED = 2;

    private final UUID correlationId = UUID.randomUUID();
    private final CompletableFuture<R> future = new CompletableFuture<>();
    private final AtomicInteger state = new AtomicInteger(PENDING);

    public UUID correlationId() {
        return correlationId;
    }

    /**
     * Delivers a successful response. Dropped if the caller has already given up.
     *
     * @return true if the response was delivered
     */
    @SuppressWarnings("unchecked")
    public boolean complete(Object response) {
        if (!state.compareAndSet(PENDING, ANSWERED)) {
            logger.warn("Dropping reply for call {}: caller no longer waiting", correlationId);
            return false;
        }
        return future.complete((R) response);
    }

    /**
     * Delivers a failure. Dropped if the caller has already given up.
     *
     * @return true if the failure was delivered
     */
    public boolean fail(Throwable error) {
        if (!state.compareAndSet(PENDING, ANSWERED)) {
            logger.warn("Dropping failed reply for call {}: caller no longer waiting", correlationId, error);
            return false;
        }
        return future.completeExceptionally(error);
    }

    /**
     * Blocks until the slot is answered.
     *
     * @param timeout maximum wait, or null to wait forever
     * @return the response
     * @throws TimeoutException if no answer arrived in time; the slot is then abandoned
     * @throws InterruptedException if the caller was interrupted; the slot is then abandoned
     * @throws RuntimeException the failure written by the worker
     */
    public R await(Duration timeout) throws TimeoutException, InterruptedException {
        try {
            if (timeout == null) {
                return future.get();
            }
            return future.get(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (state.compareAndSet(PENDING, ABANDONED)) {
                throw e;
            }
            // answered while timing out, the value is about to land
            return join();
        } catch (InterruptedException e) {
            if (state.compareAndSet(PENDING, ABANDONED)) {
                throw e;
            }
            Thread.currentThread().interrupt();
            return join();
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * Returns a future completed with the outcome. Used for asynchronous calls, which never abandon.
     */
    public CompletableFuture<R> future() {
        return future;
    }

    public boolean isAbandoned() {
        return state.get() == ABANDONED;
    }

    private R join() {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new CompletionException(cause);
    }
}
