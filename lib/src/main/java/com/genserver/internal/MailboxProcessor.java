package com.genserver.internal;

import com.genserver.CallResult;
import com.genserver.CallbackException;
import com.genserver.GenServerStatus;
import com.genserver.StoppedException;
import com.genserver.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Owns the worker thread of one server and runs its loop: init, then take entries in FIFO order
 * and apply them to the state until a {@link Envelope.Stop} arrives, then terminate.
 *
 * <p>The state lives only in {@link #processLoop()}'s local variable. Callback failures are
 * contained: a failed cast keeps the previous state, a failed call is answered with a
 * {@link CallbackException}. Only a fault of the loop itself ends it early.
 *
 * @param <C> The type of cast messages
 * @param <K> The type of call messages
 * @param <S> The type of the server state
 */
public class MailboxProcessor<C, K, S> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    private final String serverName;
    private final Mailbox<Envelope<C, K>> mailbox;
    private final ServerLifecycle<C, K, S> lifecycle;
    private final ThreadFactory threadFactory;
    private final CompletableFuture<Void> initialized = new CompletableFuture<>();
    private final CountDownLatch exited = new CountDownLatch(1);

    private volatile Thread thread;

    public MailboxProcessor(String serverName,
                            Mailbox<Envelope<C, K>> mailbox,
                            ServerLifecycle<C, K, S> lifecycle,
                            ThreadFactory threadFactory) {
        this.serverName = serverName;
        this.mailbox = mailbox;
        this.lifecycle = lifecycle;
        this.threadFactory = threadFactory;
    }

    /**
     * Spawns the worker thread. Must be called at most once.
     *
     * @return a future completed when init has returned, or completed exceptionally with init's failure
     */
    public CompletableFuture<Void> start() {
        if (thread != null) {
            throw new IllegalStateException("Worker for " + serverName + " already started");
        }
        try {
            Thread worker = threadFactory.newThread(this::processLoop);
            if (worker == null) {
                throw new IllegalStateException("Thread factory refused to create a worker for " + serverName);
            }
            thread = worker;
            worker.start();
        } catch (RuntimeException e) {
            // no loop will ever run, release anyone waiting in awaitExit
            exited.countDown();
            throw e;
        }
        return initialized;
    }

    /**
     * Enqueues an entry. Never blocks.
     */
    public void enqueue(Envelope<C, K> envelope) {
        mailbox.offer(envelope);
    }

    /**
     * Waits for the worker thread to exit.
     *
     * @param timeout maximum wait, or null to wait forever
     * @return true if the worker has exited
     */
    public boolean awaitExit(Duration timeout) throws InterruptedException {
        if (timeout == null) {
            exited.await();
            return true;
        }
        // convert saturates where Duration.toNanos() would overflow
        return exited.await(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
    }

    public boolean isWorkerThread() {
        return thread != null && Thread.currentThread() == thread;
    }

    public int pendingEntries() {
        return mailbox.size();
    }

    private void processLoop() {
        try {
            S state;
            try {
                state = lifecycle.init();
            } catch (Throwable e) {
                logger.error("GenServer {} init failed", serverName, e);
                exit(GenServerStatus.FAILED, e);
                initialized.completeExceptionally(e);
                return;
            }
            lifecycle.onInitialized();
            initialized.complete(null);
            logger.debug("GenServer {} initialized, processing mailbox", serverName);

            GenServerStatus finalStatus = GenServerStatus.STOPPED;
            Throwable fault = null;
            try {
                state = drainUntilStop(state);
            } catch (InterruptedException e) {
                logger.error("GenServer {} worker interrupted, leaving loop", serverName);
                Thread.currentThread().interrupt();
                finalStatus = GenServerStatus.FAILED;
                fault = e;
            } catch (Throwable e) {
                logger.error("GenServer {} main loop error", serverName, e);
                finalStatus = GenServerStatus.FAILED;
                fault = e;
            }

            try {
                lifecycle.terminate(state);
            } catch (Throwable e) {
                logger.error("GenServer {} terminate error", serverName, e);
            }
            exit(finalStatus, fault);
        } finally {
            exited.countDown();
        }
    }

    private S drainUntilStop(S state) throws InterruptedException {
        while (true) {
            Envelope<C, K> envelope = mailbox.take();
            if (envelope instanceof Envelope.Stop) {
                logger.debug("GenServer {} received stop signal", serverName);
                return state;
            } else if (envelope instanceof Envelope.Call) {
                state = processCall((Envelope.Call<C, K>) envelope, state);
            } else if (envelope instanceof Envelope.Cast) {
                state = processCast((Envelope.Cast<C, K>) envelope, state);
            } else {
                logger.warn("GenServer {} received unknown mailbox entry: {}", serverName, envelope);
            }
        }
    }

    private S processCast(Envelope.Cast<C, K> cast, S state) {
        try {
            return lifecycle.handleCast(cast.message(), state);
        } catch (Throwable e) {
            logger.error("GenServer {} handleCast error for message: {}", serverName, cast.message(), e);
            return state;
        }
    }

    private S processCall(Envelope.Call<C, K> call, S state) {
        ReplySlot<?> slot = call.replySlot();
        CallResult<S> result;
        try {
            result = lifecycle.handleCall(call.message(), state);
            if (result == null) {
                throw new IllegalStateException("handleCall returned null instead of a CallResult");
            }
        } catch (Throwable e) {
            logger.error("GenServer {} handleCall error for message: {} (call {})",
                    serverName, call.message(), slot.correlationId(), e);
            slot.fail(new CallbackException("handleCall", e, serverName));
            return state;
        }
        slot.complete(result.response());
        return result.state();
    }

    private void exit(GenServerStatus finalStatus, Throwable cause) {
        lifecycle.onExit(finalStatus, cause);

        List<Envelope<C, K>> leftovers = new ArrayList<>();
        mailbox.drainTo(leftovers);
        for (Envelope<C, K> envelope : leftovers) {
            if (envelope instanceof Envelope.Call) {
                ((Envelope.Call<C, K>) envelope).replySlot().fail(new StoppedException(serverName, finalStatus));
            }
        }
        if (!leftovers.isEmpty()) {
            logger.warn("GenServer {} discarded {} pending entries on exit", serverName, leftovers.size());
        }
    }
}
