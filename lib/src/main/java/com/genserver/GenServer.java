package com.genserver;

import com.genserver.config.GenServerConfig;
import com.genserver.internal.Envelope;
import com.genserver.internal.MailboxProcessor;
import com.genserver.internal.ReplySlot;
import com.genserver.internal.ServerLifecycle;
import com.genserver.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A server process owning private state that is only touched by its own worker thread.
 *
 * <p>Callers interact through {@link #cast(Object)} (enqueue and return) and {@link #call(Object)}
 * (enqueue and wait for the response). Messages are applied strictly in the order they were
 * enqueued, so application code can mutate the state without any locking.
 *
 * <p>Subclass and override the callbacks:
 * <pre>{@code
 * class Counter extends GenServer<String, String, Integer> {
 *     protected Integer init(Object... args) { return 0; }
 *     protected Integer handleCast(String msg, Integer count) { return count + 1; }
 *     protected CallResult<Integer> handleCall(String msg, Integer count) {
 *         return CallResult.reply(count, count);
 *     }
 * }
 *
 * Counter counter = new Counter();
 * counter.start();
 * counter.cast("increment");
 * int count = counter.call("get");
 * counter.stop();
 * }</pre>
 * or wrap a {@link GenServerCallbacks} with {@link #of(GenServerCallbacks)}.
 *
 * @param <C> The type of cast messages
 * @param <K> The type of call messages
 * @param <S> The type of the server state
 */
public abstract class GenServer<C, K, S> {

    private static final Logger logger = LoggerFactory.getLogger(GenServer.class);

    private final String name;
    private final GenServerConfig config;
    private final Logger serverLogger;
    private final AtomicReference<GenServerStatus> status = new AtomicReference<>(GenServerStatus.CREATED);
    // read lock: enqueue while RUNNING; write lock: leave RUNNING
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final MailboxProcessor<C, K, S> processor;

    private volatile Object[] initArgs = new Object[0];

    /**
     * Creates a server with the default configuration.
     */
    protected GenServer() {
        this(new GenServerConfig());
    }

    /**
     * Creates a server with the given configuration.
     *
     * @param config The server configuration
     */
    protected GenServer(GenServerConfig config) {
        this.config = config != null ? config : new GenServerConfig();
        this.name = this.config.getName() != null ? this.config.getName() : generateDefaultName(getClass());
        this.serverLogger = LoggerFactory.getLogger(getClass().getName() + "." + name);
        Mailbox<Envelope<C, K>> mailbox = this.config.getMailboxType().create(this.config.getInitialCapacity());
        this.processor = new MailboxProcessor<>(name, mailbox, new Lifecycle(), this.config.createThreadFactory(name));
    }

    /**
     * Creates a server driven by the given callbacks.
     *
     * @param callbacks The application callbacks
     * @return a new, not yet started server
     */
    public static <C, K, S> GenServer<C, K, S> of(GenServerCallbacks<C, K, S> callbacks) {
        return of(callbacks, new GenServerConfig());
    }

    /**
     * Creates a server driven by the given callbacks with the given configuration.
     *
     * @param callbacks The application callbacks
     * @param config The server configuration
     * @return a new, not yet started server
     */
    public static <C, K, S> GenServer<C, K, S> of(GenServerCallbacks<C, K, S> callbacks, GenServerConfig config) {
        return new CallbackGenServer<>(callbacks, config);
    }

    // ------------------------------------------------------------------ callbacks

    /**
     * Builds the initial state on the worker thread.
     *
     * @param args the arguments passed to {@link #start(Object...)}
     * @return the initial state
     * @throws Exception to fail startup
     */
    protected abstract S init(Object... args) throws Exception;

    /**
     * Handles a cast. The default logs the message as unhandled and keeps the state.
     */
    protected S handleCast(C message, S state) throws Exception {
        logger.warn("GenServer {} unhandled cast message: {}. Override handleCast to handle it.", name, message);
        return state;
    }

    /**
     * Handles a call. The default fails, which the caller sees as a {@link CallbackException}.
     */
    protected CallResult<S> handleCall(K message, S state) throws Exception {
        throw new UnsupportedOperationException("handleCall must be overridden to handle call message: " + message);
    }

    /**
     * Cleans up when the server stops. Failures are logged, never propagated.
     */
    protected void terminate(S state) throws Exception {
    }

    // ------------------------------------------------------------------ message boundary hooks

    /**
     * Validates a cast message before it is enqueued. Runs on the caller's thread.
     */
    protected void checkCastMessage(C message) {
    }

    /**
     * Validates a call message before it is enqueued. Runs on the caller's thread.
     */
    protected void checkCallMessage(K message) {
    }

    /**
     * Validates a state produced by a callback. Runs on the worker thread; throwing rejects the transition.
     */
    protected void checkState(S state) {
    }

    // ------------------------------------------------------------------ lifecycle

    /**
     * Starts the worker thread and runs {@code init(args)} on it. Returns once init has completed.
     *
     * @param args arguments forwarded to {@code init}
     * @throws AlreadyStartedException if this server has been started before
     * @throws InitFailedException if init threw; the server is then {@link GenServerStatus#FAILED}
     */
    public void start(Object... args) {
        // under the lifecycle lock so a concurrent stop() never acts on a stale CREATED
        lifecycleLock.writeLock().lock();
        try {
            if (!status.compareAndSet(GenServerStatus.CREATED, GenServerStatus.STARTING)) {
                throw new AlreadyStartedException(name, status.get());
            }
            initArgs = args == null ? new Object[0] : args.clone();
        } finally {
            lifecycleLock.writeLock().unlock();
        }
        logger.info("Starting GenServer {}", name);

        CompletableFuture<Void> initialized;
        try {
            initialized = processor.start();
        } catch (RuntimeException e) {
            status.set(GenServerStatus.FAILED);
            throw new GenServerException("Could not spawn worker for " + name, e, name);
        }

        boolean interrupted = false;
        while (true) {
            try {
                initialized.get();
                break;
            } catch (InterruptedException e) {
                // init is already running on the worker; wait for its outcome
                interrupted = true;
            } catch (ExecutionException e) {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
                throw new InitFailedException(e.getCause(), name);
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        logger.info("GenServer {} started", name);
    }

    /**
     * Stops the server, waiting as long as the configured default stop timeout allows.
     *
     * @see #stop(Duration)
     */
    public void stop() {
        stop(config.getDefaultStopTimeout());
    }

    /**
     * Enqueues a stop signal behind every pending message and waits for the worker to run
     * {@code terminate} and exit. Stopping a server that is already stopped or failed succeeds
     * without effect; stopping a server that was never started just marks it stopped.
     *
     * <p>When called from one of this server's own callbacks the signal is enqueued and the
     * method returns at once.
     *
     * @param timeout maximum wait, or null to wait forever
     * @throws GenServerTimeoutException if the worker has not exited in time; it keeps running
     */
    public void stop(Duration timeout) {
        lifecycleLock.writeLock().lock();
        try {
            GenServerStatus current = status.get();
            if (current.isTerminal()) {
                logger.debug("GenServer {} already {}", name, current);
                return;
            }
            if (current == GenServerStatus.CREATED) {
                status.set(GenServerStatus.STOPPED);
                logger.info("GenServer {} stopped before it was started", name);
                return;
            }
            if (current != GenServerStatus.STOPPING) {
                status.set(GenServerStatus.STOPPING);
                processor.enqueue(new Envelope.Stop<>());
                logger.info("Stopping GenServer {}", name);
            }
        } finally {
            lifecycleLock.writeLock().unlock();
        }

        if (processor.isWorkerThread()) {
            return;
        }

        try {
            if (!processor.awaitExit(timeout)) {
                throw new GenServerTimeoutException(
                        "GenServer " + name + " failed to stop within " + timeout, timeout, name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenServerException("Interrupted while stopping " + name, e, name);
        }
    }

    // ------------------------------------------------------------------ messaging

    /**
     * Enqueues a fire-and-forget message. Never blocks.
     *
     * @param message the message
     * @throws NotStartedException if the server has not been started
     * @throws StoppedException if the server is stopping, stopped or failed
     */
    public void cast(C message) {
        checkCastMessage(message);
        enqueue(new Envelope.Cast<>(message));
    }

    /**
     * Sends a request and waits for the response, as long as the configured default call timeout allows.
     *
     * @see #call(Object, Duration)
     */
    public <R> R call(K message) {
        return call(message, config.getDefaultCallTimeout());
    }

    /**
     * Sends a request and blocks until {@code handleCall} has answered it.
     *
     * @param message the request
     * @param timeout maximum wait, or null to wait forever
     * @param <R> the expected response type
     * @return the response produced by {@code handleCall}
     * @throws NotRunningException if the server is not running
     * @throws CallbackException if {@code handleCall} threw; the server keeps running
     * @throws GenServerTimeoutException if no response arrived in time; the server may still answer later
     */
    public <R> R call(K message, Duration timeout) {
        if (processor.isWorkerThread()) {
            throw new GenServerException("GenServer " + name + " cannot call itself from a callback", name);
        }
        checkCallMessage(message);
        ReplySlot<R> slot = new ReplySlot<>();
        enqueue(new Envelope.Call<>(message, slot));
        if (logger.isDebugEnabled()) {
            logger.debug("GenServer {} call {} enqueued: {}", name, slot.correlationId(), message);
        }
        try {
            return slot.await(timeout);
        } catch (TimeoutException e) {
            throw new GenServerTimeoutException(
                    "No response received from " + name + " for call within timeout: " + timeout, timeout, name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenServerException("Interrupted while waiting for " + name + " to answer", e, name);
        }
    }

    /**
     * Sends a request without blocking. The future completes with the response, or exceptionally
     * with a {@link CallbackException} or {@link StoppedException}.
     *
     * @param message the request
     * @param <R> the expected response type
     * @return a future for the response
     * @throws NotRunningException if the server is not running
     */
    public <R> CompletableFuture<R> callAsync(K message) {
        checkCallMessage(message);
        ReplySlot<R> slot = new ReplySlot<>();
        enqueue(new Envelope.Call<>(message, slot));
        return slot.future();
    }

    private void enqueue(Envelope<C, K> envelope) {
        lifecycleLock.readLock().lock();
        try {
            GenServerStatus current = status.get();
            boolean selfSendDuringInit = current == GenServerStatus.STARTING && processor.isWorkerThread();
            if (current != GenServerStatus.RUNNING && !selfSendDuringInit) {
                throw notRunning(current);
            }
            processor.enqueue(envelope);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    private NotRunningException notRunning(GenServerStatus current) {
        if (current == GenServerStatus.CREATED || current == GenServerStatus.STARTING) {
            return new NotStartedException(name, current);
        }
        return new StoppedException(name, current);
    }

    // ------------------------------------------------------------------ observers

    public String getName() {
        return name;
    }

    public GenServerStatus getStatus() {
        return status.get();
    }

    public boolean isRunning() {
        return status.get() == GenServerStatus.RUNNING;
    }

    /**
     * Returns the number of entries waiting in the mailbox.
     */
    public int getPendingMessages() {
        return processor.pendingEntries();
    }

    protected GenServerConfig getConfig() {
        return config;
    }

    /**
     * Returns a logger named after this server's class and name.
     */
    protected Logger getLogger() {
        return serverLogger;
    }

    protected static String generateDefaultName(Class<?> type) {
        String simpleName = type.isSynthetic() || type.getSimpleName().isEmpty() ? "genserver" : type.getSimpleName();
        return simpleName + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', status=" + status.get() + "}";
    }

    /**
     * Bridges the worker loop to this server's protected callbacks.
     */
    private final class Lifecycle implements ServerLifecycle<C, K, S> {

        @Override
        public S init() throws Exception {
            S state = GenServer.this.init(initArgs);
            checkState(state);
            return state;
        }

        @Override
        public S handleCast(C message, S state) throws Exception {
            S next = GenServer.this.handleCast(message, state);
            checkState(next);
            return next;
        }

        @Override
        public CallResult<S> handleCall(K message, S state) throws Exception {
            CallResult<S> result = GenServer.this.handleCall(message, state);
            if (result != null) {
                checkState(result.state());
            }
            return result;
        }

        @Override
        public void terminate(S state) throws Exception {
            GenServer.this.terminate(state);
        }

        @Override
        public void onInitialized() {
            // a concurrent stop() may already have moved us to STOPPING
            status.compareAndSet(GenServerStatus.STARTING, GenServerStatus.RUNNING);
        }

        @Override
        public void onExit(GenServerStatus finalStatus, Throwable cause) {
            lifecycleLock.writeLock().lock();
            try {
                status.set(finalStatus);
            } finally {
                lifecycleLock.writeLock().unlock();
            }
            if (finalStatus == GenServerStatus.FAILED) {
                logger.error("GenServer {} failed", name, cause);
            } else {
                logger.info("GenServer {} stopped", name);
            }
        }
    }
}
