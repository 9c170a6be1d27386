package com.genserver;

/**
 * Application callbacks driven by a {@link GenServer}. Every method runs on the server's worker
 * thread, one at a time, so implementations never need to synchronize access to the state.
 *
 * <p>Pass an implementation to {@link GenServer#of(GenServerCallbacks)}, or subclass
 * {@link GenServer} and override the same methods there.
 *
 * @param <C> The type of cast messages
 * @param <K> The type of call messages
 * @param <S> The type of the server state
 */
public interface GenServerCallbacks<C, K, S> {

    /**
     * Builds the initial state. Runs first on the worker thread; a failure aborts startup.
     *
     * @param args the arguments passed to {@link GenServer#start(Object...)}
     * @return the initial state
     * @throws Exception to fail startup
     */
    S init(Object... args) throws Exception;

    /**
     * Handles a fire-and-forget message.
     * The default implementation leaves the state unchanged.
     *
     * @param message the cast message
     * @param state the current state
     * @return the new state
     * @throws Exception to skip this transition; the server keeps the current state
     */
    default S handleCast(C message, S state) throws Exception {
        return state;
    }

    /**
     * Handles a request and produces its response.
     * The default implementation rejects every message.
     *
     * @param message the call message
     * @param state the current state
     * @return the response and the new state
     * @throws Exception delivered to the caller wrapped in a {@link CallbackException}
     */
    default CallResult<S> handleCall(K message, S state) throws Exception {
        throw new UnsupportedOperationException("Call message not handled: " + message);
    }

    /**
     * Cleans up when the server stops. Failures are logged and never reach the caller of stop.
     *
     * @param state the final state
     * @throws Exception logged by the server
     */
    default void terminate(S state) throws Exception {
    }
}
