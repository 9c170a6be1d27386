package com.genserver.internal;

import com.genserver.CallResult;
import com.genserver.GenServerStatus;

/**
 * Hooks a {@link MailboxProcessor} invokes on its worker thread.
 *
 * @param <C> The type of cast messages
 * @param <K> The type of call messages
 * @param <S> The type of the server state
 */
public interface ServerLifecycle<C, K, S> {

    /** Builds the initial state. */
    S init() throws Exception;

    /** Applies a cast and returns the next state. */
    S handleCast(C message, S state) throws Exception;

    /** Applies a call and returns the response with the next state. */
    CallResult<S> handleCall(K message, S state) throws Exception;

    /** Releases resources held by the final state. */
    void terminate(S state) throws Exception;

    /** Called once init has succeeded, before the first entry is taken. */
    void onInitialized();

    /**
     * Records the worker's final status. Called once, before leftover entries are drained,
     * so that nothing can be enqueued afterwards.
     */
    void onExit(GenServerStatus finalStatus, Throwable cause);
}
