package com.genserver;

import com.genserver.config.GenServerConfig;

import java.util.Objects;

/**
 * GenServer whose behavior comes from a {@link GenServerCallbacks} instance instead of a subclass.
 */
final class CallbackGenServer<C, K, S> extends GenServer<C, K, S> {

    private final GenServerCallbacks<C, K, S> callbacks;

    CallbackGenServer(GenServerCallbacks<C, K, S> callbacks, GenServerConfig config) {
        super(withDefaultName(config, callbacks));
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks cannot be null");
    }

    @Override
    protected S init(Object... args) throws Exception {
        return callbacks.init(args);
    }

    @Override
    protected S handleCast(C message, S state) throws Exception {
        return callbacks.handleCast(message, state);
    }

    @Override
    protected CallResult<S> handleCall(K message, S state) throws Exception {
        return callbacks.handleCall(message, state);
    }

    @Override
    protected void terminate(S state) throws Exception {
        callbacks.terminate(state);
    }

    private static GenServerConfig withDefaultName(GenServerConfig config, GenServerCallbacks<?, ?, ?> callbacks) {
        GenServerConfig effective = config != null ? config.copy() : new GenServerConfig();
        if (effective.getName() == null && callbacks != null) {
            effective.setName(generateDefaultName(callbacks.getClass()));
        }
        return effective;
    }
}
