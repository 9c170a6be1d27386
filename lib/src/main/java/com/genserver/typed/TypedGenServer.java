package com.genserver.typed;

import com.genserver.CallResult;
import com.genserver.GenServer;
import com.genserver.GenServerCallbacks;
import com.genserver.MessageTypeException;
import com.genserver.config.GenServerConfig;

import java.util.Objects;

/**
 * A {@link GenServer} that only accepts messages and states of declared runtime types.
 *
 * <p>The declared types are usually sealed interfaces naming a closed set of message records:
 * <pre>{@code
 * sealed interface CounterCast permits Increment, Decrement {}
 * record Increment() implements CounterCast {}
 * record Decrement() implements CounterCast {}
 *
 * class Counter extends TypedGenServer<CounterCast, CounterCall, Integer> {
 *     Counter() { super(CounterCast.class, CounterCall.class, Integer.class); }
 *     ...
 * }
 * }</pre>
 *
 * A payload of any other type (for example one slipped past the compiler through a raw type) is
 * rejected with a {@link MessageTypeException} on the sender's thread, before it reaches the
 * mailbox. A callback returning a state of the wrong type fails like any other callback.
 * Execution semantics are exactly those of {@link GenServer}.
 *
 * @param <C> The type of cast messages
 * @param <K> The type of call messages
 * @param <S> The type of the server state
 */
public abstract class TypedGenServer<C, K, S> extends GenServer<C, K, S> {

    private final Class<C> castType;
    private final Class<K> callType;
    private final Class<S> stateType;

    protected TypedGenServer(Class<C> castType, Class<K> callType, Class<S> stateType) {
        this(castType, callType, stateType, new GenServerConfig());
    }

    protected TypedGenServer(Class<C> castType, Class<K> callType, Class<S> stateType, GenServerConfig config) {
        super(config);
        this.castType = Objects.requireNonNull(castType, "castType cannot be null");
        this.callType = Objects.requireNonNull(callType, "callType cannot be null");
        this.stateType = Objects.requireNonNull(stateType, "stateType cannot be null");
    }

    /**
     * Creates a typed server driven by the given callbacks.
     */
    public static <C, K, S> TypedGenServer<C, K, S> of(Class<C> castType,
                                                       Class<K> callType,
                                                       Class<S> stateType,
                                                       GenServerCallbacks<C, K, S> callbacks) {
        return of(castType, callType, stateType, callbacks, new GenServerConfig());
    }

    /**
     * Creates a typed server driven by the given callbacks with the given configuration.
     */
    public static <C, K, S> TypedGenServer<C, K, S> of(Class<C> castType,
                                                       Class<K> callType,
                                                       Class<S> stateType,
                                                       GenServerCallbacks<C, K, S> callbacks,
                                                       GenServerConfig config) {
        Objects.requireNonNull(callbacks, "callbacks cannot be null");
        return new TypedGenServer<>(castType, callType, stateType, config) {
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
        };
    }

    @Override
    protected void checkCastMessage(C message) {
        if (!castType.isInstance(message)) {
            throw new MessageTypeException("cast message", castType, message, getName());
        }
    }

    @Override
    protected void checkCallMessage(K message) {
        if (!callType.isInstance(message)) {
            throw new MessageTypeException("call message", callType, message, getName());
        }
    }

    @Override
    protected void checkState(S state) {
        if (state != null && !stateType.isInstance(state)) {
            throw new MessageTypeException("state", stateType, state, getName());
        }
    }

    public Class<C> getCastType() {
        return castType;
    }

    public Class<K> getCallType() {
        return callType;
    }

    public Class<S> getStateType() {
        return stateType;
    }
}
