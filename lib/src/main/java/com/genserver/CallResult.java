package com.genserver;

/**
 * Outcome of {@code handleCall}: the response delivered to the caller and the server's next state.
 *
 * @param response the value returned from {@code call}, may be null
 * @param state the new state, may be the unchanged current state
 * @param <S> the state type
 */
public record CallResult<S>(Object response, S state) {

    /**
     * Replies with {@code response} and moves to {@code newState}.
     */
    public static <S> CallResult<S> reply(Object response, S newState) {
        return new CallResult<>(response, newState);
    }
}
