package com.genserver.internal;

/**
 * An entry in a server's mailbox.
 *
 * @param <C> The type of cast messages
 * @param <K> The type of call messages
 */
public sealed interface Envelope<C, K> permits Envelope.Cast, Envelope.Call, Envelope.Stop {

    /**
     * Fire-and-forget message.
     */
    record Cast<C, K>(C message) implements Envelope<C, K> {
    }

    /**
     * Request whose response goes to {@code replySlot}.
     */
    record Call<C, K>(K message, ReplySlot<?> replySlot) implements Envelope<C, K> {
    }

    /**
     * Makes the worker leave its loop. Nothing is accepted behind it.
     */
    record Stop<C, K>() implements Envelope<C, K> {
    }
}
