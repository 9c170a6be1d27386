package com.genserver.mailbox;

import java.util.Collection;

/**
 * Unbounded multi-producer, single-consumer queue holding the pending entries of one server.
 * Any number of threads may {@link #offer} concurrently; only the worker thread consumes.
 *
 * @param <T> The type of entries stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Appends the entry to the back of this mailbox. Never blocks.
     *
     * @param entry the entry to add
     * @return true if the entry was added
     * @throws NullPointerException if the entry is null
     */
    boolean offer(T entry);

    /**
     * Retrieves and removes the head of this mailbox, waiting if necessary
     * until an entry becomes available.
     *
     * @return the head of this mailbox
     * @throws InterruptedException if interrupted while waiting
     */
    T take() throws InterruptedException;

    /**
     * Removes all available entries from this mailbox and adds them to the
     * given collection, preserving order.
     *
     * @param collection the collection to transfer entries into
     * @return the number of entries transferred
     */
    int drainTo(Collection<? super T> collection);

    /**
     * Returns the number of entries in this mailbox.
     */
    int size();
}
