package com.genserver.mailbox;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Default mailbox backed by an unbounded {@link LinkedBlockingQueue}.
 * Producers and the consumer use separate locks, so offers rarely contend with the worker.
 *
 * @param <T> The type of entries
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final LinkedBlockingQueue<T> queue = new LinkedBlockingQueue<>();

    @Override
    public boolean offer(T entry) {
        Objects.requireNonNull(entry, "Entry cannot be null");
        return queue.offer(entry);
    }

    @Override
    public T take() throws InterruptedException {
        return queue.take();
    }

    @Override
    public int drainTo(Collection<? super T> collection) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        return queue.drainTo(collection);
    }

    @Override
    public int size() {
        return queue.size();
    }
}
