package com.genserver.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mailbox backed by a JCTools {@link MpscUnboundedArrayQueue}.
 *
 * <p>Offers are lock-free. The single consumer parks on a condition only when the queue is empty,
 * and producers take the lock to signal only while the consumer is parked.
 *
 * @param <T> The type of entries
 */
public class MpscMailbox<T> implements Mailbox<T> {

    public static final int DEFAULT_CHUNK_SIZE = 128;

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile boolean consumerWaiting = false;

    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * Creates an MPSC mailbox. The queue is unbounded; {@code chunkSize} only sets the size of
     * each backing array and is rounded up to a power of two (JCTools needs at least 2).
     *
     * @param chunkSize the initial chunk size
     */
    public MpscMailbox(int chunkSize) {
        this.queue = new MpscUnboundedArrayQueue<>(nextPowerOfTwo(Math.max(2, chunkSize)));
    }

    @Override
    public boolean offer(T entry) {
        Objects.requireNonNull(entry, "Entry cannot be null");
        boolean added = queue.offer(entry);
        if (added && consumerWaiting) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
        return added;
    }

    @Override
    public T take() throws InterruptedException {
        T entry = queue.poll();
        if (entry != null) {
            return entry;
        }

        lock.lockInterruptibly();
        try {
            consumerWaiting = true;
            while ((entry = queue.poll()) == null) {
                notEmpty.await();
            }
            return entry;
        } finally {
            consumerWaiting = false;
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        int count = 0;
        T entry;
        while ((entry = queue.poll()) != null) {
            collection.add(entry);
            count++;
        }
        return count;
    }

    @Override
    public int size() {
        return queue.size();
    }

    private static int nextPowerOfTwo(int value) {
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }
}
