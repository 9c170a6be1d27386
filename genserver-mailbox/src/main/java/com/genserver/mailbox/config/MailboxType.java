package com.genserver.mailbox.config;

import com.genserver.mailbox.LinkedMailbox;
import com.genserver.mailbox.Mailbox;
import com.genserver.mailbox.MpscMailbox;

/**
 * Selects the queue implementation behind a server's mailbox. Both are unbounded and FIFO.
 *
 * <ul>
 *   <li>{@link #LINKED} - {@link LinkedMailbox}, two-lock linked queue (default)</li>
 *   <li>{@link #MPSC} - {@link MpscMailbox}, lock-free JCTools queue for many concurrent senders</li>
 * </ul>
 */
public enum MailboxType {

    LINKED {
        @Override
        public <T> Mailbox<T> create(int initialCapacity) {
            return new LinkedMailbox<>();
        }
    },

    MPSC {
        @Override
        public <T> Mailbox<T> create(int initialCapacity) {
            return new MpscMailbox<>(initialCapacity);
        }
    };

    /**
     * Creates an empty mailbox of this type.
     *
     * @param initialCapacity sizing hint; ignored by {@link #LINKED}
     * @param <T> the entry type
     * @return a new mailbox
     */
    public abstract <T> Mailbox<T> create(int initialCapacity);
}
