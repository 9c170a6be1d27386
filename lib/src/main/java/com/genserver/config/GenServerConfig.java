package com.genserver.config;

import com.genserver.mailbox.config.MailboxType;

import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Settings for a single {@link com.genserver.GenServer}.
 * All setters return this instance so a configuration can be built fluently:
 *
 * <pre>{@code
 * GenServerConfig config = new GenServerConfig()
 *         .setName("counter")
 *         .setMailboxType(MailboxType.MPSC)
 *         .setDefaultCallTimeout(Duration.ofSeconds(5));
 * }</pre>
 */
public class GenServerConfig {
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.LINKED;
    public static final int DEFAULT_INITIAL_CAPACITY = 128;
    public static final boolean DEFAULT_DAEMON = false;

    private static final String THREAD_NAME_PREFIX = "genserver-";

    private String name;
    private MailboxType mailboxType = DEFAULT_MAILBOX_TYPE;
    private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
    private Duration defaultCallTimeout;
    private Duration defaultStopTimeout;
    private boolean daemon = DEFAULT_DAEMON;
    private ThreadFactory threadFactory;

    /**
     * Creates a configuration with default values: generated name, linked mailbox,
     * non-daemon worker, unbounded call and stop waits.
     */
    public GenServerConfig() {
    }

    /**
     * Sets the server name used in thread names, log lines and exceptions.
     *
     * @param name The server name, or null to have one generated
     * @return This GenServerConfig instance
     */
    public GenServerConfig setName(String name) {
        this.name = name;
        return this;
    }

    /**
     * Sets the mailbox implementation.
     *
     * @param mailboxType The mailbox type
     * @return This GenServerConfig instance
     */
    public GenServerConfig setMailboxType(MailboxType mailboxType) {
        if (mailboxType == null) {
            throw new IllegalArgumentException("mailboxType cannot be null");
        }
        this.mailboxType = mailboxType;
        return this;
    }

    /**
     * Sets the initial chunk size of the mailbox. Only used by {@link MailboxType#MPSC}.
     *
     * @param initialCapacity The initial capacity, must be positive
     * @return This GenServerConfig instance
     */
    public GenServerConfig setInitialCapacity(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive, got " + initialCapacity);
        }
        this.initialCapacity = initialCapacity;
        return this;
    }

    /**
     * Sets the timeout applied to {@code call} when the caller passes none.
     *
     * @param defaultCallTimeout The timeout, or null to wait forever
     * @return This GenServerConfig instance
     */
    public GenServerConfig setDefaultCallTimeout(Duration defaultCallTimeout) {
        this.defaultCallTimeout = requireNonNegative(defaultCallTimeout, "defaultCallTimeout");
        return this;
    }

    /**
     * Sets the timeout applied to {@code stop} when the caller passes none.
     *
     * @param defaultStopTimeout The timeout, or null to wait forever
     * @return This GenServerConfig instance
     */
    public GenServerConfig setDefaultStopTimeout(Duration defaultStopTimeout) {
        this.defaultStopTimeout = requireNonNegative(defaultStopTimeout, "defaultStopTimeout");
        return this;
    }

    /**
     * Sets whether the worker thread is a daemon. Non-daemon workers keep the JVM alive until stopped.
     *
     * @param daemon true for a daemon worker
     * @return This GenServerConfig instance
     */
    public GenServerConfig setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    /**
     * Sets a custom factory for the worker thread. When set, {@link #setDaemon(boolean)} is not applied.
     *
     * @param threadFactory The thread factory, or null for named platform threads
     * @return This GenServerConfig instance
     */
    public GenServerConfig setThreadFactory(ThreadFactory threadFactory) {
        this.threadFactory = threadFactory;
        return this;
    }

    /**
     * Returns an independent copy of this configuration.
     */
    public GenServerConfig copy() {
        return new GenServerConfig()
                .setName(name)
                .setMailboxType(mailboxType)
                .setInitialCapacity(initialCapacity)
                .setDefaultCallTimeout(defaultCallTimeout)
                .setDefaultStopTimeout(defaultStopTimeout)
                .setDaemon(daemon)
                .setThreadFactory(threadFactory);
    }

    /**
     * Returns the factory that creates the worker thread of the named server.
     *
     * @param serverName The server name
     * @return the configured factory, or one creating named platform threads
     */
    public ThreadFactory createThreadFactory(String serverName) {
        if (threadFactory != null) {
            return threadFactory;
        }
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                int n = threadNumber.getAndIncrement();
                Thread thread = new Thread(r, THREAD_NAME_PREFIX + serverName + (n == 1 ? "" : "-" + n));
                thread.setDaemon(daemon);
                return thread;
            }
        };
    }

    public String getName() {
        return name;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public Duration getDefaultCallTimeout() {
        return defaultCallTimeout;
    }

    public Duration getDefaultStopTimeout() {
        return defaultStopTimeout;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public ThreadFactory getThreadFactory() {
        return threadFactory;
    }

    private static Duration requireNonNegative(Duration duration, String field) {
        if (duration != null && duration.isNegative()) {
            throw new IllegalArgumentException(field + " cannot be negative: " + duration);
        }
        return duration;
    }

    @Override
    public String toString() {
        return "GenServerConfig{" +
                "name='" + name + '\'' +
                ", mailboxType=" + mailboxType +
                ", initialCapacity=" + initialCapacity +
                ", defaultCallTimeout=" + defaultCallTimeout +
                ", defaultStopTimeout=" + defaultStopTimeout +
                ", daemon=" + daemon +
                '}';
    }
}
