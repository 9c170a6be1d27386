package com.genserver;

/**
 * Wraps an exception thrown by a user callback on the worker thread.
 * For a call it is rethrown on the caller's thread; the original exception is the cause.
 */
public class CallbackException extends GenServerException {

    private final String callback;

    public CallbackException(String callback, Throwable cause, String serverName) {
        super(callback + " failed in " + serverName + ": " + cause, cause, serverName);
        this.callback = callback;
    }

    /**
     * Returns the name of the callback that failed, e.g. {@code handleCall}.
     */
    public String getCallback() {
        return callback;
    }
}
