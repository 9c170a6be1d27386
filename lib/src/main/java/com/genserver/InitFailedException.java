package com.genserver;

/**
 * Thrown by {@link GenServer#start(Object...)} when {@code init} fails.
 * The server is left in {@link GenServerStatus#FAILED}.
 */
public class InitFailedException extends GenServerException {

    public InitFailedException(Throwable cause, String serverName) {
        super("init failed for " + serverName, cause, serverName);
    }
}
