package com.genserver;

/**
 * Thrown when {@code start} is invoked on a server that has already been started.
 */
public class AlreadyStartedException extends GenServerException {

    public AlreadyStartedException(String serverName, GenServerStatus status) {
        super("GenServer " + serverName + " has already been started (status " + status + ")", serverName);
    }
}
