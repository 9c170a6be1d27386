package com.genserver;

/**
 * A message was sent to, or left pending in, a server that is stopping or has stopped.
 */
public class StoppedException extends NotRunningException {

    public StoppedException(String serverName, GenServerStatus status) {
        super("GenServer " + serverName + " has been stopped (status " + status + ")", serverName, status);
    }
}
