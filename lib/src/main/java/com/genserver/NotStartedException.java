package com.genserver;

/**
 * A message was sent before {@link GenServer#start(Object...)}.
 */
public class NotStartedException extends NotRunningException {

    public NotStartedException(String serverName, GenServerStatus status) {
        super("GenServer " + serverName + " has not been started (status " + status + ")", serverName, status);
    }
}
