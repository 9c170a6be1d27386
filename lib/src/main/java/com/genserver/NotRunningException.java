package com.genserver;

/**
 * Thrown when a message is sent to a server that is not {@link GenServerStatus#RUNNING}.
 */
public class NotRunningException extends GenServerException {

    private final GenServerStatus status;

    public NotRunningException(String serverName, GenServerStatus status) {
        this("GenServer " + serverName + " is not running (status " + status + ")", serverName, status);
    }

    protected NotRunningException(String message, String serverName, GenServerStatus status) {
        super(message, serverName);
        this.status = status;
    }

    /**
     * Returns the status the server was in when the message was rejected.
     */
    public GenServerStatus getStatus() {
        return status;
    }
}
