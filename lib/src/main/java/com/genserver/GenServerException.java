package com.genserver;

/**
 * Base class of every exception raised by a {@link GenServer}.
 * Carries the name of the server that raised it, when known.
 */
public class GenServerException extends RuntimeException {

    /** The name of the server where the exception occurred. */
    private final String serverName;

    /**
     * Creates a new GenServerException with the specified detail message.
     *
     * @param message the detail message
     */
    public GenServerException(String message) {
        super(message);
        this.serverName = null;
    }

    /**
     * Creates a new GenServerException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public GenServerException(String message, Throwable cause) {
        super(message, cause);
        this.serverName = null;
    }

    /**
     * Creates a new GenServerException with the specified detail message and server name.
     *
     * @param message the detail message
     * @param serverName the name of the server where the exception occurred
     */
    public GenServerException(String message, String serverName) {
        super(message);
        this.serverName = serverName;
    }

    /**
     * Creates a new GenServerException with the specified detail message, cause, and server name.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     * @param serverName the name of the server where the exception occurred
     */
    public GenServerException(String message, Throwable cause, String serverName) {
        super(message, cause);
        this.serverName = serverName;
    }

    /**
     * Returns the name of the server where the exception occurred.
     *
     * @return the server name, or null if not specified
     */
    public String getServerName() {
        return serverName;
    }
}
