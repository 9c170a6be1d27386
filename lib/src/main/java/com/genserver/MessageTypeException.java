package com.genserver;

/**
 * Thrown when a payload or state does not match the type a {@link com.genserver.typed.TypedGenServer} declares.
 */
public class MessageTypeException extends GenServerException {

    public MessageTypeException(String kind, Class<?> expected, Object actual, String serverName) {
        super("Expected " + kind + " of type " + expected.getName() + ", got "
                + (actual == null ? "null" : actual.getClass().getName()), serverName);
    }
}
