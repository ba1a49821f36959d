package dev.univer.collector.gateway;

/**
 * Failure reading from the remote chat system.
 * Subclasses classify the failure; a plain instance is passed through without retry.
 */
public class ChatAccessException extends Exception {

    public ChatAccessException(String message) {
        super(message);
    }

    public ChatAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
