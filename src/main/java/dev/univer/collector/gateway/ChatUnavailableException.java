package dev.univer.collector.gateway;

/** A single chat cannot be read (left, kicked, deleted). Other chats of the credential are fine. */
public class ChatUnavailableException extends ChatAccessException {

    public ChatUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
