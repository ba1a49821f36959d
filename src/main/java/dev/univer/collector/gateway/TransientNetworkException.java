package dev.univer.collector.gateway;

public class TransientNetworkException extends ChatAccessException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
