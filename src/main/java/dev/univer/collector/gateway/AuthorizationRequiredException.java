package dev.univer.collector.gateway;

/** The credential's session is invalid or expired. Fatal for every call made with it. */
public class AuthorizationRequiredException extends ChatAccessException {

    public AuthorizationRequiredException(String message) {
        super(message);
    }

    public AuthorizationRequiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
