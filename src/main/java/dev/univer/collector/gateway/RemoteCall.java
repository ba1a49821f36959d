package dev.univer.collector.gateway;

/** One remote read. */
@FunctionalInterface
public interface RemoteCall<T> {
    T call() throws ChatAccessException;
}
