package dev.univer.collector.service;

public class RunAlreadyActiveException extends IllegalStateException {
    public RunAlreadyActiveException(Long requesterId) {
        super("A collection run is already active for requester " + requesterId);
    }
}
