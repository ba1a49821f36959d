package dev.univer.collector.model;

/** Inclusive range of message ids that were all posted on one calendar date. */
public record MessageWindow(long startId, long endId) {

    public MessageWindow {
        if (startId > endId) {
            throw new IllegalArgumentException("startId " + startId + " > endId " + endId);
        }
    }
}
