package dev.univer.collector.gateway;

public enum MessageOrder {
    OLDEST_FIRST,
    NEWEST_FIRST
}
