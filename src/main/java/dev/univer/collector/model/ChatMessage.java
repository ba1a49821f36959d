package dev.univer.collector.model;

import java.time.Instant;

/** @param sender {@code null} for service messages and posts without a user behind them */
public record ChatMessage(long id, Instant postedAt, Sender sender) {
}
