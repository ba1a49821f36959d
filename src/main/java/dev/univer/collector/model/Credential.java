package dev.univer.collector.model;

import dev.univer.collector.bot.MessageJournal;
import dev.univer.collector.gateway.ChatGateway;

/**
 * An isolated remote identity with its own session and rate limit budget.
 *
 * @param journal local message log behind the gateway, {@code null} when the gateway has none
 */
public record Credential(String id, ChatGateway gateway, MessageJournal journal) {

    public Credential(String id, ChatGateway gateway) {
        this(id, gateway, null);
    }
}
