package dev.univer.collector.service;

import dev.univer.collector.gateway.ChatAccessException;
import dev.univer.collector.gateway.ChatGateway;
import dev.univer.collector.gateway.MessageOrder;
import dev.univer.collector.model.ChatInfo;
import dev.univer.collector.model.ChatMessage;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Message reads of one chat, every call going through the credential's fetcher.
 * No read is issued once the chat's signal is cancelled.
 */
@RequiredArgsConstructor
public class ChatStream {

    private final ChatGateway gateway;
    private final RateLimitedFetcher fetcher;
    @Getter
    private final ChatInfo chat;
    private final CancellationSignal signal;

    public Optional<ChatMessage> firstBetween(long fromId, long toId) throws ChatAccessException {
        return first(fetch(fromId, toId, 1, MessageOrder.OLDEST_FIRST));
    }

    public Optional<ChatMessage> lastBetween(long fromId, long toId) throws ChatAccessException {
        return first(fetch(fromId, toId, 1, MessageOrder.NEWEST_FIRST));
    }

    /** Up to {@code limit} messages from the start of the range, oldest first. */
    public List<ChatMessage> page(long fromId, long toId, int limit) throws ChatAccessException {
        return fetch(fromId, toId, limit, MessageOrder.OLDEST_FIRST);
    }

    private List<ChatMessage> fetch(long fromId, long toId, int limit, MessageOrder order) throws ChatAccessException {
        signal.throwIfCancelled();
        if (fromId > toId) return List.of();
        return fetcher.call(() -> gateway.fetchMessageWindow(chat.id(), fromId, toId, limit, order), signal);
    }

    private static Optional<ChatMessage> first(List<ChatMessage> messages) {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(0));
    }
}
