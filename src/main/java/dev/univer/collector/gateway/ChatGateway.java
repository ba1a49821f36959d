package dev.univer.collector.gateway;

import dev.univer.collector.model.ChatInfo;
import dev.univer.collector.model.ChatMessage;

import java.util.List;

/**
 * Read access to the chats one credential can see.
 *
 * <p>Implementations do not retry. Rate limits are reported as {@link RateLimitedException}
 * and handled by the caller's fetch wrapper.
 */
public interface ChatGateway {

    /** Chats the credential can enumerate, with participant counts and last message id. */
    List<ChatInfo> fetchChats() throws ChatAccessException;

    /**
     * Messages of one chat with {@code minId <= id <= maxId}, at most {@code limit} of them,
     * taken from the oldest or newest end of the range depending on {@code order}.
     */
    List<ChatMessage> fetchMessageWindow(long chatId, long minId, long maxId, int limit, MessageOrder order)
            throws ChatAccessException;
}
