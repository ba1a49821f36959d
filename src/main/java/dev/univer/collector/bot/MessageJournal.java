package dev.univer.collector.bot;

import dev.univer.collector.gateway.MessageOrder;
import dev.univer.collector.model.ChatMessage;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Group messages one bot has received, per chat and ordered by message id.
 * Safe for the bot's update thread writing while runs read.
 */
@RequiredArgsConstructor
public class MessageJournal {

    @Getter
    private final String credentialId;
    private final Map<Long, JournaledChat> chats = new ConcurrentHashMap<>();

    public void record(long chatId, String title, ChatMessage message) {
        JournaledChat chat = chats.computeIfAbsent(chatId, JournaledChat::new);
        if (title != null) chat.title = title;
        chat.messages.put(message.id(), message);
    }

    public List<JournaledChat> chats() {
        return List.copyOf(chats.values());
    }

    public List<ChatMessage> window(long chatId, long minId, long maxId, int limit, MessageOrder order) {
        JournaledChat chat = chats.get(chatId);
        if (chat == null || minId > maxId || limit <= 0) return List.of();
        ConcurrentNavigableMap<Long, ChatMessage> range = chat.messages.subMap(minId, true, maxId, true);
        Collection<ChatMessage> ordered = order == MessageOrder.NEWEST_FIRST
                                          ? range.descendingMap().values()
                                          : range.values();
        List<ChatMessage> result = new ArrayList<>(Math.min(limit, 128));
        for (ChatMessage m : ordered) {
            if (result.size() >= limit) break;
            result.add(m);
        }
        return result;
    }

    /** Removes messages posted before {@code cutoff}; returns how many were removed. */
    public int prune(Instant cutoff) {
        int removed = 0;
        for (JournaledChat chat : chats.values()) {
            Iterator<ChatMessage> it = chat.messages.values().iterator();
            while (it.hasNext()) {
                if (it.next().postedAt().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    public static final class JournaledChat {
        @Getter
        private final long id;
        @Getter
        private volatile String title;
        private final ConcurrentSkipListMap<Long, ChatMessage> messages = new ConcurrentSkipListMap<>();

        private JournaledChat(long id) {
            this.id = id;
        }

        public long lastMessageId() {
            Map.Entry<Long, ChatMessage> last = messages.lastEntry();
            return last == null ? 0 : last.getKey();
        }
    }
}
