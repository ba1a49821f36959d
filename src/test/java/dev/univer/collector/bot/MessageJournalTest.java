package dev.univer.collector.bot;

import dev.univer.collector.gateway.MessageOrder;
import dev.univer.collector.model.ChatMessage;
import dev.univer.collector.model.Sender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageJournalTest {

    private static final Instant BASE = Instant.parse("2024-03-15T10:00:00Z");

    private MessageJournal journal;

    @BeforeEach
    void setUp() {
        journal = new MessageJournal("bot1");
        Sender sender = new Sender(5, "eve", "Eve", null, null, false, false, false);
        for (long id : new long[]{3, 1, 7, 5, 9}) {
            journal.record(-42, "Readers", new ChatMessage(id, BASE.plusSeconds(id * 60), sender));
        }
    }

    @Test
    void windowIsOrderedAndLimited() {
        assertThat(ids(journal.window(-42, 2, 9, 10, MessageOrder.OLDEST_FIRST))).containsExactly(3L, 5L, 7L, 9L);
        assertThat(ids(journal.window(-42, 1, 9, 2, MessageOrder.NEWEST_FIRST))).containsExactly(9L, 7L);
        assertThat(ids(journal.window(-42, 4, 4, 1, MessageOrder.OLDEST_FIRST))).isEmpty();
    }

    @Test
    void unknownChatOrEmptyRangeYieldsNothing() {
        assertThat(journal.window(-1, 1, 100, 10, MessageOrder.OLDEST_FIRST)).isEmpty();
        assertThat(journal.window(-42, 9, 1, 10, MessageOrder.OLDEST_FIRST)).isEmpty();
        assertThat(journal.window(-42, 1, 9, 0, MessageOrder.OLDEST_FIRST)).isEmpty();
    }

    @Test
    void chatKeepsLatestTitleAndHighestId() {
        journal.record(-42, "Readers Club", new ChatMessage(8, BASE, null));
        journal.record(-42, null, new ChatMessage(2, BASE, null));

        MessageJournal.JournaledChat chat = journal.chats().get(0);
        assertThat(chat.getId()).isEqualTo(-42L);
        assertThat(chat.getTitle()).isEqualTo("Readers Club");
        assertThat(chat.lastMessageId()).isEqualTo(9L);
    }

    @Test
    void pruneDropsMessagesOlderThanCutoff() {
        int removed = journal.prune(BASE.plusSeconds(5 * 60));

        assertThat(removed).isEqualTo(2);
        assertThat(ids(journal.window(-42, 1, 100, 10, MessageOrder.OLDEST_FIRST))).containsExactly(5L, 7L, 9L);
    }

    private static List<Long> ids(List<ChatMessage> messages) {
        return messages.stream().map(ChatMessage::id).toList();
    }
}
