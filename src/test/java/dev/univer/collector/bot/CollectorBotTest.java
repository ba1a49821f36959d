package dev.univer.collector.bot;

import dev.univer.collector.gateway.MessageOrder;
import dev.univer.collector.model.ChatMessage;
import dev.univer.collector.model.Sender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CollectorBotTest {

    private MessageJournal journal;
    private CollectorBot bot;

    @BeforeEach
    void setUp() {
        journal = new MessageJournal("main");
        bot = new CollectorBot("main", "collector_bot", "123:test-token", journal);
    }

    @Test
    void groupAndSupergroupMessagesAreJournaled() {
        bot.onUpdateReceived(update(-10L, "group", "Neighbours", 1, user(7L, "nina", true)));
        bot.onUpdateReceived(update(-1001L, "supergroup", "City", 2, user(8L, "oleg", false)));

        assertThat(journal.chats()).extracting(MessageJournal.JournaledChat::getId)
                .containsExactlyInAnyOrder(-10L, -1001L);
        List<ChatMessage> messages = journal.window(-10L, 1, 10, 10, MessageOrder.OLDEST_FIRST);
        assertThat(messages).hasSize(1);
        ChatMessage message = messages.get(0);
        assertThat(message.id()).isEqualTo(1L);
        assertThat(message.postedAt()).isEqualTo(Instant.ofEpochSecond(1_710_500_000L));
        assertThat(message.sender()).isEqualTo(new Sender(7L, "nina", "Nina", null, null, true, false, false));
    }

    @Test
    void privateChatsAndNonMessageUpdatesAreIgnored() {
        bot.onUpdateReceived(update(55L, "private", null, 1, user(55L, "pat", false)));
        Update callback = new Update();
        callback.setUpdateId(9);
        bot.onUpdateReceived(callback);

        assertThat(journal.chats()).isEmpty();
    }

    @Test
    void messageWithoutAuthorHasNoSender() {
        bot.onUpdateReceived(update(-10L, "group", "Neighbours", 3, null));

        assertThat(journal.window(-10L, 1, 10, 10, MessageOrder.OLDEST_FIRST))
                .singleElement()
                .extracting(ChatMessage::sender)
                .isNull();
    }

    @Test
    void botUsernameComesFromConfiguration() {
        assertThat(bot.getBotUsername()).isEqualTo("collector_bot");
        assertThat(bot.getCredentialId()).isEqualTo("main");
    }

    private static Update update(long chatId, String type, String title, int messageId, User from) {
        Chat chat = new Chat();
        chat.setId(chatId);
        chat.setType(type);
        chat.setTitle(title);
        Message message = new Message();
        message.setMessageId(messageId);
        message.setDate(1_710_500_000);
        message.setChat(chat);
        message.setFrom(from);
        Update update = new Update();
        update.setUpdateId(messageId);
        update.setMessage(message);
        return update;
    }

    private static User user(long id, String username, boolean premium) {
        User user = new User();
        user.setId(id);
        user.setFirstName(username.substring(0, 1).toUpperCase() + username.substring(1));
        user.setUserName(username);
        user.setIsBot(false);
        user.setIsPremium(premium);
        return user;
    }
}
