package dev.univer.collector.bot;

import dev.univer.collector.model.ChatMessage;
import dev.univer.collector.model.Sender;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

import java.time.Instant;

/** Long-polling bot of one credential. Records every group message it sees into its journal. */
@Slf4j
public class CollectorBot extends TelegramLongPollingBot {

    @Getter
    private final String credentialId;
    private final String username;
    @Getter
    private final MessageJournal journal;

    public CollectorBot(String credentialId, String username, String token, MessageJournal journal) {
        super(token);
        this.credentialId = credentialId;
        this.username = username;
        this.journal = journal;
    }

    @Override public String getBotUsername() { return username; }

    @Override
    public void onUpdateReceived(Update update) {
        log.debug("[{}] Incoming update: {}", credentialId, update.getUpdateId());
        if (!update.hasMessage()) return;
        Message msg = update.getMessage();
        if (msg.getChat() == null) return;
        if (!msg.isGroupMessage() && !msg.isSuperGroupMessage()) return;
        journal.record(msg.getChatId(), msg.getChat().getTitle(), toChatMessage(msg));
    }

    static ChatMessage toChatMessage(Message msg) {
        Instant postedAt = Instant.ofEpochSecond(msg.getDate());
        return new ChatMessage(msg.getMessageId(), postedAt, toSender(msg.getFrom()));
    }

    static Sender toSender(User user) {
        if (user == null) return null;
        // the Bot API exposes neither phone numbers nor the verified flag
        return new Sender(
                user.getId(),
                user.getUserName(),
                user.getFirstName(),
                user.getLastName(),
                null,
                Boolean.TRUE.equals(user.getIsPremium()),
                false,
                Boolean.TRUE.equals(user.getIsBot()));
    }
}
