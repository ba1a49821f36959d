package dev.univer.collector.bot;

import dev.univer.collector.gateway.*;
import dev.univer.collector.model.ChatInfo;
import dev.univer.collector.model.ChatMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMemberCount;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ChatGateway} of one bot credential.
 *
 * <p>Chats and messages come from the bot's journal; participant counts are asked from the
 * Bot API. A chat whose member count cannot be read is left out of the listing.
 */
@RequiredArgsConstructor
@Slf4j
public class TelegramChatGateway implements ChatGateway {

    private final AbsSender sender;
    private final MessageJournal journal;

    @Override
    public List<ChatInfo> fetchChats() throws ChatAccessException {
        List<ChatInfo> chats = new ArrayList<>();
        for (MessageJournal.JournaledChat chat : journal.chats()) {
            Integer members;
            try {
                members = sender.execute(GetChatMemberCount.builder()
                                                 .chatId(String.valueOf(chat.getId()))
                                                 .build());
            } catch (TelegramApiException e) {
                ChatAccessException failure = TelegramErrors.translate(e);
                if (!(failure instanceof ChatUnavailableException)) throw failure;
                log.warn("[{}] Skipping chat {}: {}", journal.getCredentialId(), chat.getId(), failure.getMessage());
                continue;
            }
            chats.add(new ChatInfo(chat.getId(), chat.getTitle(), members == null ? 0 : members, chat.lastMessageId()));
        }
        return chats;
    }

    @Override
    public List<ChatMessage> fetchMessageWindow(long chatId, long minId, long maxId, int limit, MessageOrder order) {
        return journal.window(chatId, minId, maxId, limit, order);
    }
}
