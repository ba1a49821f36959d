package dev.univer.collector.config;

import dev.univer.collector.bot.CollectorBot;
import dev.univer.collector.bot.MessageJournal;
import dev.univer.collector.bot.TelegramChatGateway;
import dev.univer.collector.model.Credential;
import dev.univer.collector.service.CollectorProperties;
import dev.univer.collector.service.CredentialRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.util.ArrayList;
import java.util.List;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class TelegramBotConfig {

    private final CollectorProperties props;

    @Bean
    public TelegramBotsApi telegramBotsApi() throws TelegramApiException {
        return new TelegramBotsApi(DefaultBotSession.class);
    }

    @Bean
    public CredentialRegistry credentialRegistry() {
        List<Credential> credentials = new ArrayList<>();
        List<CollectorBot> bots = new ArrayList<>();
        for (CollectorProperties.CredentialProperties c : props.getCredentials()) {
            if (c.getId() == null || c.getToken() == null || c.getToken().isBlank()) {
                throw new IllegalStateException("Credential needs an id and a token: " + c.getId());
            }
            MessageJournal journal = new MessageJournal(c.getId());
            CollectorBot bot = new CollectorBot(c.getId(), c.getUsername(), c.getToken(), journal);
            credentials.add(new Credential(c.getId(), new TelegramChatGateway(bot, journal), journal));
            bots.add(bot);
        }
        log.info("Configured {} credential(s)", credentials.size());
        return new CredentialRegistry(credentials, bots);
    }

    @Bean
    public InitializingBean registerBots(TelegramBotsApi api, CredentialRegistry registry) {
        return () -> {
            for (CollectorBot bot : registry.getBots()) {
                try {
                    api.registerBot(bot);
                    log.info("[{}] Bot @{} registered", bot.getCredentialId(), bot.getBotUsername());
                } catch (TelegramApiException e) {
                    throw new RuntimeException("Failed to register Telegram bot " + bot.getCredentialId(), e);
                }
            }
        };
    }
}
