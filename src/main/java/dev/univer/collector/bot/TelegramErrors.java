package dev.univer.collector.bot;

import dev.univer.collector.gateway.*;
import org.telegram.telegrambots.meta.api.objects.ResponseParameters;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.time.Duration;

/** Maps Bot API failures onto the {@link ChatAccessException} taxonomy. */
public final class TelegramErrors {

    // used when a 429 arrives without retry_after
    static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(5);

    private TelegramErrors() {
    }

    public static ChatAccessException translate(TelegramApiException e) {
        if (e instanceof TelegramApiRequestException request && request.getErrorCode() != null
                && request.getErrorCode() > 0) {
            int code = request.getErrorCode();
            String text = "Telegram error " + code + ": " + request.getApiResponse();
            if (code == 429) return new RateLimitedException(retryAfter(request.getParameters()), e);
            if (code == 401) return new AuthorizationRequiredException(text, e);
            if (code >= 500) return new TransientNetworkException(text, e);
            return new ChatUnavailableException(text, e);
        }
        return new TransientNetworkException("Telegram request failed: " + e.getMessage(), e);
    }

    private static Duration retryAfter(ResponseParameters parameters) {
        if (parameters == null || parameters.getRetryAfter() == null) return DEFAULT_RETRY_AFTER;
        return Duration.ofSeconds(parameters.getRetryAfter());
    }
}
