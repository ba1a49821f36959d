package dev.univer.collector.service;

import dev.univer.collector.gateway.AuthorizationRequiredException;
import dev.univer.collector.gateway.ChatAccessException;
import dev.univer.collector.model.*;
import dev.univer.collector.util.NormalizeUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Collects the distinct senders of one credential's chats for a date.
 *
 * <p>At most {@code collector.concurrency} chats of the credential are traversed at once.
 * Chats fail independently; only an authorization failure stops the whole credential.
 * A chat that is cancelled before it finishes contributes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatProcessor {

    private final CollectorProperties props;
    private final WindowResolver resolver;
    private final ExecutorService collectorExecutor;
    private final Clock clock;

    public boolean isEligible(ChatInfo chat) {
        return chat.participantCount() > props.getMinParticipants();
    }

    public CollectionResult collect(Credential credential, LocalDate targetDate, CancellationSignal cancellation)
            throws ChatAccessException {
        RateLimitedFetcher fetcher = new RateLimitedFetcher(
                credential.id(), props.getTransientRetries(), props.getTransientRetryDelay());

        List<ChatInfo> chats = fetcher.call(credential.gateway()::fetchChats, cancellation);
        List<ChatInfo> eligible = chats.stream().filter(this::isEligible).toList();
        log.info("[{}] Found {} eligible groups (filtered from {} total) for {}",
                 credential.id(), eligible.size(), chats.size(), targetDate);

        CancellationSignal chatSignal = cancellation.child();
        AtomicReference<AuthorizationRequiredException> fatal = new AtomicReference<>();
        Semaphore slots = new Semaphore(props.getConcurrency());
        List<CompletableFuture<ChatOutcome>> tasks = new ArrayList<>();

        for (ChatInfo chat : eligible) {
            if (chatSignal.isCancelled()) break;
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                chatSignal.cancel();
                break;
            }
            if (chatSignal.isCancelled()) {
                slots.release();
                break;
            }
            ChatStream stream = new ChatStream(credential.gateway(), fetcher, chat, chatSignal);
            try {
                tasks.add(CompletableFuture.supplyAsync(
                        () -> runChat(credential, stream, targetDate, chatSignal, fatal, slots), collectorExecutor));
            } catch (RuntimeException e) {
                slots.release();
                throw e;
            }
        }

        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

        if (fatal.get() != null) throw fatal.get();

        Map<Long, IdentityRecord> merged = new LinkedHashMap<>();
        List<ChatFailure> failures = new ArrayList<>();
        int completed = 0;
        for (CompletableFuture<ChatOutcome> task : tasks) {
            ChatOutcome outcome = task.join();
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            } else if (!outcome.cancelled()) {
                completed++;
                outcome.senders().forEach(merged::putIfAbsent);
            }
        }
        boolean cancelled = cancellation.isCancelled() && completed + failures.size() < eligible.size();
        log.info("[{}] Collected {} unique users from {} chats ({} failed{})", credential.id(), merged.size(),
                 tasks.size(), failures.size(), cancelled ? ", run cancelled" : "");
        return new CollectionResult(merged.values(), eligible.size(), tasks.size(), failures, cancelled);
    }

    private ChatOutcome runChat(Credential credential,
                                ChatStream stream,
                                LocalDate targetDate,
                                CancellationSignal signal,
                                AtomicReference<AuthorizationRequiredException> fatal,
                                Semaphore slots) {
        ChatInfo chat = stream.getChat();
        String label = NormalizeUtil.chatLabel(chat.title(), chat.id());
        try {
            return ChatOutcome.completed(traverse(credential, stream, targetDate, signal));
        } catch (AuthorizationRequiredException e) {
            fatal.compareAndSet(null, e);
            signal.cancel();
            return ChatOutcome.failed(new ChatFailure(chat.id(), chat.title(), e.getMessage()));
        } catch (CancellationException e) {
            log.info("[{}] Traversal of {} cancelled, partial results discarded", credential.id(), label);
            return ChatOutcome.abandoned();
        } catch (ChatAccessException e) {
            log.warn("[{}] Error processing {}: {}", credential.id(), label, e.getMessage());
            return ChatOutcome.failed(new ChatFailure(chat.id(), chat.title(), e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("[{}] Error processing {}", credential.id(), label, e);
            return ChatOutcome.failed(new ChatFailure(chat.id(), chat.title(), NormalizeUtil.describe(e)));
        } finally {
            slots.release();
        }
    }

    private Map<Long, IdentityRecord> traverse(Credential credential,
                                               ChatStream stream,
                                               LocalDate targetDate,
                                               CancellationSignal signal) throws ChatAccessException {
        ChatInfo chat = stream.getChat();
        signal.throwIfCancelled();
        log.info("[{}] Processing group: {} (members: {})",
                 credential.id(), NormalizeUtil.chatLabel(chat.title(), chat.id()), chat.participantCount());

        Optional<MessageWindow> window = resolver.resolve(stream, targetDate);
        if (window.isEmpty()) {
            log.info("[{}] No messages in {} for {}", credential.id(), chat.title(), targetDate);
            return Map.of();
        }

        Map<Long, IdentityRecord> senders = new LinkedHashMap<>();
        long next = window.get().startId();
        long end = window.get().endId();
        int messageCount = 0;
        while (next <= end) {
            signal.throwIfCancelled();
            List<ChatMessage> page = stream.page(next, end, props.getPageSize());
            if (page.isEmpty()) break;
            for (ChatMessage message : page) {
                messageCount++;
                if (message.sender() == null || !targetDate.equals(resolver.dateOf(message))) continue;
                senders.computeIfAbsent(message.sender().userId(), id -> toRecord(credential, chat, message));
            }
            next = page.get(page.size() - 1).id() + 1;
        }
        log.info("[{}] Group {}: {} unique users from {} messages",
                 credential.id(), chat.title(), senders.size(), messageCount);
        return senders;
    }

    private IdentityRecord toRecord(Credential credential, ChatInfo chat, ChatMessage message) {
        Sender s = message.sender();
        return IdentityRecord.builder()
                .userId(s.userId())
                .username(NormalizeUtil.normalizeUsername(s.username()))
                .firstName(s.firstName())
                .lastName(s.lastName())
                .phone(s.phone())
                .premium(s.premium())
                .verified(s.verified())
                .bot(s.bot())
                .firstSeenAt(message.postedAt())
                .collectedAt(Instant.now(clock))
                .sourceChatId(chat.id())
                .sourceChatTitle(chat.title())
                .credentialId(credential.id())
                .build();
    }

    private record ChatOutcome(Map<Long, IdentityRecord> senders, ChatFailure failure, boolean cancelled) {
        static ChatOutcome completed(Map<Long, IdentityRecord> senders) {
            return new ChatOutcome(senders, null, false);
        }

        static ChatOutcome failed(ChatFailure failure) {
            return new ChatOutcome(Map.of(), failure, false);
        }

        static ChatOutcome abandoned() {
            return new ChatOutcome(Map.of(), null, true);
        }
    }
}
