package dev.univer.collector.service;

import dev.univer.collector.gateway.ChatAccessException;
import dev.univer.collector.model.ChatInfo;
import dev.univer.collector.model.ChatMessage;
import dev.univer.collector.model.MessageWindow;
import dev.univer.collector.util.NormalizeUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Finds the range of message ids posted on one calendar date.
 *
 * <p>Message ids grow with post time but the two are not linearly related, so both ends are
 * located by binary search over the id space, each probe fetching the nearest existing
 * message. The pair found is then checked once more at each end. A boundary that fails the
 * check moves inwards; the window only ever narrows. When the ends still disagree after
 * {@code maxNarrowingSteps} moves, the chat is reported as having no window.
 */
@Component
@Slf4j
public class WindowResolver {

    private final ZoneId zone;
    private final int maxNarrowingSteps;

    public WindowResolver(CollectorProperties props) {
        this.zone = props.zone();
        this.maxNarrowingSteps = props.getMaxNarrowingSteps();
    }

    public Optional<MessageWindow> resolve(ChatStream stream, LocalDate targetDate) throws ChatAccessException {
        ChatInfo chat = stream.getChat();
        long lastId = chat.lastMessageId();
        if (lastId <= 0) return Optional.empty();

        Optional<ChatMessage> first = lowerBound(stream, targetDate, lastId);
        Optional<ChatMessage> last = upperBound(stream, targetDate, lastId);
        if (first.isEmpty() || last.isEmpty() || first.get().id() > last.get().id()) {
            log.debug("No messages in {} for {}", NormalizeUtil.chatLabel(chat.title(), chat.id()), targetDate);
            return Optional.empty();
        }
        return validate(stream, targetDate, first.get().id(), last.get().id());
    }

    public LocalDate dateOf(ChatMessage message) {
        return message.postedAt().atZone(zone).toLocalDate();
    }

    // earliest message dated on or after the target, kept only if it is on the target
    private Optional<ChatMessage> lowerBound(ChatStream stream, LocalDate target, long lastId) throws ChatAccessException {
        long lo = 1;
        long hi = lastId;
        ChatMessage found = null;
        while (lo <= hi) {
            long mid = lo + (hi - lo) / 2;
            Optional<ChatMessage> probe = stream.firstBetween(mid, lastId);
            if (probe.isEmpty()) {
                hi = mid - 1;
                continue;
            }
            ChatMessage m = probe.get();
            if (dateOf(m).isBefore(target)) {
                lo = m.id() + 1;
            } else {
                found = m;
                hi = mid - 1;
            }
        }
        return Optional.ofNullable(found).filter(m -> dateOf(m).equals(target));
    }

    // latest message dated on or before the target, kept only if it is on the target
    private Optional<ChatMessage> upperBound(ChatStream stream, LocalDate target, long lastId) throws ChatAccessException {
        long lo = 1;
        long hi = lastId;
        ChatMessage found = null;
        while (lo <= hi) {
            long mid = lo + (hi - lo) / 2;
            Optional<ChatMessage> probe = stream.lastBetween(1, mid);
            if (probe.isEmpty()) {
                lo = mid + 1;
                continue;
            }
            ChatMessage m = probe.get();
            if (dateOf(m).isAfter(target)) {
                hi = m.id() - 1;
            } else {
                found = m;
                lo = mid + 1;
            }
        }
        return Optional.ofNullable(found).filter(m -> dateOf(m).equals(target));
    }

    private Optional<MessageWindow> validate(ChatStream stream, LocalDate target, long start, long end)
            throws ChatAccessException {
        ChatInfo chat = stream.getChat();
        int steps = 0;
        while (start <= end) {
            Optional<ChatMessage> head = stream.firstBetween(start, end);
            Optional<ChatMessage> tail = stream.lastBetween(start, end);
            if (head.isEmpty() || tail.isEmpty()) break;

            boolean headOnDate = dateOf(head.get()).equals(target);
            boolean tailOnDate = dateOf(tail.get()).equals(target);
            if (headOnDate && tailOnDate) {
                MessageWindow window = new MessageWindow(head.get().id(), tail.get().id());
                log.debug("Window for {} on {}: {}-{}", NormalizeUtil.chatLabel(chat.title(), chat.id()),
                          target, window.startId(), window.endId());
                return Optional.of(window);
            }
            if (++steps > maxNarrowingSteps) break;
            if (!headOnDate) start = head.get().id() + 1;
            if (!tailOnDate) end = tail.get().id() - 1;
        }
        log.warn("Inconsistent boundaries in {} for {} after {} narrowing steps, treating as empty",
                 NormalizeUtil.chatLabel(chat.title(), chat.id()), target, steps);
        return Optional.empty();
    }
}
