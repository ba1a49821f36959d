package dev.univer.collector.service;

import dev.univer.collector.gateway.ChatAccessException;
import dev.univer.collector.gateway.ChatGateway;
import dev.univer.collector.gateway.InMemoryChatGateway;
import dev.univer.collector.gateway.MessageOrder;
import dev.univer.collector.model.ChatInfo;
import dev.univer.collector.model.ChatMessage;
import dev.univer.collector.model.MessageWindow;
import dev.univer.collector.model.Sender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowResolverTest {

    private static final long CHAT = -100L;
    private static final LocalDate DAY_14 = LocalDate.of(2024, 3, 14);
    private static final LocalDate DAY_15 = LocalDate.of(2024, 3, 15);
    private static final LocalDate DAY_16 = LocalDate.of(2024, 3, 16);
    private static final LocalDate DAY_18 = LocalDate.of(2024, 3, 18);

    private final Sender sender = new Sender(1, "alice", "Alice", null, null, false, false, false);
    private final RateLimitedFetcher fetcher = new RateLimitedFetcher("test", 1, Duration.ZERO);

    private CollectorProperties props;
    private WindowResolver resolver;
    private InMemoryChatGateway gateway;

    @BeforeEach
    void setUp() {
        props = new CollectorProperties();
        resolver = new WindowResolver(props);
        gateway = new InMemoryChatGateway().addChat(CHAT, "Chat", 50);
        // 1-10 on the 14th, 11-20 on the 15th with 13 and 18 deleted, 21-30 on the 16th,
        // nothing on the 17th, 31-35 on the 18th
        for (long id = 1; id <= 10; id++) add(id, DAY_14);
        for (long id = 11; id <= 20; id++) if (id != 13 && id != 18) add(id, DAY_15);
        for (long id = 21; id <= 30; id++) add(id, DAY_16);
        for (long id = 31; id <= 35; id++) add(id, DAY_18);
    }

    @Test
    void resolvedWindowStartsAndEndsOnTheTargetDate() throws Exception {
        ChatStream stream = stream();

        Optional<MessageWindow> window = resolver.resolve(stream, DAY_15);

        assertThat(window).contains(new MessageWindow(11, 20));
        assertThat(resolver.dateOf(stream.firstBetween(11, 11).orElseThrow())).isEqualTo(DAY_15);
        assertThat(resolver.dateOf(stream.lastBetween(20, 20).orElseThrow())).isEqualTo(DAY_15);
    }

    @Test
    void windowBoundariesSkipDeletedIds() throws Exception {
        gateway = new InMemoryChatGateway().addChat(CHAT, "Chat", 50);
        for (long id = 1; id <= 10; id++) add(id, DAY_14);
        for (long id = 14; id <= 17; id++) add(id, DAY_15);
        for (long id = 25; id <= 30; id++) add(id, DAY_16);

        assertThat(resolver.resolve(stream(), DAY_15)).contains(new MessageWindow(14, 17));
    }

    @Test
    void firstAndLastDayOfTheChatAreResolved() throws Exception {
        assertThat(resolver.resolve(stream(), DAY_14)).contains(new MessageWindow(1, 10));
        assertThat(resolver.resolve(stream(), DAY_18)).contains(new MessageWindow(31, 35));
    }

    @Test
    void dayWithoutMessagesHasNoWindow() throws Exception {
        assertThat(resolver.resolve(stream(), LocalDate.of(2024, 3, 17))).isEmpty();
        assertThat(resolver.resolve(stream(), LocalDate.of(2024, 3, 1))).isEmpty();
        assertThat(resolver.resolve(stream(), LocalDate.of(2024, 4, 1))).isEmpty();
    }

    @Test
    void chatWithoutMessagesHasNoWindow() throws Exception {
        InMemoryChatGateway empty = new InMemoryChatGateway().addChat(7, "Empty", 50);
        ChatStream stream = new ChatStream(empty, fetcher, empty.fetchChats().get(0), new CancellationSignal());

        assertThat(resolver.resolve(stream, DAY_15)).isEmpty();
        assertThat(empty.windowCalls(7)).isZero();
    }

    @Test
    void singleMessageDayResolvesToOneId() throws Exception {
        gateway = new InMemoryChatGateway().addChat(CHAT, "Chat", 50);
        add(4, DAY_14);
        add(9, DAY_15);
        add(12, DAY_16);

        assertThat(resolver.resolve(stream(), DAY_15)).contains(new MessageWindow(9, 9));
    }

    @Test
    void datesAreEvaluatedInConfiguredZone() throws Exception {
        gateway = new InMemoryChatGateway().addChat(CHAT, "Chat", 50)
                .addMessage(CHAT, 1, Instant.parse("2024-03-14T20:00:00Z"), sender)
                .addMessage(CHAT, 2, Instant.parse("2024-03-14T23:30:00Z"), sender)
                .addMessage(CHAT, 3, Instant.parse("2024-03-15T12:00:00Z"), sender);
        props.setZoneId("Europe/Moscow");
        resolver = new WindowResolver(props);

        // 23:30Z on the 14th is 02:30 on the 15th in Moscow
        assertThat(resolver.resolve(stream(), DAY_15)).contains(new MessageWindow(2, 3));
    }

    @Test
    void inconsistentBoundaryIsNarrowedInwards() throws Exception {
        ChatStream flaky = new BoundaryFlipStream(stream(), 11, 20, 1);

        assertThat(resolver.resolve(flaky, DAY_15)).contains(new MessageWindow(12, 20));
    }

    @Test
    void persistentInconsistencyYieldsNoWindow() throws Exception {
        ChatStream flaky = new BoundaryFlipStream(stream(), 11, 20, Integer.MAX_VALUE);

        assertThat(resolver.resolve(flaky, DAY_15)).isEmpty();
    }

    @Test
    void cancelledChatStopsResolving() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        ChatGateway cancelling = new ChatGateway() {
            @Override
            public List<ChatInfo> fetchChats() throws ChatAccessException {
                return gateway.fetchChats();
            }

            @Override
            public List<ChatMessage> fetchMessageWindow(long chatId, long minId, long maxId, int limit,
                                                        MessageOrder order) throws ChatAccessException {
                calls.incrementAndGet();
                signal.cancel();
                return gateway.fetchMessageWindow(chatId, minId, maxId, limit, order);
            }
        };
        ChatStream stream = new ChatStream(cancelling, fetcher, gateway.fetchChats().get(0), signal);

        assertThatThrownBy(() -> resolver.resolve(stream, DAY_15)).isInstanceOf(CancellationException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    private ChatStream stream() throws ChatAccessException {
        ChatInfo chat = gateway.fetchChats().get(0);
        return new ChatStream(gateway, fetcher, chat, new CancellationSignal());
    }

    private void add(long id, LocalDate day) {
        gateway.addMessage(CHAT, id, day.atTime(8, 0).plusMinutes(id).toInstant(ZoneOffset.UTC), sender);
    }

    /**
     * Reports the head of the window as posted the day before, the way a boundary message
     * edited or moved between two probes would look.
     */
    private static class BoundaryFlipStream extends ChatStream {

        private final ChatStream delegate;
        private final long windowStart;
        private final long windowEnd;
        private int flipsLeft;

        BoundaryFlipStream(ChatStream delegate, long windowStart, long windowEnd, int flips) {
            super(null, null, delegate.getChat(), new CancellationSignal());
            this.delegate = delegate;
            this.windowStart = windowStart;
            this.windowEnd = windowEnd;
            this.flipsLeft = flips;
        }

        @Override
        public Optional<ChatMessage> firstBetween(long fromId, long toId) throws ChatAccessException {
            if (fromId >= windowStart && toId == windowEnd && flipsLeft > 0) {
                flipsLeft--;
                return Optional.of(new ChatMessage(fromId, DAY_14.atTime(23, 59).toInstant(ZoneOffset.UTC), null));
            }
            return delegate.firstBetween(fromId, toId);
        }

        @Override
        public Optional<ChatMessage> lastBetween(long fromId, long toId) throws ChatAccessException {
            return delegate.lastBetween(fromId, toId);
        }
    }
}
