package dev.univer.collector.service;

import dev.univer.collector.model.CredentialSummary;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/** One collection run as seen by whoever started it. */
@Getter
public class RunHandle {

    public enum State { RUNNING, CANCELLING, COMPLETED, CANCELLED }

    private final UUID runId;
    private final Long requesterId;
    private final LocalDate targetDate;
    private final Instant startedAt;
    private final CancellationSignal signal = new CancellationSignal();
    private final CompletableFuture<List<CredentialSummary>> completion = new CompletableFuture<>();
    private final List<CredentialSummary> summaries = new CopyOnWriteArrayList<>();

    RunHandle(UUID runId, Long requesterId, LocalDate targetDate, Instant startedAt) {
        this.runId = runId;
        this.requesterId = requesterId;
        this.targetDate = targetDate;
        this.startedAt = startedAt;
    }

    public void cancel() {
        signal.cancel();
    }

    public State state() {
        if (completion.isDone()) return signal.isCancelled() ? State.CANCELLED : State.COMPLETED;
        return signal.isCancelled() ? State.CANCELLING : State.RUNNING;
    }

    /** Summaries of the credentials finished so far. */
    public List<CredentialSummary> summaries() {
        return List.copyOf(summaries);
    }

    void record(CredentialSummary summary) {
        summaries.add(summary);
    }

    void complete() {
        completion.complete(List.copyOf(summaries));
    }
}
