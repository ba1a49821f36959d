package dev.univer.collector.service;

import dev.univer.collector.gateway.AuthorizationRequiredException;
import dev.univer.collector.gateway.ChatAccessException;
import dev.univer.collector.model.CollectionResult;
import dev.univer.collector.model.Credential;
import dev.univer.collector.model.CredentialSummary;
import dev.univer.collector.model.CredentialSummary.Status;
import dev.univer.collector.model.PersistResult;
import dev.univer.collector.util.NormalizeUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for the front end: starts and cancels collection runs.
 *
 * <p>Every credential of a run gets its own pipeline (collect, then persist) and always ends
 * with a summary, whatever happened to it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final CredentialRegistry credentialRegistry;
    private final ChatProcessor chatProcessor;
    private final IdentityPersistenceService persistenceService;
    private final MissedDaysService missedDaysService;
    private final RunRegistry runRegistry;
    private final ApplicationEventPublisher publisher;
    private final ExecutorService collectorExecutor;

    public RunHandle startRun(Collection<String> credentialIds, LocalDate targetDate) {
        return startRun(null, credentialIds, targetDate);
    }

    public RunHandle startRun(Long requesterId, Collection<String> credentialIds, LocalDate targetDate) {
        List<Credential> credentials = credentialRegistry.select(credentialIds);
        RunHandle handle = runRegistry.register(requesterId, targetDate);
        log.info("Run {} started for {} on {} credential(s)", handle.getRunId(), targetDate, credentials.size());

        List<CompletableFuture<CredentialSummary>> pipelines = credentials.stream()
                .map(c -> CompletableFuture.supplyAsync(() -> runCredential(handle, c), collectorExecutor))
                .toList();

        CompletableFuture.allOf(pipelines.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> finish(handle));
        return handle;
    }

    public boolean cancel(UUID runId) {
        return runRegistry.find(runId).map(handle -> {
            log.info("Run {} cancellation requested", runId);
            handle.cancel();
            return true;
        }).orElse(false);
    }

    private CredentialSummary runCredential(RunHandle handle, Credential credential) {
        CredentialSummary summary;
        PersistResult persisted = PersistResult.empty();
        try {
            CollectionResult collected = chatProcessor.collect(credential, handle.getTargetDate(), handle.getSignal());
            persisted = persistenceService.persist(collected.records());
            summary = CredentialSummary.of(credential.id(), collected, persisted);
        } catch (AuthorizationRequiredException e) {
            log.error("[{}] Session needs reauthorization: {}", credential.id(), e.getMessage());
            summary = CredentialSummary.aborted(credential.id(), Status.NEEDS_REAUTHORIZATION, e.getMessage());
        } catch (ChatAccessException e) {
            log.error("[{}] Cannot list chats: {}", credential.id(), e.getMessage());
            summary = CredentialSummary.aborted(credential.id(), Status.FAILED, e.getMessage());
        } catch (CancellationException e) {
            log.info("[{}] Cancelled before any chat finished", credential.id());
            summary = CredentialSummary.aborted(credential.id(), Status.CANCELLED, "cancelled");
        } catch (RuntimeException e) {
            log.error("[{}] Run failed", credential.id(), e);
            summary = CredentialSummary.aborted(credential.id(), Status.FAILED, NormalizeUtil.describe(e));
        }

        handle.record(summary);
        log.info("[{}] {}: {} chats attempted, {} failed, +{} new, {} duplicates, {} failed batches",
                 credential.id(), summary.status(), summary.chatsAttempted(), summary.chatsFailed(),
                 summary.insertedCount(), summary.duplicateCount(), summary.batchErrors().size());
        try {
            publisher.publishEvent(new CredentialRunCompletedEvent(
                    handle.getRunId(), handle.getTargetDate(), summary, persisted.insertedRecords()));
        } catch (RuntimeException e) {
            log.error("[{}] Run completion listener failed", credential.id(), e);
        }
        return summary;
    }

    private void finish(RunHandle handle) {
        try {
            List<CredentialSummary> summaries = handle.summaries();
            boolean allCompleted = !summaries.isEmpty()
                    && summaries.stream().allMatch(s -> s.status() == Status.COMPLETED && s.batchErrors().isEmpty());
            if (allCompleted) {
                int inserted = summaries.stream().mapToInt(CredentialSummary::insertedCount).sum();
                missedDaysService.markCollected(handle.getTargetDate(), inserted);
            }
        } catch (RuntimeException e) {
            log.error("Run {}: cannot record collected day {}", handle.getRunId(), handle.getTargetDate(), e);
        } finally {
            runRegistry.remove(handle.getRunId());
            handle.complete();
            log.info("Run {} finished: {}", handle.getRunId(), handle.state());
        }
    }
}
