package dev.univer.collector.service;

import dev.univer.collector.model.BackupSnapshot;
import dev.univer.collector.model.BatchError;
import dev.univer.collector.model.IdentityRecord;
import dev.univer.collector.model.PersistResult;
import dev.univer.collector.util.NormalizeUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Stores the records whose user id is not stored yet.
 *
 * <p>A backup is taken before anything is written. New records go in fixed-size batches,
 * each committed on its own: a failed batch is reported and skipped, batches already
 * committed stay, the following batches are still attempted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityPersistenceService {

    private final IdentityStore store;
    private final CollectorProperties props;

    public PersistResult persist(Collection<IdentityRecord> identities) {
        Map<Long, IdentityRecord> distinct = new LinkedHashMap<>();
        for (IdentityRecord r : identities) distinct.putIfAbsent(r.getUserId(), r);
        if (distinct.isEmpty()) {
            log.info("No users collected, nothing to persist");
            return PersistResult.empty();
        }

        BackupSnapshot backup = store.snapshot();

        Set<Long> existing = store.existingIds(distinct.keySet());
        List<IdentityRecord> fresh = distinct.values().stream()
                .filter(r -> !existing.contains(r.getUserId()))
                .toList();
        log.info("{} collected users, {} already stored, {} new", distinct.size(), existing.size(), fresh.size());

        int batchSize = props.getBatchSize();
        int duplicates = existing.size();
        List<IdentityRecord> inserted = new ArrayList<>(fresh.size());
        List<BatchError> errors = new ArrayList<>();
        for (int from = 0, index = 0; from < fresh.size(); from += batchSize, index++) {
            List<IdentityRecord> batch = List.copyOf(fresh.subList(from, Math.min(fresh.size(), from + batchSize)));
            try {
                IdentityStore.BatchOutcome outcome = store.insertBatch(batch);
                inserted.addAll(outcome.inserted());
                duplicates += outcome.ignoredCount();
                log.debug("Batch {} committed: {} inserted, {} ignored", index, outcome.inserted().size(),
                          outcome.ignoredCount());
            } catch (RuntimeException e) {
                log.error("Batch {} of {} records failed", index, batch.size(), e);
                errors.add(new BatchError(index, batch.size(), NormalizeUtil.describe(e)));
            }
        }

        log.info("Database updated: +{} new users, {} duplicates, {} failed batches",
                 inserted.size(), duplicates, errors.size());
        return new PersistResult(inserted.size(), duplicates, errors, inserted, backup);
    }
}
