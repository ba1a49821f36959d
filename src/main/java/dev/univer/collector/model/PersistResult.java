package dev.univer.collector.model;

import java.util.List;

/**
 * Outcome of one persist call.
 * {@code insertedCount + duplicateCount + failedCount()} equals the number of distinct input ids.
 *
 * @param backup {@code null} when nothing was to be written
 */
public record PersistResult(int insertedCount,
                            int duplicateCount,
                            List<BatchError> batchErrors,
                            List<IdentityRecord> insertedRecords,
                            BackupSnapshot backup) {

    public static PersistResult empty() {
        return new PersistResult(0, 0, List.of(), List.of(), null);
    }

    public int failedCount() {
        return batchErrors.stream().mapToInt(BatchError::affectedCount).sum();
    }
}
