package dev.univer.collector.model;

import java.util.List;

public record CredentialSummary(String credentialId,
                                Status status,
                                int chatsAttempted,
                                List<ChatFailure> chatFailures,
                                int insertedCount,
                                int duplicateCount,
                                List<BatchError> batchErrors,
                                String message) {

    public enum Status { COMPLETED, CANCELLED, NEEDS_REAUTHORIZATION, FAILED }

    public static CredentialSummary of(String credentialId, CollectionResult collected, PersistResult persisted) {
        return new CredentialSummary(
                credentialId,
                collected.cancelled() ? Status.CANCELLED : Status.COMPLETED,
                collected.chatsAttempted(),
                List.copyOf(collected.failures()),
                persisted.insertedCount(),
                persisted.duplicateCount(),
                List.copyOf(persisted.batchErrors()),
                null);
    }

    public static CredentialSummary aborted(String credentialId, Status status, String message) {
        return new CredentialSummary(credentialId, status, 0, List.of(), 0, 0, List.of(), message);
    }

    public int chatsFailed() {
        return chatFailures.size();
    }
}
