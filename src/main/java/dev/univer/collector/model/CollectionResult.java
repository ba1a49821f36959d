package dev.univer.collector.model;

import java.util.Collection;
import java.util.List;

/**
 * Distinct senders collected for one credential.
 *
 * @param chatsAttempted eligible chats whose traversal was started
 * @param cancelled      the run was cancelled before every eligible chat finished
 */
public record CollectionResult(Collection<IdentityRecord> records,
                               int chatsEligible,
                               int chatsAttempted,
                               List<ChatFailure> failures,
                               boolean cancelled) {
}
