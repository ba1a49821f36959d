package dev.univer.collector.service;

import dev.univer.collector.model.BatchError;
import dev.univer.collector.model.IdentityRecord;
import dev.univer.collector.model.ManualEntryResult;
import dev.univer.collector.model.PersistResult;
import dev.univer.collector.util.NormalizeUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Adds identities typed in by an operator, one per line: {@code id [@username] [first] [last]}.
 *
 * <p>Ids already stored are skipped. The rest go through {@link IdentityPersistenceService},
 * so a backup is taken first and the writes share the store's gate with collection runs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManualEntryService {

    public static final String SOURCE_TITLE = "manual";

    private final IdentityStore store;
    private final IdentityPersistenceService persistenceService;
    private final CollectorProperties props;
    private final Clock clock;

    public ManualEntryResult add(String text) {
        List<String> lines = text == null || text.isBlank() ? List.of() : List.of(text.strip().split("\\R"));
        if (lines.size() > props.getManualEntryLimit()) {
            throw new IllegalArgumentException(
                    "At most " + props.getManualEntryLimit() + " users at a time, got " + lines.size());
        }

        Instant now = Instant.now(clock);
        Map<Long, IdentityRecord> pending = new LinkedHashMap<>();
        List<Long> skipped = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String[] parts = lines.get(i).trim().split("\\s+");
            if (parts[0].isEmpty()) continue;

            long userId;
            try {
                userId = Long.parseLong(parts[0]);
            } catch (NumberFormatException e) {
                errors.add("Line " + (i + 1) + ": invalid id '" + parts[0] + "'");
                continue;
            }
            if (pending.containsKey(userId) || store.findById(userId).isPresent()) {
                skipped.add(userId);
                continue;
            }
            pending.put(userId, toRecord(userId, parts, now));
        }

        List<Long> added = new ArrayList<>();
        if (!pending.isEmpty()) {
            PersistResult persisted = persistenceService.persist(pending.values());
            persisted.insertedRecords().forEach(r -> added.add(r.getUserId()));
            for (BatchError error : persisted.batchErrors()) {
                errors.add("Batch " + error.batchIndex() + ": " + error.message());
            }
            if (persisted.batchErrors().isEmpty()) {
                // stored by someone else between the lookup and the insert
                pending.keySet().stream().filter(id -> !added.contains(id)).forEach(skipped::add);
            }
        }

        long total = store.statistics().totalUsers();
        log.info("Manual entry: +{} added, {} skipped, {} errors, {} users stored",
                 added.size(), skipped.size(), errors.size(), total);
        return new ManualEntryResult(added, skipped, errors, total);
    }

    private static IdentityRecord toRecord(long userId, String[] parts, Instant now) {
        String username = null;
        String firstName = null;
        String lastName = null;
        for (int p = 1; p < parts.length; p++) {
            String part = parts[p];
            if (part.charAt(0) == NormalizeUtil.USERNAME_MARKER) {
                username = NormalizeUtil.normalizeUsername(part);
            } else if (firstName == null) {
                firstName = part;
            } else if (lastName == null) {
                lastName = part;
            }
        }
        return IdentityRecord.builder()
                .userId(userId)
                .username(username)
                .firstName(firstName)
                .lastName(lastName)
                .collectedAt(now)
                .sourceChatTitle(SOURCE_TITLE)
                .build();
    }
}
