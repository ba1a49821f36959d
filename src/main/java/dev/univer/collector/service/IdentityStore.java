package dev.univer.collector.service;

import dev.univer.collector.model.BackupSnapshot;
import dev.univer.collector.model.CollectedDay;
import dev.univer.collector.model.IdentityRecord;
import dev.univer.collector.model.StoreStatistics;
import dev.univer.collector.repo.CollectedDayRepository;
import dev.univer.collector.repo.IdentityRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Access to the identity table through a bounded set of connections.
 *
 * <p>Every operation holds one of {@code poolSize} permits for as long as it uses its
 * connection, so callers queue here when the pool is busy instead of timing out in it.
 * Every write shares a gate that {@link #snapshot()} takes exclusively: a backup never
 * overlaps a write, reads are never held back.
 */
@Service
@Slf4j
public class IdentityStore {

    private static final int ID_QUERY_CHUNK = 500;
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private static final String INSERT_IGNORE =
            "INSERT OR IGNORE INTO identity_records ("
            + "user_id, username, first_name, last_name, phone, "
            + "premium, verified, bot, first_seen_at, collected_at, "
            + "source_chat_id, source_chat_title, credential_id"
            + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String CLEAR_BLANK_USERNAMES =
            "UPDATE identity_records SET username = NULL "
            + "WHERE username IS NOT NULL AND trim(username) IN ('', '@')";

    private static final String NORMALIZED_USERNAME =
            "CASE WHEN substr(trim(username), 1, 1) = '@' THEN trim(username) ELSE '@' || trim(username) END";

    private static final String PREFIX_USERNAMES =
            "UPDATE identity_records SET username = " + NORMALIZED_USERNAME
            + " WHERE username IS NOT NULL AND username <> " + NORMALIZED_USERNAME;

    private final IdentityRecordRepository repository;
    private final CollectedDayRepository collectedDays;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Semaphore connections;
    private final ReentrantReadWriteLock writeGate = new ReentrantReadWriteLock(true);
    private final Path backupDir;
    private final Clock clock;

    public IdentityStore(IdentityRecordRepository repository,
                         CollectedDayRepository collectedDays,
                         JdbcTemplate jdbcTemplate,
                         PlatformTransactionManager transactionManager,
                         CollectorProperties props,
                         Clock clock,
                         @Value("${spring.datasource.hikari.maximum-pool-size:5}") int poolSize) {
        this.repository = repository;
        this.collectedDays = collectedDays;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.connections = new Semaphore(poolSize, true);
        this.backupDir = Paths.get(props.getBackupDir());
        this.clock = clock;
    }

    public Set<Long> existingIds(Collection<Long> candidateIds) {
        List<Long> ids = new ArrayList<>(new LinkedHashSet<>(candidateIds));
        Set<Long> found = new HashSet<>();
        for (int from = 0; from < ids.size(); from += ID_QUERY_CHUNK) {
            List<Long> chunk = ids.subList(from, Math.min(ids.size(), from + ID_QUERY_CHUNK));
            found.addAll(withConnection(() -> repository.findExistingIds(chunk)));
        }
        return found;
    }

    /**
     * Inserts the batch in one transaction. Rows whose user id already exists are skipped
     * silently and reported through {@link BatchOutcome#ignoredCount()}.
     */
    public BatchOutcome insertBatch(List<IdentityRecord> batch) {
        if (batch.isEmpty()) return new BatchOutcome(List.of(), 0);
        return asWriter(() -> transactionTemplate.execute(status -> {
            int[] counts = jdbcTemplate.batchUpdate(INSERT_IGNORE, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    bind(ps, batch.get(i));
                }

                @Override
                public int getBatchSize() {
                    return batch.size();
                }
            });
            List<IdentityRecord> inserted = new ArrayList<>(batch.size());
            for (int i = 0; i < counts.length; i++) {
                if (counts[i] > 0 || counts[i] == Statement.SUCCESS_NO_INFO) inserted.add(batch.get(i));
            }
            return new BatchOutcome(inserted, batch.size() - inserted.size());
        }));
    }

    /** Records {@code day} as fully collected, replacing an earlier mark for the same day. */
    public CollectedDay markCollected(LocalDate day, int insertedCount) {
        return asWriter(() -> transactionTemplate.execute(status -> {
            CollectedDay d = collectedDays.findByDay(day).orElseGet(() -> CollectedDay.builder().day(day).build());
            d.setCompletedAt(Instant.now(clock));
            d.setInsertedCount(insertedCount);
            return collectedDays.save(d);
        }));
    }

    /**
     * Rewrites stored usernames to the {@code @name} form: blank or bare {@code @} values become
     * null, the rest are trimmed and get the marker prepended where it is missing. Same rules
     * as {@link dev.univer.collector.util.NormalizeUtil#normalizeUsername(String)}.
     *
     * @return number of rows changed
     */
    public int normalizeUsernames() {
        Integer changed = asWriter(() -> transactionTemplate.execute(status ->
                jdbcTemplate.update(CLEAR_BLANK_USERNAMES) + jdbcTemplate.update(PREFIX_USERNAMES)));
        return changed == null ? 0 : changed;
    }

    /** Copies the whole database into a new timestamped file under the backup directory. */
    public BackupSnapshot snapshot() {
        writeGate.writeLock().lock();
        try {
            return withConnection(() -> {
                Instant takenAt = Instant.now(clock);
                Path target = backupDir
                        .resolve("identities_backup_" + BACKUP_STAMP.format(takenAt.atOffset(ZoneOffset.UTC)) + ".db")
                        .toAbsolutePath();
                try {
                    Files.createDirectories(backupDir);
                    Files.deleteIfExists(target);
                } catch (IOException e) {
                    throw new DataAccessResourceFailureException("Cannot prepare backup file " + target, e);
                }
                jdbcTemplate.execute("VACUUM INTO '" + target.toString().replace("'", "''") + "'");
                long size;
                try {
                    size = Files.size(target);
                } catch (IOException e) {
                    throw new DataAccessResourceFailureException("Backup file missing after VACUUM INTO: " + target, e);
                }
                log.info("Database backup created: {} ({} bytes)", target, size);
                return new BackupSnapshot(target, takenAt, size);
            });
        } finally {
            writeGate.writeLock().unlock();
        }
    }

    public StoreStatistics statistics() {
        return withConnection(() -> new StoreStatistics(
                repository.count(),
                repository.countByUsernameIsNotNull(),
                repository.countByPremiumTrue(),
                repository.countByVerifiedTrue(),
                repository.countByBotTrue(),
                repository.findFirstCollectedAt(),
                repository.findLastCollectedAt()));
    }

    public Optional<IdentityRecord> findById(long userId) {
        return withConnection(() -> repository.findById(userId));
    }

    public List<IdentityRecord> findByUsername(String username) {
        return withConnection(() -> repository.findAllByUsername(username));
    }

    public List<IdentityRecord> collectedBetween(Instant from, Instant to) {
        return withConnection(() -> repository.findAllByCollectedAtBetweenOrderByCollectedAtAsc(from, to));
    }

    public List<IdentityRecord> fromChat(long chatId) {
        return withConnection(() -> repository.findAllBySourceChatIdOrderByCollectedAtAsc(chatId));
    }

    public Optional<LocalDate> firstCollectedDay() {
        return withConnection(() -> collectedDays.findTopByOrderByDayAsc().map(CollectedDay::getDay));
    }

    public Optional<LocalDate> lastCollectedDay() {
        return withConnection(() -> collectedDays.findTopByOrderByDayDesc().map(CollectedDay::getDay));
    }

    public List<LocalDate> collectedDaysBetween(LocalDate from, LocalDate to) {
        return withConnection(() -> collectedDays.findAllByDayBetweenOrderByDayAsc(from, to).stream()
                .map(CollectedDay::getDay)
                .toList());
    }

    // shared side of the gate: any number of writers, never during a snapshot
    private <T> T asWriter(Supplier<T> work) {
        writeGate.readLock().lock();
        try {
            return withConnection(work);
        } finally {
            writeGate.readLock().unlock();
        }
    }

    private <T> T withConnection(Supplier<T> work) {
        connections.acquireUninterruptibly();
        try {
            return work.get();
        } finally {
            connections.release();
        }
    }

    private static void bind(PreparedStatement ps, IdentityRecord r) throws SQLException {
        ps.setLong(1, r.getUserId());
        ps.setString(2, r.getUsername());
        ps.setString(3, r.getFirstName());
        ps.setString(4, r.getLastName());
        ps.setString(5, r.getPhone());
        ps.setBoolean(6, r.isPremium());
        ps.setBoolean(7, r.isVerified());
        ps.setBoolean(8, r.isBot());
        ps.setObject(9, r.getFirstSeenAt() == null ? null : r.getFirstSeenAt().toEpochMilli(), Types.BIGINT);
        ps.setLong(10, r.getCollectedAt().toEpochMilli());
        ps.setObject(11, r.getSourceChatId(), Types.BIGINT);
        ps.setString(12, r.getSourceChatTitle());
        ps.setString(13, r.getCredentialId());
    }

    /** @param ignoredCount rows skipped because their user id was already stored */
    public record BatchOutcome(List<IdentityRecord> inserted, int ignoredCount) {}
}
