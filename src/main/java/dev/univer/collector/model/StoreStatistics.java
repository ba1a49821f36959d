package dev.univer.collector.model;

import java.time.Instant;

/** @param firstCollectedAt {@code null} while the store is empty, same for {@code lastCollectedAt} */
public record StoreStatistics(long totalUsers,
                              long withUsername,
                              long premiumUsers,
                              long verifiedUsers,
                              long botAccounts,
                              Instant firstCollectedAt,
                              Instant lastCollectedAt) {
}
