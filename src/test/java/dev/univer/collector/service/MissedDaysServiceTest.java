package dev.univer.collector.service;

import dev.univer.collector.SqliteTestSupport;
import dev.univer.collector.model.CollectedDay;
import dev.univer.collector.repo.CollectedDayRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class MissedDaysServiceTest extends SqliteTestSupport {

    @Autowired
    private MissedDaysService service;
    @Autowired
    private CollectedDayRepository repo;

    @BeforeEach
    void clean() {
        repo.deleteAllInBatch();
    }

    @Test
    void nothingCollectedMeansNothingMissed() {
        assertThat(service.missedDays(LocalDate.of(2024, 3, 8))).isEmpty();
        assertThat(service.lastCollectedDay()).isEmpty();
    }

    @Test
    void gapsUpToYesterdayAreReported() {
        service.markCollected(LocalDate.of(2024, 3, 1), 10);
        service.markCollected(LocalDate.of(2024, 3, 2), 4);
        service.markCollected(LocalDate.of(2024, 3, 5), 0);

        assertThat(service.missedDays(LocalDate.of(2024, 3, 8))).containsExactly(
                LocalDate.of(2024, 3, 3),
                LocalDate.of(2024, 3, 4),
                LocalDate.of(2024, 3, 6),
                LocalDate.of(2024, 3, 7));
        assertThat(service.lastCollectedDay()).contains(LocalDate.of(2024, 3, 5));
    }

    @Test
    void markingTheSameDayAgainUpdatesIt() {
        LocalDate day = LocalDate.of(2024, 3, 1);
        service.markCollected(day, 10);
        service.markCollected(day, 3);

        assertThat(repo.count()).isEqualTo(1);
        CollectedDay stored = repo.findByDay(day).orElseThrow();
        assertThat(stored.getInsertedCount()).isEqualTo(3);
        assertThat(stored.getCompletedAt()).isNotNull();
        assertThat(service.missedDays(day.plusDays(1))).isEmpty();
    }
}
