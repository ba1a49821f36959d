package dev.univer.collector.repo;

import dev.univer.collector.model.CollectedDay;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface CollectedDayRepository extends JpaRepository<CollectedDay, Long> {
    Optional<CollectedDay> findByDay(LocalDate day);
    Optional<CollectedDay> findTopByOrderByDayAsc();
    Optional<CollectedDay> findTopByOrderByDayDesc();
    List<CollectedDay> findAllByDayBetweenOrderByDayAsc(LocalDate from, LocalDate to);
}
