package dev.univer.collector.service;

import dev.univer.collector.model.CollectedDay;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class MissedDaysService {
    private final IdentityStore store;

    public CollectedDay markCollected(LocalDate day, int insertedCount) {
        return store.markCollected(day, insertedCount);
    }

    public Optional<LocalDate> lastCollectedDay() {
        return store.lastCollectedDay();
    }

    /**
     * Days from the first collected day up to yesterday that were never collected.
     * Empty when nothing was ever collected.
     */
    public List<LocalDate> missedDays(LocalDate today) {
        Optional<LocalDate> first = store.firstCollectedDay();
        if (first.isEmpty()) return List.of();

        LocalDate from = first.get();
        LocalDate to = today.minusDays(1);
        if (from.isAfter(to)) return List.of();

        Set<LocalDate> done = new HashSet<>(store.collectedDaysBetween(from, to));
        List<LocalDate> missed = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (!done.contains(d)) missed.add(d);
        }
        return missed;
    }
}
