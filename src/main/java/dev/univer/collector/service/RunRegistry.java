package dev.univer.collector.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** Runs that have not reached a terminal state, by run id. */
@Component
@RequiredArgsConstructor
public class RunRegistry {

    private final Map<UUID, RunHandle> active = new ConcurrentHashMap<>();
    private final Clock clock;

    /** @param requesterId front end user starting the run, {@code null} when not tied to one */
    public synchronized RunHandle register(Long requesterId, LocalDate targetDate) {
        if (requesterId != null && active.values().stream().anyMatch(h -> requesterId.equals(h.getRequesterId()))) {
            throw new RunAlreadyActiveException(requesterId);
        }
        RunHandle handle = new RunHandle(UUID.randomUUID(), requesterId, targetDate, Instant.now(clock));
        active.put(handle.getRunId(), handle);
        return handle;
    }

    public Optional<RunHandle> find(UUID runId) {
        return Optional.ofNullable(active.get(runId));
    }

    public Collection<RunHandle> activeRuns() {
        return List.copyOf(active.values());
    }

    synchronized void remove(UUID runId) {
        active.remove(runId);
    }
}
