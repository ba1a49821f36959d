package dev.univer.collector.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class StoreMaintenanceService {

    private final IdentityStore store;

    // Rows written before usernames were normalized on the way in
    @EventListener(ApplicationReadyEvent.class)
    public void normalizeStoredUsernames() {
        try {
            int changed = store.normalizeUsernames();
            if (changed > 0) log.info("Normalized {} stored usernames", changed);
        } catch (DataAccessException e) {
            log.error("Cannot normalize stored usernames", e);
        }
    }
}
