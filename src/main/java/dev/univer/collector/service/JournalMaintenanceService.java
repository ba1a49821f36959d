package dev.univer.collector.service;

import dev.univer.collector.bot.MessageJournal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class JournalMaintenanceService {

    private final CredentialRegistry credentialRegistry;
    private final CollectorProperties props;
    private final Clock clock;

    // Hourly: drop journaled messages older than the retention period
    @Scheduled(cron = "0 15 * * * *")
    public void prune() {
        Instant cutoff = Instant.now(clock).minus(props.getJournalRetention());
        for (MessageJournal journal : credentialRegistry.journals()) {
            int removed = journal.prune(cutoff);
            if (removed > 0) {
                log.info("[{}] Pruned {} journaled messages older than {}", journal.getCredentialId(), removed, cutoff);
            }
        }
    }
}
