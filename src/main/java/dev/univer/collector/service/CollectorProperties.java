package dev.univer.collector.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "collector")
@Getter @Setter
public class CollectorProperties {
    // calendar dates of messages are evaluated in this zone
    private String zoneId = "UTC";

    // chats traversed at once per credential
    private int concurrency = 3;
    // chats with this many participants or fewer are skipped
    private int minParticipants = 10;
    private int pageSize = 100;

    private int batchSize = 1000;

    // total attempts for a call failing with a transient network error
    private int transientRetries = 3;
    private Duration transientRetryDelay = Duration.ofSeconds(1);

    private int maxNarrowingSteps = 4;

    // lines accepted by one manual entry call
    private int manualEntryLimit = 50;

    private String backupDir = "data/backups";
    private Duration journalRetention = Duration.ofDays(7);

    private List<CredentialProperties> credentials = new ArrayList<>();

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    @Getter @Setter
    public static class CredentialProperties {
        private String id;
        private String username;
        private String token;
    }
}
