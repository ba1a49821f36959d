package dev.univer.collector.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "identity_records", indexes = {
        @Index(name = "idx_identity_username", columnList = "username"),
        @Index(name = "idx_identity_collected_at", columnList = "collectedAt"),
        @Index(name = "idx_identity_source_chat", columnList = "sourceChatId")
})
public class IdentityRecord {
    @Id
    private Long userId;

    private String username; // always "@name" when present

    private String firstName;
    private String lastName;
    private String phone;

    private boolean premium;
    private boolean verified;
    private boolean bot;

    // post time of the first message seen from this user in the window
    @Convert(converter = EpochMillisConverter.class)
    private Instant firstSeenAt;

    @Convert(converter = EpochMillisConverter.class)
    @Column(nullable = false)
    private Instant collectedAt;

    private Long sourceChatId;
    private String sourceChatTitle;

    private String credentialId;
}
