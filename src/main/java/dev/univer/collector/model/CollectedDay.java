package dev.univer.collector.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/** A target date for which a run finished on every credential. */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "collected_days", uniqueConstraints = @UniqueConstraint(columnNames = {"day"}))
public class CollectedDay {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Convert(converter = IsoDateConverter.class)
    @Column(nullable = false, length = 10)
    private LocalDate day;

    @Convert(converter = EpochMillisConverter.class)
    private Instant completedAt;

    private Integer insertedCount;
}
