package dev.univer.collector.model;

import java.nio.file.Path;
import java.time.Instant;

public record BackupSnapshot(Path file, Instant takenAt, long sizeBytes) {
}
