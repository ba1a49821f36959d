package dev.univer.collector.service;

import dev.univer.collector.model.CredentialSummary;
import dev.univer.collector.model.IdentityRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/** Published once per credential when its part of a run is over, for the export side. */
public record CredentialRunCompletedEvent(UUID runId,
                                          LocalDate targetDate,
                                          CredentialSummary summary,
                                          List<IdentityRecord> insertedRecords) {
}
