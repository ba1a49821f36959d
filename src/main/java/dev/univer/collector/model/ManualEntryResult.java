package dev.univer.collector.model;

import java.util.List;

/**
 * Outcome of one manual entry call.
 *
 * @param skipped ids that were already stored or repeated in the input
 * @param errors  one message per line or batch that could not be stored
 */
public record ManualEntryResult(List<Long> added, List<Long> skipped, List<String> errors, long totalStored) {
}
