package dev.univer.collector.model;

/** @param batchIndex zero-based position of the failed batch within one persist call */
public record BatchError(int batchIndex, int affectedCount, String message) {
}
