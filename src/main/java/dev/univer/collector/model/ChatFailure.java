package dev.univer.collector.model;

public record ChatFailure(long chatId, String title, String reason) {
}
