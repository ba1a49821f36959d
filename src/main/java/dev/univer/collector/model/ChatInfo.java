package dev.univer.collector.model;

/**
 * A group chat as seen by one credential.
 *
 * @param lastMessageId highest message id known for the chat, {@code 0} when it has no messages
 */
public record ChatInfo(long id, String title, int participantCount, long lastMessageId) {
}
