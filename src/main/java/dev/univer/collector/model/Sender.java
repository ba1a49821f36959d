package dev.univer.collector.model;

public record Sender(long userId,
                     String username,
                     String firstName,
                     String lastName,
                     String phone,
                     boolean premium,
                     boolean verified,
                     boolean bot) {
}
