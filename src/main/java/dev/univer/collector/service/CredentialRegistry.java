package dev.univer.collector.service;

import dev.univer.collector.bot.CollectorBot;
import dev.univer.collector.bot.MessageJournal;
import dev.univer.collector.model.Credential;
import lombok.Getter;

import java.util.*;

/** Credentials available to runs, in configuration order. */
public class CredentialRegistry {

    private final Map<String, Credential> credentials = new LinkedHashMap<>();
    @Getter
    private final List<CollectorBot> bots;

    public CredentialRegistry(List<Credential> credentials, List<CollectorBot> bots) {
        for (Credential c : credentials) {
            if (this.credentials.putIfAbsent(c.id(), c) != null) {
                throw new IllegalArgumentException("Duplicate credential id: " + c.id());
            }
        }
        this.bots = List.copyOf(bots);
    }

    public List<Credential> all() {
        return List.copyOf(credentials.values());
    }

    /** Credentials with the given ids, or all of them for an empty selection. */
    public List<Credential> select(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) return all();
        List<Credential> selected = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) {
            Credential c = credentials.get(id);
            if (c == null) throw new IllegalArgumentException("Unknown credential: " + id);
            selected.add(c);
        }
        return selected;
    }

    public List<MessageJournal> journals() {
        return credentials.values().stream()
                .map(Credential::journal)
                .filter(Objects::nonNull)
                .toList();
    }
}
