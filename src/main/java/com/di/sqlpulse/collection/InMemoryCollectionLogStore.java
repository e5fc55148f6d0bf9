package com.di.sqlpulse.collection;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of CollectionLogStore.
 */
@Component
@ConditionalOnProperty(name = "sqlpulse.storage.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryCollectionLogStore implements CollectionLogStore {

    private final Map<String, CollectionLog> logsById = new ConcurrentHashMap<>();

    @Override
    public void insert(CollectionLog log) {
        logsById.put(log.getId(), log);
    }

    @Override
    public void complete(CollectionLog log) {
        logsById.computeIfPresent(log.getId(), (id, existing) -> log);
    }

    @Override
    public Optional<CollectionLog> findById(String logId) {
        return Optional.ofNullable(logsById.get(logId));
    }

    @Override
    public List<CollectionLog> findRecent(String connectionId, int limit) {
        return logsById.values().stream()
                .filter(l -> l.getConnectionId().equals(connectionId))
                .sorted(Comparator.comparing(CollectionLog::getStartedAt).reversed())
                .limit(Math.max(1, limit))
                .collect(Collectors.toList());
    }

    @Override
    public boolean deleteById(String connectionId, String logId) {
        CollectionLog existing = logsById.get(logId);
        return existing != null && existing.getConnectionId().equals(connectionId)
                && logsById.remove(logId, existing);
    }

    @Override
    public int deleteByConnection(String connectionId) {
        int before = logsById.size();
        logsById.values().removeIf(l -> l.getConnectionId().equals(connectionId));
        return before - logsById.size();
    }

    @Override
    public int deleteStartedBefore(Instant cutoff) {
        int before = logsById.size();
        logsById.values().removeIf(l -> l.getStartedAt().isBefore(cutoff));
        return before - logsById.size();
    }
}
