package com.di.sqlpulse.collection;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(name = "sqlpulse.storage.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryCollectionSettingsStore implements CollectionSettingsStore {

    private final Map<String, CollectionSettings> settingsByConnection = new ConcurrentHashMap<>();

    @Override
    public Optional<CollectionSettings> find(String connectionId) {
        return Optional.ofNullable(settingsByConnection.get(connectionId));
    }

    @Override
    public List<CollectionSettings> findAll() {
        return settingsByConnection.values().stream()
                .sorted(Comparator.comparing(CollectionSettings::getConnectionId))
                .collect(Collectors.toList());
    }

    @Override
    public void save(CollectionSettings settings) {
        settingsByConnection.put(settings.getConnectionId(), settings);
    }

    @Override
    public boolean delete(String connectionId) {
        return settingsByConnection.remove(connectionId) != null;
    }
}
