package com.di.sqlpulse.collection;

import java.util.List;
import java.util.Optional;

public interface CollectionSettingsStore {

    Optional<CollectionSettings> find(String connectionId);

    List<CollectionSettings> findAll();

    /** Inserts or replaces the settings of {@link CollectionSettings#getConnectionId()}. */
    void save(CollectionSettings settings);

    boolean delete(String connectionId);
}
