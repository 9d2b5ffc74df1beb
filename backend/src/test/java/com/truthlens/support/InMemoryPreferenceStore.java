package com.truthlens.support;

import com.truthlens.entity.ContentPreferences;
import com.truthlens.store.PreferenceStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemoryPreferenceStore implements PreferenceStore {

    private final Map<UUID, ContentPreferences> rows = new HashMap<>();
    private int saveCount;

    @Override
    public synchronized Optional<ContentPreferences> find(UUID userId) {
        return Optional.ofNullable(rows.get(userId));
    }

    @Override
    public synchronized ContentPreferences save(ContentPreferences preferences) {
        rows.put(preferences.getUserId(), preferences);
        saveCount++;
        return preferences;
    }

    @Override
    public synchronized boolean delete(UUID userId) {
        return rows.remove(userId) != null;
    }

    public synchronized int getSaveCount() {
        return saveCount;
    }
}
