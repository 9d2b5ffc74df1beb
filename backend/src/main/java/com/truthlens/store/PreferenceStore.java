package com.truthlens.store;

import com.truthlens.entity.ContentPreferences;

import java.util.Optional;
import java.util.UUID;

public interface PreferenceStore {

    Optional<ContentPreferences> find(UUID userId);

    ContentPreferences save(ContentPreferences preferences);

    /**
     * @return true when a row was removed
     */
    boolean delete(UUID userId);
}
