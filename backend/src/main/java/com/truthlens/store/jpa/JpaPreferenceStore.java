package com.truthlens.store.jpa;

import com.truthlens.entity.ContentPreferences;
import com.truthlens.repository.ContentPreferencesRepository;
import com.truthlens.store.PreferenceStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaPreferenceStore implements PreferenceStore {

    private final ContentPreferencesRepository repository;

    @Override
    public Optional<ContentPreferences> find(UUID userId) {
        return repository.findById(userId);
    }

    @Override
    public ContentPreferences save(ContentPreferences preferences) {
        return repository.save(preferences);
    }

    @Override
    public boolean delete(UUID userId) {
        if (!repository.existsById(userId)) {
            return false;
        }
        repository.deleteById(userId);
        return true;
    }
}
