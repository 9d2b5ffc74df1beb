package com.truthlens.repository;

import com.truthlens.entity.ContentPreferences;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ContentPreferencesRepository extends JpaRepository<ContentPreferences, UUID> {
}
