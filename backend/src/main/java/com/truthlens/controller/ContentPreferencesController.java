package com.truthlens.controller;

import com.truthlens.dto.request.PreferencesRequest;
import com.truthlens.dto.response.PreferencesResponse;
import com.truthlens.security.AuthenticatedUser;
import com.truthlens.service.ContentPreferencesService;
import com.truthlens.service.ThresholdConfig;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/api/content-preferences")
@RequiredArgsConstructor
@Slf4j
public class ContentPreferencesController {

    private final ContentPreferencesService preferencesService;

    /**
     * Stored preferences or the defaults. Never creates a row.
     */
    @GetMapping
    public ResponseEntity<PreferencesResponse> getPreferences(Authentication authentication) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        Optional<ThresholdConfig> stored = preferencesService.storedConfig(userId);
        return ResponseEntity.ok(PreferencesResponse.from(
                stored.orElseGet(ThresholdConfig::defaults), stored.isEmpty()));
    }

    @PutMapping
    public ResponseEntity<PreferencesResponse> updatePreferences(
            @Valid @RequestBody PreferencesRequest request,
            Authentication authentication) {

        UUID userId = AuthenticatedUser.idOf(authentication);
        log.info("Preferences update requested: userId={}", userId);
        return ResponseEntity.ok(PreferencesResponse.from(preferencesService.upsert(userId, request.toUpdate()), false));
    }

    @DeleteMapping
    public ResponseEntity<PreferencesResponse> resetPreferences(Authentication authentication) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        log.info("Preferences reset requested: userId={}", userId);
        return ResponseEntity.ok(PreferencesResponse.from(preferencesService.reset(userId), true));
    }
}
