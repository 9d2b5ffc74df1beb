package com.truthlens.controller;

import com.truthlens.dto.request.LimitCheckRequest;
import com.truthlens.dto.request.SessionUpdateRequest;
import com.truthlens.dto.response.CheckResponse;
import com.truthlens.dto.response.PreferencesResponse;
import com.truthlens.dto.response.SessionResponse;
import com.truthlens.dto.response.SessionUpdateResponse;
import com.truthlens.dto.response.TodayStatsResponse;
import com.truthlens.entity.ContentType;
import com.truthlens.exception.MonitoringException;
import com.truthlens.security.AuthenticatedUser;
import com.truthlens.service.ConsumptionStatsService;
import com.truthlens.service.ContentPreferencesService;
import com.truthlens.service.SessionCoordinator;
import com.truthlens.service.SessionUpdateResult;
import com.truthlens.service.ThresholdEvaluator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Map;
import java.util.UUID;

/**
 * Session API used by the tracker, plus explicit threshold checks and the
 * read endpoints of the monitoring dashboard.
 *
 * Endpoints:
 * - POST /session/start, /session/update, /session/end
 * - POST /checks/limits, /checks/break, /checks/quality, /checks/wellness
 * - GET  /today-stats, /preferences
 */
@RestController
@RequestMapping("/api/content-monitoring")
@RequiredArgsConstructor
@Slf4j
public class ContentMonitoringController {

    private final SessionCoordinator sessionCoordinator;
    private final ThresholdEvaluator thresholdEvaluator;
    private final ConsumptionStatsService statsService;
    private final ContentPreferencesService preferencesService;

    @PostMapping("/session/start")
    public ResponseEntity<SessionResponse> startSession(Authentication authentication) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        log.info("Session start requested: userId={}", userId);
        return ResponseEntity.ok(SessionResponse.from(sessionCoordinator.start(userId)));
    }

    @PostMapping("/session/update")
    public ResponseEntity<SessionUpdateResponse> updateSession(
            @Valid @RequestBody SessionUpdateRequest request,
            Authentication authentication) {

        UUID userId = AuthenticatedUser.idOf(authentication);
        log.debug("Session update received: userId={}, contentType={}, timeSpent={}",
                userId, request.getContentType(), request.getTimeSpent());

        try {
            SessionUpdateResult result = sessionCoordinator.update(userId, request.toCommand());
            return ResponseEntity.ok(SessionUpdateResponse.from(result));
        } catch (MonitoringException e) {
            log.warn("Session update rejected: userId={}, message={}", userId, e.getMessage());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    @PostMapping("/session/end")
    public ResponseEntity<SessionResponse> endSession(Authentication authentication) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        log.info("Session end requested: userId={}", userId);
        return ResponseEntity.ok(SessionResponse.from(sessionCoordinator.end(userId)));
    }

    @PostMapping("/checks/limits")
    public ResponseEntity<CheckResponse> checkLimits(
            @RequestBody(required = false) LimitCheckRequest request,
            Authentication authentication) {

        UUID userId = AuthenticatedUser.idOf(authentication);
        ContentType contentType = request != null ? request.getContentType() : null;
        return ResponseEntity.ok(CheckResponse.of("limits", thresholdEvaluator.checkLimits(userId, contentType)));
    }

    @PostMapping("/checks/break")
    public ResponseEntity<CheckResponse> checkBreak(Authentication authentication) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        return ResponseEntity.ok(CheckResponse.of("break", thresholdEvaluator.checkBreak(userId)));
    }

    @PostMapping("/checks/quality")
    public ResponseEntity<CheckResponse> checkQuality(Authentication authentication) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        return ResponseEntity.ok(CheckResponse.of("quality", thresholdEvaluator.checkQuality(userId)));
    }

    @PostMapping("/checks/wellness")
    public ResponseEntity<CheckResponse> checkWellness(Authentication authentication) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        return ResponseEntity.ok(CheckResponse.of("wellness", thresholdEvaluator.checkWellness(userId)));
    }

    @GetMapping("/today-stats")
    public ResponseEntity<TodayStatsResponse> getTodayStats(Authentication authentication) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        return ResponseEntity.ok(TodayStatsResponse.from(statsService.aggregateToday(userId)));
    }

    /**
     * Stored preferences under {@code preferences}, null when the user never saved any.
     */
    @GetMapping("/preferences")
    public ResponseEntity<Map<String, PreferencesResponse>> getPreferences(Authentication authentication) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        PreferencesResponse stored = preferencesService.storedConfig(userId)
                .map(config -> PreferencesResponse.from(config, false))
                .orElse(null);
        return ResponseEntity.ok(Collections.singletonMap("preferences", stored));
    }
}
