package com.truthlens.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.truthlens.entity.ContentSession;
import com.truthlens.entity.SessionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionResponse {

    private SessionState state;

    private int sessionNumber;

    private Instant startedAt;

    private Instant lastHeartbeatAt;

    private Instant endedAt;

    private long accumulatedSeconds;

    private int contentCount;

    public static SessionResponse from(ContentSession session) {
        return SessionResponse.builder()
                .state(session.getState())
                .sessionNumber(session.getSessionNumber())
                .startedAt(session.getStartedAt())
                .lastHeartbeatAt(session.getLastHeartbeatAt())
                .endedAt(session.getEndedAt())
                .accumulatedSeconds(session.getAccumulatedSeconds())
                .contentCount(session.getContentCount())
                .build();
    }
}
