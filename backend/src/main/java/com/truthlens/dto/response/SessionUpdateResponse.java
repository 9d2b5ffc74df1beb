package com.truthlens.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.truthlens.entity.SessionState;
import com.truthlens.service.SessionUpdateResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionUpdateResponse {

    private boolean success;

    private boolean recorded;

    private SessionUpdateResult.Outcome outcome;

    private UUID recordId;

    private SessionState state;

    private Integer sessionNumber;

    private Long accumulatedSeconds;

    public static SessionUpdateResponse from(SessionUpdateResult result) {
        SessionUpdateResponseBuilder builder = SessionUpdateResponse.builder()
                .success(true)
                .recorded(result.isRecorded())
                .outcome(result.getOutcome());
        if (result.isRecorded()) {
            builder.recordId(result.getRecordId())
                    .state(result.getState())
                    .sessionNumber(result.getSessionNumber())
                    .accumulatedSeconds(result.getAccumulatedSeconds());
        }
        return builder.build();
    }
}
