package com.kb.metering.model.dto;

import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.SessionStatus;
import lombok.Builder;
import lombok.Data;

/**
 * 세션 시작 응답 DTO
 */
@Data
@Builder
public class SessionStartResponse {

    private String sessionId;

    private String roomId;

    /**
     * 분당 요금
     */
    private long rate;

    private long authorizedAmount;

    private int authorizedMinutes;

    private SessionStatus status;

    public static SessionStartResponse from(MeteredSession session) {
        return SessionStartResponse.builder()
                .sessionId(session.getId())
                .roomId(session.getRoomId())
                .rate(session.getRatePerMinute())
                .authorizedAmount(session.getAuthorizedAmount())
                .authorizedMinutes(session.getAuthorizedMinutes())
                .status(session.getStatus())
                .build();
    }
}
