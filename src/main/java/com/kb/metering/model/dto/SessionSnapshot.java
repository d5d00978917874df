package com.kb.metering.model.dto;

import com.kb.metering.model.entity.EndReason;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.SessionKind;
import com.kb.metering.model.entity.SessionStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 세션 조회 응답 DTO
 */
@Data
@Builder
public class SessionSnapshot {

    private String sessionId;
    private String roomId;
    private String clientId;
    private String readerId;
    private SessionKind kind;
    private SessionStatus status;
    private long rate;
    private int authorizedMinutes;
    private long authorizedAmount;
    private int billedMinutes;
    private long billedAmount;
    private int remainingMinutes;
    private Instant startedAt;
    private Instant endedAt;
    private EndReason endReason;

    /**
     * 서버 현재 시각 - 클라이언트 경과 시간 표시 동기화용
     */
    private Instant serverTime;

    public static SessionSnapshot of(MeteredSession session, Instant serverTime) {
        return SessionSnapshot.builder()
                .sessionId(session.getId())
                .roomId(session.getRoomId())
                .clientId(session.getClientId())
                .readerId(session.getReaderId())
                .kind(session.getKind())
                .status(session.getStatus())
                .rate(session.getRatePerMinute())
                .authorizedMinutes(session.getAuthorizedMinutes())
                .authorizedAmount(session.getAuthorizedAmount())
                .billedMinutes(session.getBilledMinutes())
                .billedAmount(session.getBilledAmount())
                .remainingMinutes(session.getRemainingMinutes())
                .startedAt(session.getStartedAt())
                .endedAt(session.getEndedAt())
                .endReason(session.getEndReason())
                .serverTime(serverTime)
                .build();
    }
}
