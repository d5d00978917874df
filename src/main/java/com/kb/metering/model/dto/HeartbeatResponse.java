package com.kb.metering.model.dto;

import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.SessionStatus;
import lombok.Builder;
import lombok.Data;

/**
 * 하트비트(과금) 응답 DTO
 */
@Data
@Builder
public class HeartbeatResponse {

    private String sessionId;

    private SessionStatus status;

    private int billedMinutes;

    private long billedAmount;

    private int remainingMinutes;

    /**
     * 이번 호출에서 새로 과금된 분
     */
    private int minutesBilled;

    private boolean needsMoreFunds;

    public static HeartbeatResponse of(MeteredSession session, int minutesBilled, boolean needsMoreFunds) {
        return HeartbeatResponse.builder()
                .sessionId(session.getId())
                .status(session.getStatus())
                .billedMinutes(session.getBilledMinutes())
                .billedAmount(session.getBilledAmount())
                .remainingMinutes(session.getRemainingMinutes())
                .minutesBilled(minutesBilled)
                .needsMoreFunds(needsMoreFunds)
                .build();
    }
}
