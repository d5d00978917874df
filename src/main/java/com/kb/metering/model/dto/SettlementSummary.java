package com.kb.metering.model.dto;

import com.kb.metering.billing.EndOutcome;
import com.kb.metering.model.entity.EndReason;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.SessionStatus;
import com.kb.metering.model.entity.SettlementRecord;
import lombok.Builder;
import lombok.Data;

/**
 * 세션 종료 정산 요약 DTO
 */
@Data
@Builder
public class SettlementSummary {

    private String sessionId;

    private SessionStatus status;

    private EndReason endReason;

    private String endedBy;

    private int billedMinutes;

    private long billedAmount;

    private long refundedAmount;

    private long readerShare;

    private long platformShare;

    /**
     * 이미 종료된 세션에 대한 중복 종료 요청이었는지
     */
    private boolean alreadyEnded;

    public static SettlementSummary from(EndOutcome outcome) {
        MeteredSession session = outcome.getSession();
        SettlementRecord settlement = outcome.getSettlement();
        return SettlementSummary.builder()
                .sessionId(session.getId())
                .status(session.getStatus())
                .endReason(session.getEndReason())
                .endedBy(session.getEndedBy())
                .billedMinutes(session.getBilledMinutes())
                .billedAmount(session.getBilledAmount())
                .refundedAmount(outcome.getRefundedAmount())
                .readerShare(settlement != null ? settlement.getReaderShare() : 0L)
                .platformShare(settlement != null ? settlement.getPlatformShare() : 0L)
                .alreadyEnded(outcome.isAlreadyEnded())
                .build();
    }
}
