package com.kb.metering.billing;

import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.SettlementRecord;
import lombok.Value;

/**
 * End 결과
 * alreadyEnded 이면 아무것도 변경되지 않았음
 */
@Value
public class EndOutcome {

    MeteredSession session;

    long refundedAmount;

    /**
     * 과금액이 있을 때만 존재
     */
    SettlementRecord settlement;

    boolean alreadyEnded;

    /**
     * 환불 반영 후 고객 잔액 (alreadyEnded 이면 null)
     */
    ClientBalance clientBalance;

    public static EndOutcome alreadyEnded(MeteredSession session, SettlementRecord existingSettlement) {
        return new EndOutcome(session, 0L, existingSettlement, true, null);
    }
}
