package com.kb.metering.service;

import com.kb.metering.billing.TickOutcome;
import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.MeteredSession;
import lombok.Value;

/**
 * 하트비트/재조정 처리 결과
 */
@Value
public class SessionTick {

    MeteredSession session;

    TickOutcome outcome;

    /**
     * 과금이 일어났을 때만 존재
     */
    ClientBalance clientBalance;

    /**
     * 이번 호출로 initialized -> active 전이가 일어났는지
     */
    boolean activated;

    public static SessionTick unchanged(MeteredSession session) {
        return new SessionTick(session, TickOutcome.of(TickOutcome.Status.NO_CHANGE, session, 0, 0L), null, false);
    }
}
