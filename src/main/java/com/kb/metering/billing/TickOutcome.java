package com.kb.metering.billing;

import com.kb.metering.model.entity.MeteredSession;
import lombok.Value;

/**
 * Tick 결과
 */
@Value
public class TickOutcome {

    public enum Status {
        /** 새 분이 과금됨 */
        BILLED,
        /** 과금할 분 경계가 아직 없음 (중복 하트비트 포함) */
        NO_CHANGE,
        /** 예치 분을 모두 소진하여 연장이 필요함 */
        NEEDS_MORE_FUNDS,
        /** 아직 시작되지 않은 세션 */
        NOT_STARTED
    }

    Status status;

    int minutesBilled;

    long amountBilled;

    int billedMinutes;

    long billedAmount;

    int remainingMinutes;

    public static TickOutcome of(Status status, MeteredSession session, int minutesBilled, long amountBilled) {
        return new TickOutcome(status, minutesBilled, amountBilled,
                session.getBilledMinutes(), session.getBilledAmount(), session.getRemainingMinutes());
    }

    public boolean isBilled() {
        return status == Status.BILLED;
    }

    /**
     * 연장이 필요한 상태인지 (소진 후 재호출 또는 이번 과금으로 남은 분이 0)
     */
    public boolean isNeedsMoreFunds() {
        return status == Status.NEEDS_MORE_FUNDS || (status == Status.BILLED && remainingMinutes == 0);
    }
}
