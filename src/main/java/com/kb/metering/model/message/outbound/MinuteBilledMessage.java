package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 분 단위 과금 알림
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class MinuteBilledMessage extends ServerMessage {

    public static final String TYPE = "minute_billed";

    private String sessionId;

    private int minutesBilled;

    private int billedMinutes;

    private long billedAmount;

    private int remainingMinutes;

    private boolean lowBalance;

    @Override
    public String getType() {
        return TYPE;
    }
}
