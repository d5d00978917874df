package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 예치 시간 소진 경고. graceSeconds 안에 연장하지 않으면 세션 종료
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class NeedsMoreFundsMessage extends ServerMessage {

    public static final String TYPE = "needs_more_funds";

    private String sessionId;

    private int remainingMinutes;

    private long graceSeconds;

    @Override
    public String getType() {
        return TYPE;
    }
}
