package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 세션 종료 알림
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class SessionEndMessage extends ServerMessage {

    public static final String TYPE = "session_end";

    private String sessionId;

    private String reason;

    private String endedBy;

    private int billedMinutes;

    private long billedAmount;

    @Override
    public String getType() {
        return TYPE;
    }
}
