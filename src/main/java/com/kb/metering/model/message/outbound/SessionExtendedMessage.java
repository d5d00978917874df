package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 세션 연장 알림
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class SessionExtendedMessage extends ServerMessage {

    public static final String TYPE = "session_extended";

    private String sessionId;

    private int authorizedMinutes;

    private long authorizedAmount;

    private int remainingMinutes;

    @Override
    public String getType() {
        return TYPE;
    }
}
