package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 세션 룸 입장 완료 (입장한 연결에만 전송)
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class SessionJoinedMessage extends ServerMessage {

    public static final String TYPE = "session_joined";

    private String sessionId;

    private String roomId;

    private String status;

    private int billedMinutes;

    private long billedAmount;

    private int remainingMinutes;

    private int participantCount;

    private boolean resumed;

    @Override
    public String getType() {
        return TYPE;
    }
}
