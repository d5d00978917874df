package com.kb.metering.model.event;

import com.kb.metering.model.message.outbound.ServerMessage;
import com.kb.metering.model.message.outbound.SessionEndMessage;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 세션 종료/정산 이벤트
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class SessionEndedEvent extends SessionEvent {

    private String status;

    private String reason;

    private String endedBy;

    private int billedMinutes;

    private long billedAmount;

    private long refundedAmount;

    private long readerShare;

    private long platformShare;

    @Override
    public String getEventType() {
        return "SESSION_ENDED";
    }

    @Override
    public String getActorId() {
        return endedBy;
    }

    @Override
    public Map<String, Object> getEventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status);
        data.put("reason", reason);
        data.put("billedMinutes", billedMinutes);
        data.put("billedAmount", billedAmount);
        data.put("refundedAmount", refundedAmount);
        data.put("readerShare", readerShare);
        data.put("platformShare", platformShare);
        return data;
    }

    @Override
    public ServerMessage toRoomMessage() {
        return SessionEndMessage.builder()
                .sessionId(getSessionId())
                .reason(reason)
                .endedBy(endedBy)
                .billedMinutes(billedMinutes)
                .billedAmount(billedAmount)
                .build();
    }

    @Override
    public EventPriority getPriority() {
        return EventPriority.CRITICAL;
    }
}
