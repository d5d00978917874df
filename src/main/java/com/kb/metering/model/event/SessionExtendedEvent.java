package com.kb.metering.model.event;

import com.kb.metering.model.message.outbound.ServerMessage;
import com.kb.metering.model.message.outbound.SessionExtendedMessage;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 세션 연장 이벤트
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class SessionExtendedEvent extends SessionEvent {

    private String clientId;

    private int additionalMinutes;

    private int authorizedMinutes;

    private long authorizedAmount;

    private int remainingMinutes;

    @Override
    public String getEventType() {
        return "SESSION_EXTENDED";
    }

    @Override
    public String getActorId() {
        return clientId;
    }

    @Override
    public Map<String, Object> getEventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("additionalMinutes", additionalMinutes);
        data.put("authorizedMinutes", authorizedMinutes);
        data.put("authorizedAmount", authorizedAmount);
        return data;
    }

    @Override
    public ServerMessage toRoomMessage() {
        return SessionExtendedMessage.builder()
                .sessionId(getSessionId())
                .authorizedMinutes(authorizedMinutes)
                .authorizedAmount(authorizedAmount)
                .remainingMinutes(remainingMinutes)
                .build();
    }

    @Override
    public EventPriority getPriority() {
        return EventPriority.IMPORTANT;
    }
}
