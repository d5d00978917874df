package com.kb.metering.model.event;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 예치 승인(세션 생성) 이벤트
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class SessionAuthorizedEvent extends SessionEvent {

    private String clientId;

    private String readerId;

    private String kind;

    private long rate;

    private int authorizedMinutes;

    private long authorizedAmount;

    @Override
    public String getEventType() {
        return "SESSION_AUTHORIZED";
    }

    @Override
    public String getActorId() {
        return clientId;
    }

    @Override
    public Map<String, Object> getEventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("readerId", readerId);
        data.put("kind", kind);
        data.put("rate", rate);
        data.put("authorizedMinutes", authorizedMinutes);
        data.put("authorizedAmount", authorizedAmount);
        return data;
    }

    @Override
    public EventPriority getPriority() {
        return EventPriority.IMPORTANT;
    }
}
