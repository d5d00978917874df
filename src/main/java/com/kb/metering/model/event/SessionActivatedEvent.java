package com.kb.metering.model.event;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.Map;

/**
 * 세션 활성화(과금 시작) 이벤트
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class SessionActivatedEvent extends SessionEvent {

    private String activatedBy;

    private Instant startedAt;

    @Override
    public String getEventType() {
        return "SESSION_ACTIVATED";
    }

    @Override
    public String getActorId() {
        return activatedBy;
    }

    @Override
    public Map<String, Object> getEventData() {
        return Map.of("startedAt", String.valueOf(startedAt));
    }
}
