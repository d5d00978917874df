package com.kb.metering.model.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.kb.metering.model.message.outbound.ServerMessage;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * 세션 라이프사이클 이벤트 기본 클래스
 * Kafka 로 전파되어 감사 로그 저장과 다른 서버 인스턴스의 룸 전파에 사용
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SessionAuthorizedEvent.class, name = "SESSION_AUTHORIZED"),
    @JsonSubTypes.Type(value = SessionActivatedEvent.class, name = "SESSION_ACTIVATED"),
    @JsonSubTypes.Type(value = MinuteBilledEvent.class, name = "MINUTE_BILLED"),
    @JsonSubTypes.Type(value = SessionExtendedEvent.class, name = "SESSION_EXTENDED"),
    @JsonSubTypes.Type(value = SessionEndedEvent.class, name = "SESSION_ENDED"),
    @JsonSubTypes.Type(value = GiftSentEvent.class, name = "GIFT_SENT")
})
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@SuperBuilder
@NoArgsConstructor
public abstract class SessionEvent {
    
    /**
     * 이벤트 고유 ID
     */
    @Builder.Default
    private String eventId = UUID.randomUUID().toString();
    
    /**
     * 세션 ID (방송 선물 이벤트는 null)
     */
    private String sessionId;

    /**
     * 이벤트를 전파할 룸 ID (Kafka 메시지 키로도 사용)
     */
    private String roomId;
    
    /**
     * 이벤트 발생 시각
     */
    @Builder.Default
    private Instant timestamp = Instant.now();
    
    /**
     * 이벤트를 발생시킨 서버 ID
     */
    private String originServerId;
    
    /**
     * 이벤트 타입 (하위 클래스에서 구현)
     */
    @JsonIgnore
    public abstract String getEventType();

    /**
     * 감사 로그에 남길 상세 데이터
     */
    @JsonIgnore
    public abstract Map<String, Object> getEventData();

    /**
     * 이벤트 관련 사용자 ID
     */
    @JsonIgnore
    public abstract String getActorId();

    /**
     * 다른 인스턴스에 연결된 룸 멤버에게 전달할 메시지 (전달 대상이 아니면 null)
     */
    @JsonIgnore
    public ServerMessage toRoomMessage() {
        return null;
    }
    
    /**
     * 이벤트 우선순위 (기본값: NORMAL)
     */
    public EventPriority getPriority() {
        return EventPriority.NORMAL;
    }
}
