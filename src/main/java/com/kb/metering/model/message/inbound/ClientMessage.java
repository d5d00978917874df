package com.kb.metering.model.message.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 클라이언트 -> 서버 실시간 메시지 기본 클래스
 * type 필드로 하위 타입을 구분하며, 알 수 없는 type 은 UnknownClientMessage 로 역직렬화
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", visible = true,
        defaultImpl = UnknownClientMessage.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = JoinSessionMessage.class, name = "join_session"),
    @JsonSubTypes.Type(value = LeaveSessionMessage.class, name = "leave_session"),
    @JsonSubTypes.Type(value = JoinBroadcastMessage.class, name = "join_broadcast"),
    @JsonSubTypes.Type(value = LeaveBroadcastMessage.class, name = "leave_broadcast"),
    @JsonSubTypes.Type(value = ChatMessage.class, name = "chat_message"),
    @JsonSubTypes.Type(value = SignalMessage.class, names = {"signal_offer", "signal_answer", "signal_ice"}),
    @JsonSubTypes.Type(value = SendGiftMessage.class, name = "send_gift"),
    @JsonSubTypes.Type(value = HeartbeatMessage.class, name = "heartbeat"),
    @JsonSubTypes.Type(value = EndSessionMessage.class, name = "end_session")
})
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
public abstract class ClientMessage {
}
