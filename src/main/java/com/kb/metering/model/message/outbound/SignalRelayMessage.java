package com.kb.metering.model.message.outbound;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 중계된 시그널링 메시지
 * 수신 측은 senderId 로 보낸 참여자를 식별
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class SignalRelayMessage extends ServerMessage {

    @JsonIgnore
    private String signalType;

    private String sessionId;

    private String senderId;

    private JsonNode payload;

    @Override
    public String getType() {
        return signalType;
    }
}
