package com.kb.metering.model.message.inbound;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 통화 시그널링 메시지 (offer / answer / ice candidate)
 * payload 는 해석하지 않고 그대로 대상에게 전달
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
@AllArgsConstructor
public class SignalMessage extends ClientMessage {

    /**
     * 원본 type 값 (signal_offer | signal_answer | signal_ice)
     */
    @JsonProperty(value = "type", access = JsonProperty.Access.WRITE_ONLY)
    private String signalType;

    private String sessionId;

    /**
     * 수신 대상 참여자 ID
     */
    private String targetId;

    private JsonNode payload;
}
