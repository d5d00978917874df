package com.kb.metering.model.message.inbound;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 소켓 경유 하트비트 (REST 하트비트와 동일하게 과금 트리거)
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatMessage extends ClientMessage {

    private String sessionId;
}
