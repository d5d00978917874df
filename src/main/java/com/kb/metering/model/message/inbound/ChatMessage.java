package com.kb.metering.model.message.inbound;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 채팅 메시지
 * sessionId 또는 broadcastId 중 하나로 대상 룸 지정
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage extends ClientMessage {

    private String sessionId;

    private String broadcastId;

    private String content;
}
