package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.Instant;

/**
 * 룸 채팅 메시지 (선물 메시지 포함)
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class ChatBroadcastMessage extends ServerMessage {

    public static final String TYPE = "chat_message";

    private String roomId;

    private String messageId;

    private String senderId;

    private String content;

    private Instant timestamp;

    private boolean gift;

    private String giftId;

    /**
     * 선물 메시지일 때 선물 금액
     */
    private Long giftValue;

    @Override
    public String getType() {
        return TYPE;
    }
}
