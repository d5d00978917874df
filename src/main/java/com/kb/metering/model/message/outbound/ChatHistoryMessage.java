package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

/**
 * 룸 입장 시 재전송하는 최근 채팅 기록
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class ChatHistoryMessage extends ServerMessage {

    public static final String TYPE = "chat_history";

    private String roomId;

    private List<ChatBroadcastMessage> messages;

    @Override
    public String getType() {
        return TYPE;
    }
}
