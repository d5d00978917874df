package com.kb.metering.model.event;

import com.kb.metering.model.message.outbound.GiftAnimationMessage;
import com.kb.metering.model.message.outbound.ServerMessage;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 방송 선물 이벤트
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class GiftSentEvent extends SessionEvent {

    private String broadcastId;

    private String transactionId;

    private String senderId;

    private String receiverId;

    private String giftId;

    private String label;

    private long amount;

    private String animation;

    @Override
    public String getEventType() {
        return "GIFT_SENT";
    }

    @Override
    public String getActorId() {
        return senderId;
    }

    @Override
    public Map<String, Object> getEventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("broadcastId", broadcastId);
        data.put("transactionId", transactionId);
        data.put("receiverId", receiverId);
        data.put("giftId", giftId);
        data.put("amount", amount);
        return data;
    }

    @Override
    public ServerMessage toRoomMessage() {
        return GiftAnimationMessage.builder()
                .broadcastId(broadcastId)
                .senderId(senderId)
                .giftId(giftId)
                .label(label)
                .value(amount)
                .animation(animation)
                .build();
    }

    @Override
    public EventPriority getPriority() {
        return EventPriority.IMPORTANT;
    }
}
