package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 선물 애니메이션 트리거
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class GiftAnimationMessage extends ServerMessage {

    public static final String TYPE = "gift_animation";

    private String broadcastId;

    private String senderId;

    private String giftId;

    private String label;

    private long value;

    private String animation;

    @Override
    public String getType() {
        return TYPE;
    }
}
