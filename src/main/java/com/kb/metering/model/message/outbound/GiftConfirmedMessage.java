package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 선물 결제 완료 (보낸 사람에게만 전송)
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class GiftConfirmedMessage extends ServerMessage {

    public static final String TYPE = "gift_confirmed";

    private String transactionId;

    private String giftId;

    private long amount;

    private long available;

    @Override
    public String getType() {
        return TYPE;
    }
}
