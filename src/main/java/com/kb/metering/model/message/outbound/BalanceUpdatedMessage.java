package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 잔액 변경 알림 (고객 메일박스로 전송)
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class BalanceUpdatedMessage extends ServerMessage {

    public static final String TYPE = "balance_updated";

    private long available;

    private long locked;

    @Override
    public String getType() {
        return TYPE;
    }
}
