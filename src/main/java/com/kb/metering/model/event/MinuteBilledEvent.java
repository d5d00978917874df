package com.kb.metering.model.event;

import com.kb.metering.model.message.outbound.MinuteBilledMessage;
import com.kb.metering.model.message.outbound.ServerMessage;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 분 과금 이벤트
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class MinuteBilledEvent extends SessionEvent {

    private String clientId;

    private int minutesBilled;

    private long amountBilled;

    private int billedMinutes;

    private long billedAmount;

    private int remainingMinutes;

    private boolean lowBalance;

    @Override
    public String getEventType() {
        return "MINUTE_BILLED";
    }

    @Override
    public String getActorId() {
        return clientId;
    }

    @Override
    public Map<String, Object> getEventData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("minutesBilled", minutesBilled);
        data.put("amountBilled", amountBilled);
        data.put("billedMinutes", billedMinutes);
        data.put("billedAmount", billedAmount);
        data.put("remainingMinutes", remainingMinutes);
        return data;
    }

    @Override
    public ServerMessage toRoomMessage() {
        return MinuteBilledMessage.builder()
                .sessionId(getSessionId())
                .minutesBilled(minutesBilled)
                .billedMinutes(billedMinutes)
                .billedAmount(billedAmount)
                .remainingMinutes(remainingMinutes)
                .lowBalance(lowBalance)
                .build();
    }

    @Override
    public EventPriority getPriority() {
        return EventPriority.CRITICAL;
    }
}
