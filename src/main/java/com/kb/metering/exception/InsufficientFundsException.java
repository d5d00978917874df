package com.kb.metering.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 잔액 부족 예외
 * 필요 금액과 현재 가용 잔액을 함께 전달하여 충전을 유도
 */
public class InsufficientFundsException extends MeteringException {

    private final long required;
    private final long available;

    public InsufficientFundsException(long required, long available) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("잔액이 부족합니다 (필요: %d, 가용: %d)", required, available));
        this.required = required;
        this.available = available;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }

    public long getShortfall() {
        return required - available;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required", required);
        details.put("available", available);
        details.put("shortfall", getShortfall());
        return details;
    }
}
