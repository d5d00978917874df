package com.kb.metering.model.dto;

import com.kb.metering.model.entity.MeteredSession;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExtendResponse {

    private String sessionId;

    private int authorizedMinutes;

    private long authorizedAmount;

    private int remainingMinutes;

    /**
     * 이번 연장으로 추가 예치된 금액
     */
    private long reservedAmount;

    public static ExtendResponse of(MeteredSession session, long reservedAmount) {
        return ExtendResponse.builder()
                .sessionId(session.getId())
                .authorizedMinutes(session.getAuthorizedMinutes())
                .authorizedAmount(session.getAuthorizedAmount())
                .remainingMinutes(session.getRemainingMinutes())
                .reservedAmount(reservedAmount)
                .build();
    }
}
