package com.kb.metering.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * 잔액 조회 응답 DTO
 * 리더인 경우 지급 예정 잔액도 포함
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BalanceResponse {

    private String userId;

    private long available;

    private long locked;

    private Long payable;

    private Long lifetimeEarnings;
}
