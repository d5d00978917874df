package com.kb.metering.model.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 충전 반영 요청 (결제 게이트웨이 측에서 호출)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TopUpRequest {

    @NotBlank(message = "고객 ID는 필수입니다")
    private String clientId;

    @Min(value = 1, message = "충전 금액은 1 이상이어야 합니다")
    private long amount;
}
