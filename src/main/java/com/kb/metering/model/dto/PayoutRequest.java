package com.kb.metering.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 지급 반영 요청 (지급 배치 측에서 호출)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PayoutRequest {

    @NotBlank(message = "리더 ID는 필수입니다")
    private String readerId;
}
