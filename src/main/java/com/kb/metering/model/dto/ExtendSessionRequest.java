package com.kb.metering.model.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 세션 연장 요청 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtendSessionRequest {

    @NotBlank(message = "세션 ID는 필수입니다")
    private String sessionId;

    /**
     * 추가 시간 (분). 생략 시 기본 연장 시간
     */
    @Min(value = 1, message = "연장 시간은 1분 이상이어야 합니다")
    private Integer additionalMinutes;
}
