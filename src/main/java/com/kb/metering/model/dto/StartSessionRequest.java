package com.kb.metering.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 세션 시작 요청 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartSessionRequest {

    @NotBlank(message = "리더 ID는 필수입니다")
    private String readerId;

    /**
     * 세션 종류 (text | voice | video)
     */
    @NotBlank(message = "세션 종류는 필수입니다")
    private String type;

    /**
     * 최초 예치 시간 (분)
     */
    @Min(value = 1, message = "세션 시간은 1분 이상이어야 합니다")
    @Max(value = 240, message = "세션 시간은 240분을 넘을 수 없습니다")
    private int duration;
}
