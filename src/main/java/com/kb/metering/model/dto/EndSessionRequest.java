package com.kb.metering.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EndSessionRequest {

    @NotBlank(message = "세션 ID는 필수입니다")
    private String sessionId;

    /**
     * 종료 사유 (기본: normal)
     */
    private String reason;
}
