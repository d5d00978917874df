package com.kb.metering.model.message.outbound;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 오류 알림 (요청한 연결에만 전송)
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class ErrorMessage extends ServerMessage {

    public static final String TYPE = "error";

    private String code;

    private String message;

    @Override
    public String getType() {
        return TYPE;
    }
}
