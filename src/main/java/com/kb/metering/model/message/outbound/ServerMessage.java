package com.kb.metering.model.message.outbound;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 서버 -> 클라이언트 실시간 메시지 기본 클래스
 * 모든 메시지는 type 필드를 포함하는 JSON 객체로 직렬화
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class ServerMessage {

    /**
     * 메시지 타입 (하위 클래스에서 구현)
     */
    @JsonProperty("type")
    public abstract String getType();
}
