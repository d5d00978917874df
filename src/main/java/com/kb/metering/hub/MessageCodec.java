package com.kb.metering.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kb.metering.model.message.inbound.ClientMessage;
import com.kb.metering.model.message.outbound.ServerMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 실시간 채널 JSON 코덱
 * 수신 프레임은 경계에서 한 번만 타입 메시지로 변환하고, 송신 메시지는 브로드캐스트당 한 번만 직렬화
 */
@Slf4j
@Component
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * 수신 프레임 해석
     *
     * @param frame 원본 텍스트 프레임
     * @return 해석된 메시지. JSON 이 아니거나 형식이 맞지 않으면 empty
     */
    public Optional<ClientMessage> decode(String frame) {
        if (frame == null || frame.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(frame, ClientMessage.class));
        } catch (JsonProcessingException e) {
            log.debug("해석할 수 없는 프레임 무시: error={}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public String encode(ServerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("메시지 직렬화 실패: type=" + message.getType(), e);
        }
    }
}
