package com.kb.metering.config;

import com.kb.metering.controller.RealtimeWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;

import java.util.Map;

/**
 * WebSocket 설정
 * 단일 실시간 채널(/ws/realtime)에 타입 기반 JSON 프레임 핸들러를 매핑
 */
@Configuration
public class WebSocketConfig {

    public static final String REALTIME_PATH = "/ws/realtime";

    @Bean
    public HandlerMapping realtimeHandlerMapping(RealtimeWebSocketHandler realtimeWebSocketHandler) {
        Map<String, WebSocketHandler> mappings = Map.of(REALTIME_PATH, realtimeWebSocketHandler);
        // 컨트롤러 매핑보다 먼저 평가
        return new SimpleUrlHandlerMapping(mappings, Ordered.HIGHEST_PRECEDENCE);
    }
}
