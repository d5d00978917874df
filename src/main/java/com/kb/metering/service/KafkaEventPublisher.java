package com.kb.metering.service;

import com.kb.metering.model.event.SessionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.reactive.ReactiveKafkaProducerTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Kafka 이벤트 발행 서비스
 * 원장 커밋 이후 세션 라이프사이클 이벤트를 발행
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KafkaEventPublisher {
    
    private final ReactiveKafkaProducerTemplate<String, SessionEvent> sessionEventProducerTemplate;
    
    @Value("${metering.kafka.topics.session-events}")
    private String sessionEventsTopic;
    
    /**
     * 세션 이벤트 발행 (세션 ID, 없으면 룸 ID를 키로 사용)
     * @param event 발행할 이벤트
     * @return 발행 결과 (실패 시 에러 전파)
     */
    public Mono<Void> publish(SessionEvent event) {
        String key = partitionKey(event);
        log.debug("세션 이벤트 발행: {} - {}", event.getEventType(), key);
        
        return sessionEventProducerTemplate
            .send(sessionEventsTopic, key, event)
            .doOnSuccess(result -> 
                log.info("세션 이벤트 발행 성공: {} - {} (파티션: {}, 오프셋: {})", 
                    event.getEventType(), key,
                    result.recordMetadata().partition(), 
                    result.recordMetadata().offset())
            )
            .doOnError(error -> 
                log.error("세션 이벤트 발행 실패: {} - {}", event.getEventType(), key, error)
            )
            .then();
    }

    /**
     * 과금 흐름용 발행: 실패해도 호출한 금전 작업은 성공으로 유지
     * @param event 발행할 이벤트
     * @return 항상 정상 완료
     */
    public Mono<Void> publishQuietly(SessionEvent event) {
        return publish(event)
            .onErrorResume(error -> {
                log.warn("세션 이벤트 발행 실패 (원장 커밋은 유지): {} - {}, error={}",
                    event.getEventType(), partitionKey(event), error.getMessage());
                return Mono.empty();
            });
    }

    private String partitionKey(SessionEvent event) {
        return event.getSessionId() != null ? event.getSessionId() : event.getRoomId();
    }
}
