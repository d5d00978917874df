package com.kb.metering.service;

import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.SignalingRelay;
import com.kb.metering.model.entity.SessionEventLog;
import com.kb.metering.model.event.SessionEndedEvent;
import com.kb.metering.model.event.SessionEvent;
import com.kb.metering.model.event.SessionExtendedEvent;
import com.kb.metering.model.message.outbound.ServerMessage;
import com.kb.metering.repository.SessionEventLogRepository;
import com.kb.metering.util.ServerInstanceIdGenerator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;

import java.time.Instant;

/**
 * Kafka 이벤트 소비 서비스
 *
 * 인스턴스마다 별도 컨슈머 그룹으로 모든 세션 이벤트를 수신한다.
 * - 이 서버에서 발생한 이벤트: 감사 로그 저장
 * - 다른 서버에서 발생한 이벤트: 이 서버에 연결된 룸 멤버에게 전달하고 로컬 타이머/시그널링 정리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KafkaEventConsumer {

    private final ReceiverOptions<String, SessionEvent> sessionEventReceiverOptions;
    private final SessionEventLogRepository eventLogRepository;
    private final ConnectionHub hub;
    private final SignalingRelay signalingRelay;
    private final SessionTimerScheduler timerScheduler;
    private final ChatFanoutService chatFanoutService;
    private final ServerInstanceIdGenerator serverInstanceIdGenerator;

    private Disposable sessionEventsDisposable;

    /**
     * Kafka 이벤트 소비 시작
     */
    @PostConstruct
    public void startConsuming() {
        sessionEventsDisposable = KafkaReceiver.create(sessionEventReceiverOptions)
            .receive()
            .doOnNext(record -> log.debug("세션 이벤트 수신: key={}, type={}, origin={}",
                record.key(), record.value().getEventType(), record.value().getOriginServerId()))
            .concatMap(record -> processEvent(record.value())
                .doOnSuccess(v -> record.receiverOffset().acknowledge())
                .doOnError(e -> log.error("세션 이벤트 처리 실패: {}", e.getMessage(), e))
                .onErrorComplete()) // 한 이벤트 실패로 구독이 끊기지 않도록 함
            .doOnError(error -> log.error("세션 이벤트 Consumer 오류", error))
            .subscribe();

        log.info("Kafka Consumer 시작: serverId={}", serverInstanceIdGenerator.getServerInstanceId());
    }

    /**
     * 애플리케이션 종료 시 Consumer 정리
     */
    @PreDestroy
    public void cleanup() {
        if (sessionEventsDisposable != null && !sessionEventsDisposable.isDisposed()) {
            sessionEventsDisposable.dispose();
            log.info("세션 이벤트 Consumer 종료됨");
        }
    }

    /**
     * 이벤트 처리
     * @param event 처리할 이벤트
     * @return 처리 결과
     */
    Mono<Void> processEvent(SessionEvent event) {
        if (serverInstanceIdGenerator.isLocal(event.getOriginServerId())) {
            return saveEventLog(event);
        }
        return Mono.fromRunnable(() -> relayRemoteEvent(event));
    }

    /**
     * 이벤트 로그 저장 (재전달된 이벤트는 건너뜀)
     * @param event 저장할 이벤트
     * @return 저장 결과
     */
    private Mono<Void> saveEventLog(SessionEvent event) {
        SessionEventLog eventLog = SessionEventLog.builder()
            .eventId(event.getEventId())
            .sessionId(event.getSessionId())
            .eventType(event.getEventType())
            .timestamp(event.getTimestamp())
            .userId(event.getActorId())
            .originServerId(event.getOriginServerId())
            .recordedBy(serverInstanceIdGenerator.getServerInstanceId())
            .priority(event.getPriority().name())
            .eventData(event.getEventData())
            .createdAt(Instant.now())
            .build();

        return eventLogRepository.existsByEventId(event.getEventId())
            .flatMap(exists -> {
                if (exists) {
                    log.debug("이미 저장된 이벤트 로그: eventId={}", event.getEventId());
                    return Mono.empty();
                }
                return eventLogRepository.save(eventLog)
                    .doOnSuccess(saved -> log.debug("이벤트 로그 저장 완료: {} - {}", saved.getEventType(), saved.getId()))
                    .then();
            });
    }

    /**
     * 다른 서버에서 발생한 이벤트를 로컬 룸 멤버에게 전달
     * @param event 전달할 이벤트
     */
    private void relayRemoteEvent(SessionEvent event) {
        String roomId = event.getRoomId();
        if (event instanceof SessionEndedEvent) {
            // 다른 서버에서 종료된 세션은 이 서버의 타이머와 시그널링도 즉시 중단
            timerScheduler.cancel(event.getSessionId());
            signalingRelay.unregister(roomId);
        } else if (event instanceof SessionExtendedEvent) {
            timerScheduler.cancelCountdown(event.getSessionId());
        }

        if (roomId == null || !hub.hasRoom(roomId)) {
            log.debug("로컬 멤버 없는 이벤트 무시: {} - {}", event.getEventType(), roomId);
            return;
        }
        ServerMessage message = event.toRoomMessage();
        if (message != null) {
            int delivered = hub.broadcast(roomId, message, null);
            log.debug("원격 이벤트 전달: {} -> {} ({}개 연결)", event.getEventType(), roomId, delivered);
        }
        if (event instanceof SessionEndedEvent) {
            hub.closeRoom(roomId);
            chatFanoutService.clearHistory(roomId);
        }
    }
}
