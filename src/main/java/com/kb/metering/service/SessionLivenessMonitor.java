package com.kb.metering.service;

import com.kb.metering.config.MeteringProperties;
import com.kb.metering.model.entity.SessionStatus;
import com.kb.metering.repository.MeteredSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 활성 세션 liveness 점검
 *
 * 재조정 타이머를 가진 서버가 종료된 경우에도 하트비트가 끊긴 세션이 과금 상태로 남지 않도록
 * 주기적으로 저장된 마지막 하트비트 시각을 확인해 종료한다.
 * 살아있는 활성 세션 중 재조정 타이머 소유자가 없는 세션은 이 서버가 인수한다.
 */
@Slf4j
@Component
public class SessionLivenessMonitor {

    private final MeteredSessionRepository sessionRepository;
    private final BillingHeartbeatDriver billingDriver;
    private final SessionTimerScheduler timerScheduler;
    private final Clock meteringClock;
    private final Duration livenessTimeout;

    public SessionLivenessMonitor(MeteredSessionRepository sessionRepository,
                                  BillingHeartbeatDriver billingDriver,
                                  SessionTimerScheduler timerScheduler,
                                  Clock meteringClock,
                                  MeteringProperties properties) {
        this.sessionRepository = sessionRepository;
        this.billingDriver = billingDriver;
        this.timerScheduler = timerScheduler;
        this.meteringClock = meteringClock;
        this.livenessTimeout = properties.getHeartbeat().getLivenessTimeout();
    }

    /**
     * 하트비트가 끊긴 활성 세션 종료
     */
    @Scheduled(fixedDelayString = "${metering.heartbeat.liveness-sweep-interval-ms:15000}")
    public void sweepStaleSessions() {
        Instant threshold = meteringClock.instant().minus(livenessTimeout);

        sessionRepository.findByStatusAndLastClientHeartbeatAtBefore(SessionStatus.ACTIVE, threshold)
                .doOnNext(session -> log.warn("liveness 만료 세션 발견: sessionId={}, lastHeartbeat={}",
                        session.getId(), session.getLastClientHeartbeatAt()))
                .concatMap(session -> billingDriver.endForLiveness(session.getId())
                        .doOnError(error -> log.error("liveness 만료 세션 종료 실패: sessionId={}, error={}",
                                session.getId(), error.getMessage()))
                        .onErrorComplete())
                .count()
                .subscribe(
                        ended -> {
                            if (ended > 0) {
                                log.info("liveness 점검 완료: 종료된 세션 {}개", ended);
                            }
                        },
                        error -> log.error("liveness 점검 실패", error));
    }

    /**
     * 재조정 타이머 소유자가 없는 활성 세션 인수 (서버 재시작/장애 후)
     */
    @EventListener(ApplicationReadyEvent.class)
    @Scheduled(initialDelayString = "${metering.heartbeat.liveness-sweep-interval-ms:15000}",
            fixedDelayString = "${metering.heartbeat.liveness-sweep-interval-ms:15000}")
    public void adoptOrphanedSessions() {
        sessionRepository.findByStatus(SessionStatus.ACTIVE)
                .filter(session -> !timerScheduler.isReconciling(session.getId()))
                .subscribe(
                        session -> billingDriver.startReconciliation(session.getId()),
                        error -> log.error("활성 세션 재조정 인수 실패", error));
    }
}
