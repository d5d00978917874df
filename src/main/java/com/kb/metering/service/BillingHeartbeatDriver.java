package com.kb.metering.service;

import com.kb.metering.billing.EndOutcome;
import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.billing.TickOutcome;
import com.kb.metering.config.MeteringProperties;
import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.SignalingRelay;
import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.EndReason;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.SessionStatus;
import com.kb.metering.model.message.outbound.BalanceUpdatedMessage;
import com.kb.metering.model.message.outbound.MinuteBilledMessage;
import com.kb.metering.model.message.outbound.NeedsMoreFundsMessage;
import com.kb.metering.model.message.outbound.SessionEndMessage;
import com.kb.metering.model.message.outbound.SessionExtendedMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * 과금 하트비트 드라이버
 *
 * 전송 계층(허브)에 과금 결과를 알리는 유일한 구성요소.
 * 하트비트와 서버측 재조정 타이머로 Tick 을 호출하고, 잔액 소진 시 카운트다운 후 세션을 종료한다.
 */
@Slf4j
@Service
public class BillingHeartbeatDriver {

    private final MeteredSessionService sessionService;
    private final SessionTimerScheduler timerScheduler;
    private final ConnectionHub hub;
    private final SignalingRelay signalingRelay;
    private final ChatFanoutService chatFanoutService;
    private final Duration insufficientFundsGrace;
    private final Duration livenessTimeout;

    public BillingHeartbeatDriver(MeteredSessionService sessionService,
                                  SessionTimerScheduler timerScheduler,
                                  ConnectionHub hub,
                                  SignalingRelay signalingRelay,
                                  ChatFanoutService chatFanoutService,
                                  MeteringProperties properties) {
        this.sessionService = sessionService;
        this.timerScheduler = timerScheduler;
        this.hub = hub;
        this.signalingRelay = signalingRelay;
        this.chatFanoutService = chatFanoutService;
        this.insufficientFundsGrace = properties.getHeartbeat().getInsufficientFundsGrace();
        this.livenessTimeout = properties.getHeartbeat().getLivenessTimeout();
    }

    /**
     * 참여자 하트비트 처리 후 과금 결과 전파
     */
    public Mono<SessionTick> heartbeat(String sessionId, String userId) {
        return sessionService.heartbeat(sessionId, userId)
                .doOnNext(this::publishTick);
    }

    /**
     * 서버측 재조정 (타이머에서 호출)
     * 하트비트가 liveness 기준보다 오래 없으면 세션을 종료한다.
     */
    public Mono<SessionTick> reconcile(String sessionId) {
        return sessionService.reconcile(sessionId)
                .flatMap(tick -> {
                    MeteredSession session = tick.getSession();
                    if (session.isTerminal()) {
                        timerScheduler.cancel(sessionId);
                        return Mono.just(tick);
                    }
                    publishTick(tick);
                    if (isLivenessExpired(session, sessionService.now())) {
                        log.warn("하트비트 없음, 세션 강제 종료: sessionId={}, lastHeartbeat={}",
                                sessionId, session.getLastClientHeartbeatAt());
                        return endForLiveness(sessionId).thenReturn(tick);
                    }
                    return Mono.just(tick);
                });
    }

    /**
     * 두 참여자가 모두 모였을 때 등 명시적 활성화
     */
    public Mono<MeteredSession> activate(String sessionId, String actorId) {
        return sessionService.activate(sessionId, actorId)
                .doOnNext(session -> {
                    if (session.getStatus() == SessionStatus.ACTIVE) {
                        startReconciliation(session.getId());
                    }
                });
    }

    /**
     * 세션 연장: 카운트다운 취소 후 룸에 새 예치 시간 전파
     */
    public Mono<SessionExtension> extend(String sessionId, String userId, Integer additionalMinutes) {
        return sessionService.extend(sessionId, userId, additionalMinutes)
                .doOnNext(extension -> {
                    MeteredSession session = extension.getSession();
                    timerScheduler.cancelCountdown(sessionId);
                    hub.broadcast(session.getRoomId(), SessionExtendedMessage.builder()
                            .sessionId(sessionId)
                            .authorizedMinutes(session.getAuthorizedMinutes())
                            .authorizedAmount(session.getAuthorizedAmount())
                            .remainingMinutes(session.getRemainingMinutes())
                            .build(), null);
                    sendBalance(session.getClientId(), extension.getClientBalance());
                });
    }

    /**
     * 참여자 요청에 의한 세션 종료
     * 타이머와 시그널링 등록을 먼저 중단한 뒤 정산하므로 정산 이후 늦은 Tick 이 과금할 수 없다.
     *
     * @param endedBy 참여자 ID
     */
    public Mono<EndOutcome> end(String sessionId, String endedBy, EndReason reason) {
        return sessionService.findSession(sessionId, endedBy)
                .then(terminate(sessionId, endedBy, Mono.defer(() -> sessionService.end(sessionId, endedBy, reason))));
    }

    /**
     * 서버 판단에 의한 세션 종료 (liveness 만료, 잔액 소진)
     */
    public Mono<EndOutcome> endBySystem(String sessionId, EndReason reason) {
        return terminate(sessionId, SessionStateMachine.SYSTEM_ACTOR,
                Mono.defer(() -> sessionService.endBySystem(sessionId, reason)));
    }

    public Mono<EndOutcome> endForLiveness(String sessionId) {
        return endBySystem(sessionId, EndReason.LIVENESS_TIMEOUT);
    }

    private Mono<EndOutcome> terminate(String sessionId, String endedBy, Mono<EndOutcome> settlement) {
        return Mono.<EndOutcome>fromRunnable(() -> {
                    timerScheduler.cancel(sessionId);
                    signalingRelay.unregister(SessionStateMachine.roomIdOf(sessionId));
                })
                .then(settlement)
                .doOnNext(outcome -> {
                    if (outcome.isAlreadyEnded()) {
                        return;
                    }
                    MeteredSession session = outcome.getSession();
                    hub.broadcast(session.getRoomId(), SessionEndMessage.builder()
                            .sessionId(sessionId)
                            .reason(session.getEndReason().getCode())
                            .endedBy(session.getEndedBy())
                            .billedMinutes(session.getBilledMinutes())
                            .billedAmount(session.getBilledAmount())
                            .build(), null);
                    sendBalance(session.getClientId(), outcome.getClientBalance());
                    hub.closeRoom(session.getRoomId());
                    chatFanoutService.clearHistory(session.getRoomId());
                })
                .doOnError(error -> log.warn("세션 종료 처리 실패: sessionId={}, endedBy={}, error={}",
                        sessionId, endedBy, error.getMessage()));
    }

    /**
     * 잔액 부족 카운트다운 만료
     * 그 사이 다른 서버에서 연장되었으면 종료하지 않음
     */
    public Mono<EndOutcome> endForInsufficientFunds(String sessionId) {
        return sessionService.reconcile(sessionId)
                .flatMap(tick -> {
                    if (tick.getSession().isTerminal() || tick.getOutcome().getRemainingMinutes() > 0) {
                        log.info("잔액 부족 카운트다운 만료, 종료 불필요: sessionId={}, remaining={}",
                                sessionId, tick.getOutcome().getRemainingMinutes());
                        return Mono.empty();
                    }
                    log.info("잔액 부족으로 세션 종료: sessionId={}", sessionId);
                    return endBySystem(sessionId, EndReason.INSUFFICIENT_BALANCE);
                });
    }

    /**
     * 활성 세션의 재조정 타이머 시작 (이미 다른 서버가 맡았으면 무시)
     */
    public void startReconciliation(String sessionId) {
        if (timerScheduler.isReconciling(sessionId)) {
            return;
        }
        timerScheduler.scheduleReconciliation(sessionId, () -> reconcile(sessionId)
                        .subscribe(
                                tick -> log.debug("세션 재조정 완료: sessionId={}, status={}",
                                        sessionId, tick.getOutcome().getStatus()),
                                error -> log.error("세션 재조정 실패: sessionId={}, error={}",
                                        sessionId, error.getMessage(), error)))
                .subscribe(
                        owned -> log.debug("세션 재조정 타이머 요청: sessionId={}, owned={}", sessionId, owned),
                        error -> log.error("세션 재조정 타이머 등록 실패: sessionId={}", sessionId, error));
    }

    public boolean isLivenessExpired(MeteredSession session, Instant now) {
        Instant last = session.getLastClientHeartbeatAt();
        return session.getStatus() == SessionStatus.ACTIVE
                && last != null
                && Duration.between(last, now).compareTo(livenessTimeout) > 0;
    }

    private void publishTick(SessionTick tick) {
        MeteredSession session = tick.getSession();
        if (session.isTerminal()) {
            return;
        }
        if (tick.isActivated() || session.getStatus() == SessionStatus.ACTIVE) {
            startReconciliation(session.getId());
        }

        TickOutcome outcome = tick.getOutcome();
        if (outcome.isBilled()) {
            hub.broadcast(session.getRoomId(), MinuteBilledMessage.builder()
                    .sessionId(session.getId())
                    .minutesBilled(outcome.getMinutesBilled())
                    .billedMinutes(outcome.getBilledMinutes())
                    .billedAmount(outcome.getBilledAmount())
                    .remainingMinutes(outcome.getRemainingMinutes())
                    .lowBalance(sessionService.isLowBalance(outcome.getRemainingMinutes()))
                    .build(), null);
            sendBalance(session.getClientId(), tick.getClientBalance());
        }
        if (outcome.isNeedsMoreFunds()) {
            warnNeedsMoreFunds(session, outcome);
        }
    }

    private void warnNeedsMoreFunds(MeteredSession session, TickOutcome outcome) {
        String sessionId = session.getId();
        boolean started = timerScheduler.scheduleCountdown(sessionId, insufficientFundsGrace,
                () -> endForInsufficientFunds(sessionId)
                        .subscribe(
                                ended -> log.debug("카운트다운 종료 처리 완료: sessionId={}", sessionId),
                                error -> log.error("카운트다운 종료 처리 실패: sessionId={}", sessionId, error)));
        if (started) {
            log.info("예치 시간 소진 경고: sessionId={}, graceSeconds={}", sessionId, insufficientFundsGrace.getSeconds());
            hub.broadcast(session.getRoomId(), NeedsMoreFundsMessage.builder()
                    .sessionId(sessionId)
                    .remainingMinutes(outcome.getRemainingMinutes())
                    .graceSeconds(insufficientFundsGrace.getSeconds())
                    .build(), null);
        }
    }

    private void sendBalance(String clientId, ClientBalance balance) {
        if (balance == null) {
            return;
        }
        hub.sendToUser(clientId, BalanceUpdatedMessage.builder()
                .available(balance.getAvailable())
                .locked(balance.getLocked())
                .build());
    }
}
