package com.kb.metering.service;

import com.kb.metering.billing.EndOutcome;
import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.billing.TickOutcome;
import com.kb.metering.config.MeteringProperties;
import com.kb.metering.exception.SessionNotFoundException;
import com.kb.metering.exception.UnauthorizedParticipantException;
import com.kb.metering.ledger.LedgerChange;
import com.kb.metering.ledger.LedgerConflictRetry;
import com.kb.metering.ledger.LedgerStore;
import com.kb.metering.model.dto.StartSessionRequest;
import com.kb.metering.model.entity.EndReason;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.SessionEventLog;
import com.kb.metering.model.entity.SessionKind;
import com.kb.metering.model.entity.SessionStatus;
import com.kb.metering.model.entity.SettlementRecord;
import com.kb.metering.model.event.MinuteBilledEvent;
import com.kb.metering.model.event.SessionActivatedEvent;
import com.kb.metering.model.event.SessionAuthorizedEvent;
import com.kb.metering.model.event.SessionEndedEvent;
import com.kb.metering.model.event.SessionExtendedEvent;
import com.kb.metering.repository.SessionEventLogRepository;
import com.kb.metering.util.ServerInstanceIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuples;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * 과금 세션 서비스
 *
 * 상태 머신 호출과 원장 커밋을 묶는 계층. 각 연산은 문서를 새로 읽고, 변경하고,
 * 한 트랜잭션으로 커밋한다. 버전 충돌 시 처음부터 다시 읽어 재시도하므로
 * 실패한 시도의 변경은 어디에도 남지 않는다. 이벤트 발행은 커밋 이후에만 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeteredSessionService {

    private final LedgerStore ledgerStore;
    private final SessionStateMachine stateMachine;
    private final Clock meteringClock;
    private final MeteringProperties properties;
    private final KafkaEventPublisher eventPublisher;
    private final ServerInstanceIdGenerator serverInstanceIdGenerator;
    private final SessionEventLogRepository eventLogRepository;

    /**
     * 세션 시작 (예치 승인)
     *
     * @param clientId 고객 ID
     * @param request 리더 ID, 세션 종류, 시간(분)
     * @return 생성된 세션 (initialized)
     */
    public Mono<MeteredSession> authorize(String clientId, StartSessionRequest request) {
        SessionKind kind = SessionKind.from(request.getType());
        String sessionId = UUID.randomUUID().toString();

        return Mono.defer(() -> Mono.zip(
                        ledgerStore.findReaderProfile(request.getReaderId())
                                .switchIfEmpty(Mono.error(() -> new IllegalArgumentException(
                                        "리더를 찾을 수 없습니다: " + request.getReaderId()))),
                        ledgerStore.loadClientBalance(clientId))
                .flatMap(tuple -> {
                    long rate = tuple.getT1().rateFor(kind);
                    MeteredSession session = stateMachine.authorize(sessionId, tuple.getT2(), request.getReaderId(),
                            kind, rate, request.getDuration(), now());
                    return ledgerStore.commit(LedgerChange.builder()
                                    .session(session)
                                    .clientBalance(tuple.getT2())
                                    .build())
                            .thenReturn(session);
                }))
                .retryWhen(conflictRetry())
                .doOnSuccess(session -> log.info("세션 예치 승인: sessionId={}, clientId={}, readerId={}, kind={}, rate={}, minutes={}, amount={}",
                        session.getId(), clientId, session.getReaderId(), kind.getCode(),
                        session.getRatePerMinute(), session.getAuthorizedMinutes(), session.getAuthorizedAmount()))
                .doOnError(error -> log.warn("세션 예치 승인 실패: clientId={}, readerId={}, error={}",
                        clientId, request.getReaderId(), error.getMessage()))
                .flatMap(session -> eventPublisher.publishQuietly(SessionAuthorizedEvent.builder()
                                .sessionId(session.getId())
                                .roomId(session.getRoomId())
                                .originServerId(serverInstanceIdGenerator.getServerInstanceId())
                                .clientId(clientId)
                                .readerId(session.getReaderId())
                                .kind(kind.getCode())
                                .rate(session.getRatePerMinute())
                                .authorizedMinutes(session.getAuthorizedMinutes())
                                .authorizedAmount(session.getAuthorizedAmount())
                                .build())
                        .thenReturn(session));
    }

    /**
     * 세션 활성화 (이미 active 면 변경 없음)
     *
     * @param sessionId 세션 ID
     * @param actorId 활성화를 유발한 사용자 ID
     */
    public Mono<MeteredSession> activate(String sessionId, String actorId) {
        return Mono.defer(() -> findExisting(sessionId)
                        .flatMap(session -> {
                            if (session.isTerminal() || session.getStatus() == SessionStatus.ACTIVE) {
                                return Mono.just(Tuples.of(session, false));
                            }
                            stateMachine.activate(session, now());
                            return ledgerStore.commit(LedgerChange.builder().session(session).build())
                                    .thenReturn(Tuples.of(session, true));
                        }))
                .retryWhen(conflictRetry())
                .flatMap(result -> {
                    MeteredSession session = result.getT1();
                    if (!result.getT2()) {
                        return Mono.just(session);
                    }
                    log.info("세션 활성화: sessionId={}, actorId={}, startedAt={}", sessionId, actorId, session.getStartedAt());
                    return publishActivated(session, actorId).thenReturn(session);
                });
    }

    /**
     * 참여자 하트비트
     * 첫 하트비트는 세션을 활성화하고, 고객 하트비트는 liveness 시각을 갱신한 뒤 경과 시간만큼 과금한다.
     * 종료된 세션이면 현재 누적값을 그대로 반환 (중복 하트비트 허용)
     */
    public Mono<SessionTick> heartbeat(String sessionId, String userId) {
        return advance(sessionId, userId, true)
                .doOnSuccess(tick -> log.debug("하트비트 처리: sessionId={}, userId={}, status={}, billedMinutes={}",
                        sessionId, userId, tick.getOutcome().getStatus(), tick.getOutcome().getBilledMinutes()));
    }

    /**
     * 서버측 재조정 (하트비트가 없어도 분 경계를 넘으면 과금)
     */
    public Mono<SessionTick> reconcile(String sessionId) {
        return advance(sessionId, SessionStateMachine.SYSTEM_ACTOR, false);
    }

    /**
     * 세션 연장 (고객만 가능)
     *
     * @param additionalMinutes null 이면 기본 연장 시간
     */
    public Mono<SessionExtension> extend(String sessionId, String userId, Integer additionalMinutes) {
        int minutes = additionalMinutes != null
                ? additionalMinutes
                : properties.getBilling().getDefaultExtensionMinutes();

        return Mono.defer(() -> findExisting(sessionId)
                        .flatMap(session -> ledgerStore.loadClientBalance(session.getClientId())
                                .flatMap(balance -> {
                                    long reserved = stateMachine.extend(session, balance, userId, minutes, now());
                                    return ledgerStore.commit(LedgerChange.builder()
                                                    .session(session)
                                                    .clientBalance(balance)
                                                    .build())
                                            .thenReturn(new SessionExtension(session, minutes, reserved, balance));
                                })))
                .retryWhen(conflictRetry())
                .doOnSuccess(extension -> log.info("세션 연장: sessionId={}, minutes={}, reserved={}, authorizedMinutes={}",
                        sessionId, minutes, extension.getReservedAmount(), extension.getSession().getAuthorizedMinutes()))
                .doOnError(error -> log.warn("세션 연장 실패: sessionId={}, userId={}, error={}",
                        sessionId, userId, error.getMessage()))
                .flatMap(extension -> eventPublisher.publishQuietly(SessionExtendedEvent.builder()
                                .sessionId(sessionId)
                                .roomId(extension.getSession().getRoomId())
                                .originServerId(serverInstanceIdGenerator.getServerInstanceId())
                                .clientId(extension.getSession().getClientId())
                                .additionalMinutes(minutes)
                                .authorizedMinutes(extension.getSession().getAuthorizedMinutes())
                                .authorizedAmount(extension.getSession().getAuthorizedAmount())
                                .remainingMinutes(extension.getSession().getRemainingMinutes())
                                .build())
                        .thenReturn(extension));
    }

    /**
     * 참여자 요청에 의한 세션 종료 및 정산
     * 이미 종료된 세션이면 기존 정산 기록을 담아 alreadyEnded 로 반환
     *
     * @param endedBy 참여자 ID
     */
    public Mono<EndOutcome> end(String sessionId, String endedBy, EndReason reason) {
        return terminate(sessionId, endedBy, reason, false);
    }

    /**
     * 서버 판단에 의한 세션 종료 (liveness 만료, 잔액 소진). 참여자 검증 없음
     */
    public Mono<EndOutcome> endBySystem(String sessionId, EndReason reason) {
        return terminate(sessionId, SessionStateMachine.SYSTEM_ACTOR, reason, true);
    }

    private Mono<EndOutcome> terminate(String sessionId, String endedBy, EndReason reason, boolean systemInitiated) {
        return Mono.defer(() -> findExisting(sessionId)
                        .flatMap(session -> {
                            if (!systemInitiated && !session.isParticipant(endedBy)) {
                                return Mono.error(new UnauthorizedParticipantException("세션 참여자만 종료할 수 있습니다"));
                            }
                            if (session.isTerminal()) {
                                return ledgerStore.findSettlement(SettlementRecord.sessionReference(sessionId))
                                        .map(existing -> EndOutcome.alreadyEnded(session, existing))
                                        .defaultIfEmpty(EndOutcome.alreadyEnded(session, null));
                            }
                            return Mono.zip(ledgerStore.loadClientBalance(session.getClientId()),
                                            ledgerStore.loadReaderBalance(session.getReaderId()))
                                    .flatMap(balances -> {
                                        EndOutcome outcome = systemInitiated
                                                ? stateMachine.endBySystem(session, balances.getT1(), balances.getT2(),
                                                        reason, now())
                                                : stateMachine.end(session, balances.getT1(), balances.getT2(),
                                                        reason, endedBy, now());
                                        return ledgerStore.commit(LedgerChange.builder()
                                                        .session(session)
                                                        .clientBalance(balances.getT1())
                                                        .readerBalance(outcome.getSettlement() != null ? balances.getT2() : null)
                                                        .settlement(outcome.getSettlement())
                                                        .build())
                                                .thenReturn(outcome);
                                    });
                        }))
                .retryWhen(conflictRetry())
                .flatMap(outcome -> {
                    if (outcome.isAlreadyEnded()) {
                        log.debug("이미 종료된 세션 종료 요청 무시: sessionId={}, endedBy={}", sessionId, endedBy);
                        return Mono.just(outcome);
                    }
                    MeteredSession session = outcome.getSession();
                    log.info("세션 종료: sessionId={}, status={}, reason={}, endedBy={}, billedMinutes={}, billedAmount={}, refund={}",
                            sessionId, session.getStatus().getCode(), session.getEndReason().getCode(), endedBy,
                            session.getBilledMinutes(), session.getBilledAmount(), outcome.getRefundedAmount());
                    return eventPublisher.publishQuietly(endedEvent(outcome)).thenReturn(outcome);
                });
    }

    /**
     * 세션 조회 (참여자만)
     */
    public Mono<MeteredSession> findSession(String sessionId, String userId) {
        return findExisting(sessionId)
                .flatMap(session -> session.isParticipant(userId)
                        ? Mono.just(session)
                        : Mono.error(new UnauthorizedParticipantException("세션 참여자가 아닙니다")));
    }

    /**
     * 세션 이벤트 이력 조회 (참여자만, 최신순)
     */
    public Flux<SessionEventLog> findEvents(String sessionId, String userId) {
        return findSession(sessionId, userId)
                .flatMapMany(session -> eventLogRepository.findBySessionIdOrderByTimestampDesc(sessionId));
    }

    public Instant now() {
        return meteringClock.instant();
    }

    private Mono<SessionTick> advance(String sessionId, String actorId, boolean fromParticipant) {
        return Mono.defer(() -> findExisting(sessionId)
                        .flatMap(session -> {
                            if (fromParticipant && !session.isParticipant(actorId)) {
                                return Mono.error(new UnauthorizedParticipantException("세션 참여자가 아닙니다"));
                            }
                            if (session.isTerminal()) {
                                return Mono.just(SessionTick.unchanged(session));
                            }
                            if (!fromParticipant && session.getStatus() != SessionStatus.ACTIVE) {
                                return Mono.just(SessionTick.unchanged(session));
                            }
                            return ledgerStore.loadClientBalance(session.getClientId())
                                    .flatMap(balance -> {
                                        Instant now = now();
                                        boolean activated = fromParticipant && stateMachine.activate(session, now);
                                        boolean heartbeatRecorded = fromParticipant && session.isClient(actorId);
                                        if (heartbeatRecorded) {
                                            stateMachine.recordClientHeartbeat(session, now);
                                        }
                                        TickOutcome outcome = stateMachine.tick(session, balance, now);
                                        if (!activated && !heartbeatRecorded && !outcome.isBilled()) {
                                            return Mono.just(new SessionTick(session, outcome, null, false));
                                        }
                                        return ledgerStore.commit(LedgerChange.builder()
                                                        .session(session)
                                                        .clientBalance(outcome.isBilled() ? balance : null)
                                                        .build())
                                                .thenReturn(new SessionTick(session, outcome,
                                                        outcome.isBilled() ? balance : null, activated));
                                    });
                        }))
                .retryWhen(conflictRetry())
                .flatMap(tick -> publishTickEvents(tick, actorId).thenReturn(tick));
    }

    private Mono<Void> publishTickEvents(SessionTick tick, String actorId) {
        MeteredSession session = tick.getSession();
        Mono<Void> activated = Mono.empty();
        if (tick.isActivated()) {
            log.info("세션 활성화 (첫 하트비트): sessionId={}, actorId={}", session.getId(), actorId);
            activated = publishActivated(session, actorId);
        }
        if (!tick.getOutcome().isBilled()) {
            return activated;
        }
        TickOutcome outcome = tick.getOutcome();
        log.info("분 과금: sessionId={}, minutes={}, amount={}, billedMinutes={}, billedAmount={}, remaining={}",
                session.getId(), outcome.getMinutesBilled(), outcome.getAmountBilled(),
                outcome.getBilledMinutes(), outcome.getBilledAmount(), outcome.getRemainingMinutes());
        return activated.then(eventPublisher.publishQuietly(MinuteBilledEvent.builder()
                .sessionId(session.getId())
                .roomId(session.getRoomId())
                .originServerId(serverInstanceIdGenerator.getServerInstanceId())
                .clientId(session.getClientId())
                .minutesBilled(outcome.getMinutesBilled())
                .amountBilled(outcome.getAmountBilled())
                .billedMinutes(outcome.getBilledMinutes())
                .billedAmount(outcome.getBilledAmount())
                .remainingMinutes(outcome.getRemainingMinutes())
                .lowBalance(isLowBalance(outcome.getRemainingMinutes()))
                .build()));
    }

    /**
     * 남은 분이 경고 기준 이하인지
     */
    public boolean isLowBalance(int remainingMinutes) {
        return remainingMinutes <= properties.getBilling().getLowBalanceThresholdMinutes();
    }

    private Mono<Void> publishActivated(MeteredSession session, String actorId) {
        return eventPublisher.publishQuietly(SessionActivatedEvent.builder()
                .sessionId(session.getId())
                .roomId(session.getRoomId())
                .originServerId(serverInstanceIdGenerator.getServerInstanceId())
                .activatedBy(actorId)
                .startedAt(session.getStartedAt())
                .build());
    }

    private SessionEndedEvent endedEvent(EndOutcome outcome) {
        MeteredSession session = outcome.getSession();
        SettlementRecord settlement = outcome.getSettlement();
        return SessionEndedEvent.builder()
                .sessionId(session.getId())
                .roomId(session.getRoomId())
                .originServerId(serverInstanceIdGenerator.getServerInstanceId())
                .status(session.getStatus().getCode())
                .reason(session.getEndReason().getCode())
                .endedBy(session.getEndedBy())
                .billedMinutes(session.getBilledMinutes())
                .billedAmount(session.getBilledAmount())
                .refundedAmount(outcome.getRefundedAmount())
                .readerShare(settlement != null ? settlement.getReaderShare() : 0L)
                .platformShare(settlement != null ? settlement.getPlatformShare() : 0L)
                .build();
    }

    private Mono<MeteredSession> findExisting(String sessionId) {
        return ledgerStore.findSession(sessionId)
                .switchIfEmpty(Mono.error(() -> new SessionNotFoundException(sessionId)));
    }

    private Retry conflictRetry() {
        return LedgerConflictRetry.conflicts(properties.getBilling().getMaxConflictRetries());
    }
}
