package com.kb.metering.billing;

import com.kb.metering.exception.InsufficientFundsException;
import com.kb.metering.exception.SessionAlreadyTerminalException;
import com.kb.metering.exception.UnauthorizedParticipantException;
import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.EndReason;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.ReaderBalance;
import com.kb.metering.model.entity.SessionKind;
import com.kb.metering.model.entity.SessionStatus;
import com.kb.metering.model.entity.SettlementRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * 과금 세션 상태 머신
 * 
 * 네트워크/저장소에 의존하지 않는 순수 로직. 전달받은 문서 객체를 변경하며,
 * 모든 검증은 변경 전에 수행하므로 예외 발생 시 객체는 호출 전 상태 그대로 남는다.
 * 저장(원자적 커밋)은 호출하는 쪽의 책임.
 */
public class SessionStateMachine {

    public static final String SYSTEM_ACTOR = "system";

    private static final long MILLIS_PER_MINUTE = 60_000L;

    private final SettlementPolicy settlementPolicy;

    public SessionStateMachine(SettlementPolicy settlementPolicy) {
        this.settlementPolicy = settlementPolicy;
    }

    /**
     * 예치 승인: 필요 금액을 가용 잔액에서 locked 로 옮기고 세션 생성
     *
     * @throws InsufficientFundsException 가용 잔액 부족 (아무것도 변경하지 않음)
     */
    public MeteredSession authorize(String sessionId, ClientBalance balance, String readerId, SessionKind kind,
                                    long ratePerMinute, int minutes, Instant now) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("세션 시간은 1분 이상이어야 합니다");
        }
        if (ratePerMinute <= 0) {
            throw new IllegalArgumentException("리더의 유효한 분당 요금이 없습니다");
        }
        if (balance.getClientId().equals(readerId)) {
            throw new IllegalArgumentException("자기 자신과는 세션을 시작할 수 없습니다");
        }
        long required = Math.multiplyExact(ratePerMinute, (long) minutes);
        reserve(balance, required, now);

        return MeteredSession.builder()
                .id(sessionId)
                .clientId(balance.getClientId())
                .readerId(readerId)
                .kind(kind)
                .status(SessionStatus.INITIALIZED)
                .ratePerMinute(ratePerMinute)
                .authorizedMinutes(minutes)
                .authorizedAmount(required)
                .roomId(roomIdOf(sessionId))
                .createdAt(now)
                .build();
    }

    /**
     * initialized -> active. 이미 active 면 변경 없음
     *
     * @return 상태가 바뀌었으면 true
     */
    public boolean activate(MeteredSession session, Instant now) {
        requireNotTerminal(session);
        if (session.getStatus() == SessionStatus.ACTIVE) {
            return false;
        }
        session.setStatus(SessionStatus.ACTIVE);
        session.setStartedAt(now);
        session.setLastClientHeartbeatAt(now);
        return true;
    }

    /**
     * 고객 하트비트 시각 기록 (liveness 기준)
     */
    public void recordClientHeartbeat(MeteredSession session, Instant now) {
        requireNotTerminal(session);
        Instant last = session.getLastClientHeartbeatAt();
        if (last == null || now.isAfter(last)) {
            session.setLastClientHeartbeatAt(now);
        }
    }

    /**
     * 경과 시간 기준 과금
     * lastBilledMinute 이 유일한 기준이므로 같은 분 경계에서 여러 번 호출해도 한 번만 과금된다.
     */
    public TickOutcome tick(MeteredSession session, ClientBalance balance, Instant now) {
        requireNotTerminal(session);
        if (session.getStatus() != SessionStatus.ACTIVE || session.getStartedAt() == null) {
            return TickOutcome.of(TickOutcome.Status.NOT_STARTED, session, 0, 0L);
        }

        long elapsedMinutes = elapsedMinutes(session.getStartedAt(), now);
        long due = elapsedMinutes - session.getLastBilledMinute();
        long capacity = (long) session.getAuthorizedMinutes() - session.getBilledMinutes();
        int minutesToBill = (int) Math.min(due, capacity);

        if (minutesToBill <= 0) {
            TickOutcome.Status status = capacity <= 0 ? TickOutcome.Status.NEEDS_MORE_FUNDS : TickOutcome.Status.NO_CHANGE;
            return TickOutcome.of(status, session, 0, 0L);
        }

        long amount = Math.multiplyExact(session.getRatePerMinute(), (long) minutesToBill);
        if (balance.getLocked() < amount) {
            throw new IllegalStateException(String.format(
                    "예치 금액이 과금액보다 작습니다: sessionId=%s, locked=%d, amount=%d",
                    session.getId(), balance.getLocked(), amount));
        }

        session.setBilledMinutes(session.getBilledMinutes() + minutesToBill);
        session.setBilledAmount(session.getBilledAmount() + amount);
        session.setLastBilledMinute(session.getLastBilledMinute() + minutesToBill);
        session.setLastBilledAt(now);
        balance.setLocked(balance.getLocked() - amount);
        balance.setUpdatedAt(now);

        return TickOutcome.of(TickOutcome.Status.BILLED, session, minutesToBill, amount);
    }

    /**
     * 세션 연장 (고객만 가능)
     *
     * @throws InsufficientFundsException 가용 잔액 부족 (아무것도 변경하지 않음)
     */
    public long extend(MeteredSession session, ClientBalance balance, String requesterId,
                       int additionalMinutes, Instant now) {
        requireNotTerminal(session);
        if (!session.isClient(requesterId)) {
            throw new UnauthorizedParticipantException("세션 연장은 고객만 할 수 있습니다");
        }
        if (additionalMinutes <= 0) {
            throw new IllegalArgumentException("연장 시간은 1분 이상이어야 합니다");
        }
        long amount = Math.multiplyExact(session.getRatePerMinute(), (long) additionalMinutes);
        reserve(balance, amount, now);

        session.setAuthorizedMinutes(session.getAuthorizedMinutes() + additionalMinutes);
        session.setAuthorizedAmount(session.getAuthorizedAmount() + amount);
        return amount;
    }

    /**
     * 참여자 요청에 의한 세션 종료 및 정산
     * 미과금 예치금은 가용 잔액으로 환불하고, 과금액이 있으면 정산 기록을 정확히 한 번 생성한다.
     * 이미 종료된 세션이면 아무것도 하지 않는다.
     *
     * @throws UnauthorizedParticipantException 참여자가 아닌 사용자 (SYSTEM_ACTOR 포함)
     */
    public EndOutcome end(MeteredSession session, ClientBalance balance, ReaderBalance readerBalance,
                          EndReason reason, String endedBy, Instant now) {
        if (session.isTerminal()) {
            return EndOutcome.alreadyEnded(session, null);
        }
        if (!session.isParticipant(endedBy)) {
            throw new UnauthorizedParticipantException("세션 참여자만 종료할 수 있습니다");
        }
        EndReason reported = reason != null && reason.isParticipantReportable() ? reason : EndReason.NORMAL;
        return settle(session, balance, readerBalance, reported, endedBy, now);
    }

    /**
     * 서버 판단에 의한 세션 종료 (liveness 만료, 잔액 소진)
     * 종료 주체는 SYSTEM_ACTOR 로 기록된다.
     */
    public EndOutcome endBySystem(MeteredSession session, ClientBalance balance, ReaderBalance readerBalance,
                                  EndReason reason, Instant now) {
        if (session.isTerminal()) {
            return EndOutcome.alreadyEnded(session, null);
        }
        return settle(session, balance, readerBalance, reason, SYSTEM_ACTOR, now);
    }

    private EndOutcome settle(MeteredSession session, ClientBalance balance, ReaderBalance readerBalance,
                              EndReason reason, String endedBy, Instant now) {
        long refund = session.getUnbilledAmount();
        if (balance.getLocked() < refund) {
            throw new IllegalStateException(String.format(
                    "예치 금액이 환불액보다 작습니다: sessionId=%s, locked=%d, refund=%d",
                    session.getId(), balance.getLocked(), refund));
        }

        balance.setLocked(balance.getLocked() - refund);
        balance.setAvailable(balance.getAvailable() + refund);
        balance.setUpdatedAt(now);

        SettlementRecord settlement = null;
        if (session.getBilledAmount() > 0) {
            settlement = settlementPolicy.settleSession(session.getId(), session.getClientId(), readerBalance,
                    session.getBilledAmount(), now);
        }

        session.setStatus(session.getBilledAmount() > 0 ? SessionStatus.COMPLETED : SessionStatus.CANCELLED);
        session.setEndedAt(now);
        session.setEndReason(reason != null ? reason : EndReason.NORMAL);
        session.setEndedBy(endedBy);

        return new EndOutcome(session, refund, settlement, false, balance);
    }

    public static String roomIdOf(String sessionId) {
        return "session:" + sessionId;
    }

    static long elapsedMinutes(Instant startedAt, Instant now) {
        long millis = Duration.between(startedAt, now).toMillis();
        return millis <= 0 ? 0L : Math.floorDiv(millis, MILLIS_PER_MINUTE);
    }

    private void reserve(ClientBalance balance, long amount, Instant now) {
        if (balance.getAvailable() < amount) {
            throw new InsufficientFundsException(amount, balance.getAvailable());
        }
        balance.setAvailable(balance.getAvailable() - amount);
        balance.setLocked(balance.getLocked() + amount);
        balance.setUpdatedAt(now);
    }

    private void requireNotTerminal(MeteredSession session) {
        if (session.isTerminal()) {
            throw new SessionAlreadyTerminalException(session.getId(), session.getStatus());
        }
    }
}
