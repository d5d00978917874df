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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SessionStateMachine 과금 로직 테스트
 *
 * 테스트 범위:
 * - 예치 승인과 잔액 부족
 * - 분 경계 과금과 중복 하트비트
 * - 연장 권한과 잔액 이동
 * - 종료 환불 및 정산 (중복 종료 포함)
 */
@DisplayName("SessionStateMachine 과금 로직 테스트")
class SessionStateMachineTest {

    private static final String CLIENT_ID = "client-1";
    private static final String READER_ID = "reader-1";
    private static final String SESSION_ID = "session-1";
    private static final long RATE = 100L;

    private SessionStateMachine stateMachine;
    private ClientBalance clientBalance;
    private ReaderBalance readerBalance;
    private Instant start;

    @BeforeEach
    void setUp() {
        stateMachine = new SessionStateMachine(new SettlementPolicy(new RevenueSplit(70), new RevenueSplit(70)));
        clientBalance = ClientBalance.builder().clientId(CLIENT_ID).available(1000L).build();
        readerBalance = ReaderBalance.empty(READER_ID);
        start = Instant.parse("2026-01-01T10:00:00Z");
    }

    @Test
    @DisplayName("예치 승인 - 요금 x 시간만큼 가용 잔액에서 locked 로 이동")
    void authorize_ReservesFunds() {
        // When
        MeteredSession session = authorize(5);

        // Then
        assertThat(clientBalance.getAvailable()).isEqualTo(500L);
        assertThat(clientBalance.getLocked()).isEqualTo(500L);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.INITIALIZED);
        assertThat(session.getAuthorizedAmount()).isEqualTo(500L);
        assertThat(session.getRoomId()).isEqualTo("session:" + SESSION_ID);
    }

    @Test
    @DisplayName("예치 승인 - 잔액 부족 시 필요/가용 금액을 담아 실패하고 잔액은 그대로")
    void authorize_InsufficientFunds() {
        // When & Then
        assertThatThrownBy(() -> authorize(12))
                .isInstanceOf(InsufficientFundsException.class)
                .satisfies(error -> {
                    InsufficientFundsException insufficient = (InsufficientFundsException) error;
                    assertThat(insufficient.getRequired()).isEqualTo(1200L);
                    assertThat(insufficient.getAvailable()).isEqualTo(1000L);
                });

        assertThat(clientBalance.getAvailable()).isEqualTo(1000L);
        assertThat(clientBalance.getLocked()).isZero();
    }

    @Test
    @DisplayName("예치 승인 - 자기 자신과의 세션은 거부")
    void authorize_SelfSessionRejected() {
        // When & Then
        assertThatThrownBy(() -> stateMachine.authorize(SESSION_ID, clientBalance, CLIENT_ID, SessionKind.TEXT,
                RATE, 5, start))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(clientBalance.getAvailable()).isEqualTo(1000L);
    }

    @Test
    @DisplayName("전체 흐름 - 3분 과금 후 종료 시 200 환불, 리더 210 / 플랫폼 90 정산")
    void fullSession_BillsRefundsAndSettles() {
        // Given
        MeteredSession session = authorize(5);
        stateMachine.activate(session, start);

        // When
        for (int minute = 1; minute <= 3; minute++) {
            stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(minute)));
        }

        // Then
        assertThat(session.getBilledAmount()).isEqualTo(300L);
        assertThat(session.getBilledMinutes()).isEqualTo(3);
        assertThat(clientBalance.getLocked()).isEqualTo(200L);

        // When
        EndOutcome outcome = stateMachine.end(session, clientBalance, readerBalance, EndReason.NORMAL, CLIENT_ID,
                start.plus(Duration.ofMinutes(3)).plusSeconds(10));

        // Then
        assertThat(outcome.getRefundedAmount()).isEqualTo(200L);
        assertThat(clientBalance.getAvailable()).isEqualTo(700L);
        assertThat(clientBalance.getLocked()).isZero();
        SettlementRecord settlement = outcome.getSettlement();
        assertThat(settlement.getReaderShare()).isEqualTo(210L);
        assertThat(settlement.getPlatformShare()).isEqualTo(90L);
        assertThat(settlement.getSourceReference()).isEqualTo("session:" + SESSION_ID);
        assertThat(readerBalance.getPayable()).isEqualTo(210L);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(session.getEndReason()).isEqualTo(EndReason.NORMAL);
    }

    @Test
    @DisplayName("과금 - 같은 분 경계 안의 중복 호출은 한 번만 과금")
    void tick_DuplicateWithinSameMinute() {
        // Given
        MeteredSession session = authorize(5);
        stateMachine.activate(session, start);
        Instant now = start.plusSeconds(75);

        // When
        TickOutcome first = stateMachine.tick(session, clientBalance, now);
        TickOutcome second = stateMachine.tick(session, clientBalance, now);
        TickOutcome third = stateMachine.tick(session, clientBalance, start.plusSeconds(110));

        // Then
        assertThat(first.getStatus()).isEqualTo(TickOutcome.Status.BILLED);
        assertThat(first.getMinutesBilled()).isEqualTo(1);
        assertThat(second.getStatus()).isEqualTo(TickOutcome.Status.NO_CHANGE);
        assertThat(third.getStatus()).isEqualTo(TickOutcome.Status.NO_CHANGE);
        assertThat(session.getBilledAmount()).isEqualTo(RATE);
        assertThat(clientBalance.getLocked()).isEqualTo(400L);
    }

    @Test
    @DisplayName("과금 - 밀린 여러 분은 한 번에 과금하되 예치 분을 넘지 않음")
    void tick_CatchUpCappedByAuthorization() {
        // Given
        MeteredSession session = authorize(3);
        stateMachine.activate(session, start);

        // When
        TickOutcome outcome = stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(10)));

        // Then
        assertThat(outcome.getMinutesBilled()).isEqualTo(3);
        assertThat(outcome.getRemainingMinutes()).isZero();
        assertThat(outcome.isNeedsMoreFunds()).isTrue();
        assertThat(session.getBilledAmount()).isEqualTo(session.getBilledMinutes() * RATE);
        assertThat(session.getBilledMinutes()).isLessThanOrEqualTo(session.getAuthorizedMinutes());

        // When
        TickOutcome exhausted = stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(11)));

        // Then
        assertThat(exhausted.getStatus()).isEqualTo(TickOutcome.Status.NEEDS_MORE_FUNDS);
        assertThat(session.getBilledMinutes()).isEqualTo(3);
    }

    @Test
    @DisplayName("과금 - 시작 전 세션은 과금하지 않음")
    void tick_NotStarted() {
        // Given
        MeteredSession session = authorize(5);

        // When
        TickOutcome outcome = stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(2)));

        // Then
        assertThat(outcome.getStatus()).isEqualTo(TickOutcome.Status.NOT_STARTED);
        assertThat(clientBalance.getLocked()).isEqualTo(500L);
    }

    @Test
    @DisplayName("연장 - 고객만 가능하고 리더 요청은 거부")
    void extend_OnlyClient() {
        // Given
        MeteredSession session = authorize(5);
        stateMachine.activate(session, start);

        // When & Then
        assertThatThrownBy(() -> stateMachine.extend(session, clientBalance, READER_ID, 2, start))
                .isInstanceOf(UnauthorizedParticipantException.class);

        long reserved = stateMachine.extend(session, clientBalance, CLIENT_ID, 2, start);
        assertThat(reserved).isEqualTo(200L);
        assertThat(session.getAuthorizedMinutes()).isEqualTo(7);
        assertThat(session.getAuthorizedAmount()).isEqualTo(700L);
        assertThat(clientBalance.getAvailable()).isEqualTo(300L);
        assertThat(clientBalance.getLocked()).isEqualTo(700L);
    }

    @Test
    @DisplayName("연장 - 잔액 부족 시 세션과 잔액 모두 변경 없음")
    void extend_InsufficientFundsLeavesStateUntouched() {
        // Given
        MeteredSession session = authorize(5);

        // When & Then
        assertThatThrownBy(() -> stateMachine.extend(session, clientBalance, CLIENT_ID, 6, start))
                .isInstanceOf(InsufficientFundsException.class);
        assertThat(session.getAuthorizedMinutes()).isEqualTo(5);
        assertThat(clientBalance.getAvailable()).isEqualTo(500L);
        assertThat(clientBalance.getLocked()).isEqualTo(500L);
    }

    @Test
    @DisplayName("보존 법칙 - 성공한 승인/과금/연장 동안 available + locked + 과금액 합계 유지")
    void conservation_AcrossAuthorizeTickExtend() {
        // Given
        long total = clientBalance.getAvailable() + clientBalance.getLocked();
        MeteredSession session = authorize(3);
        stateMachine.activate(session, start);

        // When
        stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(2)));
        stateMachine.extend(session, clientBalance, CLIENT_ID, 2, start.plus(Duration.ofMinutes(2)));
        stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(4)));

        // Then
        assertThat(clientBalance.getAvailable() + clientBalance.getLocked() + session.getBilledAmount())
                .isEqualTo(total);
        assertThat(clientBalance.getLocked()).isEqualTo(session.getUnbilledAmount());
    }

    @Test
    @DisplayName("종료 - 과금 없이 종료하면 전액 환불되고 정산 기록 없이 cancelled")
    void end_WithoutBillingCancels() {
        // Given
        MeteredSession session = authorize(5);

        // When
        EndOutcome outcome = stateMachine.end(session, clientBalance, readerBalance, EndReason.CANCELLED,
                READER_ID, start.plusSeconds(30));

        // Then
        assertThat(outcome.getSettlement()).isNull();
        assertThat(outcome.getRefundedAmount()).isEqualTo(500L);
        assertThat(clientBalance.getAvailable()).isEqualTo(1000L);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.CANCELLED);
        assertThat(readerBalance.getPayable()).isZero();
    }

    @Test
    @DisplayName("종료 - 두 번 호출해도 정산은 한 번만 생성")
    void end_Twice_SingleSettlement() {
        // Given
        MeteredSession session = authorize(5);
        stateMachine.activate(session, start);
        stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(2)));

        // When
        EndOutcome first = stateMachine.end(session, clientBalance, readerBalance, EndReason.NORMAL, CLIENT_ID,
                start.plus(Duration.ofMinutes(2)));
        EndOutcome second = stateMachine.end(session, clientBalance, readerBalance, EndReason.NORMAL, READER_ID,
                start.plus(Duration.ofMinutes(3)));

        // Then
        assertThat(first.getSettlement()).isNotNull();
        assertThat(second.isAlreadyEnded()).isTrue();
        assertThat(second.getSettlement()).isNull();
        assertThat(readerBalance.getPayable()).isEqualTo(140L);
        assertThat(clientBalance.getAvailable()).isEqualTo(800L);
        assertThat(session.getEndedBy()).isEqualTo(CLIENT_ID);
    }

    @Test
    @DisplayName("종료 - 참여자가 아니면 거부하고 잔액 변경 없음")
    void end_ByStrangerRejected() {
        // Given
        MeteredSession session = authorize(5);

        // When & Then
        assertThatThrownBy(() -> stateMachine.end(session, clientBalance, readerBalance, EndReason.NORMAL,
                "stranger", start))
                .isInstanceOf(UnauthorizedParticipantException.class);
        assertThat(clientBalance.getLocked()).isEqualTo(500L);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.INITIALIZED);
    }

    @Test
    @DisplayName("종료 - 참여자가 아닌 사용자가 system 을 종료 주체로 보내도 거부")
    void end_SystemActorIdRejectedOnParticipantPath() {
        // Given
        MeteredSession session = authorize(5);
        stateMachine.activate(session, start);

        // When & Then
        assertThatThrownBy(() -> stateMachine.end(session, clientBalance, readerBalance, EndReason.NORMAL,
                SessionStateMachine.SYSTEM_ACTOR, start.plusSeconds(30)))
                .isInstanceOf(UnauthorizedParticipantException.class);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(session.getEndedBy()).isNull();
        assertThat(clientBalance.getLocked()).isEqualTo(500L);
    }

    @Test
    @DisplayName("시스템 종료 - 참여자 검증 없이 종료하고 종료 주체를 system 으로 기록")
    void endBySystem_RecordsSystemActor() {
        // Given
        MeteredSession session = authorize(5);
        stateMachine.activate(session, start);
        stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(1)));

        // When
        EndOutcome outcome = stateMachine.endBySystem(session, clientBalance, readerBalance,
                EndReason.LIVENESS_TIMEOUT, start.plus(Duration.ofMinutes(3)));

        // Then
        assertThat(outcome.isAlreadyEnded()).isFalse();
        assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(session.getEndedBy()).isEqualTo(SessionStateMachine.SYSTEM_ACTOR);
        assertThat(session.getEndReason()).isEqualTo(EndReason.LIVENESS_TIMEOUT);
        assertThat(outcome.getRefundedAmount()).isEqualTo(400L);
    }

    @Test
    @DisplayName("종료 - 참여자는 서버 전용 사유를 기록할 수 없고 normal 로 처리")
    void end_ParticipantCannotReportServerOnlyReason() {
        // Given
        MeteredSession session = authorize(5);

        // When
        stateMachine.end(session, clientBalance, readerBalance, EndReason.LIVENESS_TIMEOUT, CLIENT_ID, start);

        // Then
        assertThat(session.getEndReason()).isEqualTo(EndReason.NORMAL);
        assertThat(session.getEndedBy()).isEqualTo(CLIENT_ID);
    }

    @Test
    @DisplayName("종료된 세션 - 과금/연장은 AlreadyTerminal 예외")
    void terminalSession_RejectsMutations() {
        // Given
        MeteredSession session = authorize(5);
        stateMachine.end(session, clientBalance, readerBalance, EndReason.NORMAL, CLIENT_ID, start);

        // When & Then
        assertThatThrownBy(() -> stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(1))))
                .isInstanceOf(SessionAlreadyTerminalException.class);
        assertThatThrownBy(() -> stateMachine.extend(session, clientBalance, CLIENT_ID, 1, start))
                .isInstanceOf(SessionAlreadyTerminalException.class);
    }

    @Test
    @DisplayName("재접속 - 중단 후 재개해도 lastBilledMinute 기준으로 중복 과금 없음")
    void tick_ResumeAfterGapNoDuplicateCharge() {
        // Given
        MeteredSession session = authorize(5);
        stateMachine.activate(session, start);
        stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(1)).plusSeconds(5));

        // When
        TickOutcome resumed = stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(1)).plusSeconds(50));
        TickOutcome next = stateMachine.tick(session, clientBalance, start.plus(Duration.ofMinutes(2)).plusSeconds(1));

        // Then
        assertThat(resumed.getMinutesBilled()).isZero();
        assertThat(next.getMinutesBilled()).isEqualTo(1);
        assertThat(session.getLastBilledMinute()).isEqualTo(2);
        assertThat(session.getBilledAmount()).isEqualTo(200L);
    }

    private MeteredSession authorize(int minutes) {
        return stateMachine.authorize(SESSION_ID, clientBalance, READER_ID, SessionKind.VOICE, RATE, minutes, start);
    }
}
