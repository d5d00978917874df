package com.kb.metering.service;

import com.kb.metering.config.MeteringProperties;
import com.kb.metering.ledger.LedgerChange;
import com.kb.metering.ledger.LedgerStore;
import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.ReaderBalance;
import com.kb.metering.repository.ReaderBalanceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * BalanceService 테스트
 *
 * 테스트 범위:
 * - 잔액 조회 (리더 지급 잔액 포함)
 * - 충전 입금 및 쓰기 충돌 재시도
 * - 리더 지급 처리
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("BalanceService 잔액 테스트")
class BalanceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private LedgerStore ledgerStore;

    @Mock
    private ReaderBalanceRepository readerBalanceRepository;

    private BalanceService balanceService;

    @BeforeEach
    void setUp() {
        balanceService = new BalanceService(ledgerStore, readerBalanceRepository, Clock.fixed(NOW, ZoneOffset.UTC),
                new MeteringProperties());
    }

    @Test
    @DisplayName("잔액 조회 - 리더 잔액 문서가 있으면 지급 예정 금액 포함")
    void getBalance_IncludesReaderBalance() {
        // Given
        when(ledgerStore.loadClientBalance("reader-1")).thenReturn(Mono.just(ClientBalance.empty("reader-1")));
        when(readerBalanceRepository.findById("reader-1")).thenReturn(Mono.just(
                ReaderBalance.builder().readerId("reader-1").payable(210L).lifetimeEarnings(900L).build()));

        // When & Then
        StepVerifier.create(balanceService.getBalance("reader-1"))
                .assertNext(response -> {
                    assertThat(response.getUserId()).isEqualTo("reader-1");
                    assertThat(response.getAvailable()).isZero();
                    assertThat(response.getPayable()).isEqualTo(210L);
                    assertThat(response.getLifetimeEarnings()).isEqualTo(900L);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("잔액 조회 - 고객만 있으면 지급 항목은 비어 있음")
    void getBalance_ClientOnly() {
        // Given
        when(ledgerStore.loadClientBalance("client-1")).thenReturn(Mono.just(
                ClientBalance.builder().clientId("client-1").available(700L).locked(300L).build()));
        when(readerBalanceRepository.findById("client-1")).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(balanceService.getBalance("client-1"))
                .assertNext(response -> {
                    assertThat(response.getAvailable()).isEqualTo(700L);
                    assertThat(response.getLocked()).isEqualTo(300L);
                    assertThat(response.getPayable()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("충전 - 쓰기 충돌 시 새로 읽어서 다시 입금")
    void creditTopUp_RetriesOnConflict() {
        // Given
        when(ledgerStore.loadClientBalance("client-1"))
                .thenReturn(Mono.just(ClientBalance.builder().clientId("client-1").available(100L).build()))
                .thenReturn(Mono.just(ClientBalance.builder().clientId("client-1").available(150L).build()));
        when(ledgerStore.commit(any(LedgerChange.class)))
                .thenReturn(Mono.error(new OptimisticLockingFailureException("version mismatch")))
                .thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(balanceService.creditTopUp("client-1", 1000L))
                .assertNext(balance -> {
                    assertThat(balance.getAvailable()).isEqualTo(1150L);
                    assertThat(balance.getLastTopUpAmount()).isEqualTo(1000L);
                    assertThat(balance.getLastTopUpAt()).isEqualTo(NOW);
                })
                .verifyComplete();

        verify(ledgerStore, times(2)).commit(any(LedgerChange.class));
    }

    @Test
    @DisplayName("충전 - 0 이하 금액은 거부")
    void creditTopUp_NonPositiveAmount() {
        StepVerifier.create(balanceService.creditTopUp("client-1", 0L))
                .expectError(IllegalArgumentException.class)
                .verify();

        verifyNoInteractions(ledgerStore);
    }

    @Test
    @DisplayName("지급 - 지급 예정 금액을 0으로 만들고 누적 수익은 유지")
    void settlePayout_ClearsPayable() {
        // Given
        when(ledgerStore.loadReaderBalance("reader-1")).thenReturn(Mono.just(
                ReaderBalance.builder().readerId("reader-1").payable(210L).lifetimeEarnings(900L).build()));
        when(ledgerStore.commit(any(LedgerChange.class))).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(balanceService.settlePayout("reader-1"))
                .assertNext(reader -> {
                    assertThat(reader.getPayable()).isZero();
                    assertThat(reader.getLifetimeEarnings()).isEqualTo(900L);
                    assertThat(reader.getLastPayoutAt()).isEqualTo(NOW);
                })
                .verifyComplete();

        ArgumentCaptor<LedgerChange> captor = ArgumentCaptor.forClass(LedgerChange.class);
        verify(ledgerStore).commit(captor.capture());
        assertThat(captor.getValue().getClientBalance()).isNull();
    }

    @Test
    @DisplayName("지급 - 지급할 금액이 없으면 저장하지 않음")
    void settlePayout_NothingToPay() {
        // Given
        when(ledgerStore.loadReaderBalance("reader-1")).thenReturn(Mono.just(ReaderBalance.empty("reader-1")));

        // When & Then
        StepVerifier.create(balanceService.settlePayout("reader-1"))
                .expectNextCount(1)
                .verifyComplete();

        verify(ledgerStore, never()).commit(any());
    }
}
