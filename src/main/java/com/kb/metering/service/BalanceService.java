package com.kb.metering.service;

import com.kb.metering.config.MeteringProperties;
import com.kb.metering.ledger.LedgerChange;
import com.kb.metering.ledger.LedgerConflictRetry;
import com.kb.metering.ledger.LedgerStore;
import com.kb.metering.model.dto.BalanceResponse;
import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.ReaderBalance;
import com.kb.metering.repository.ReaderBalanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * 잔액 서비스
 * 잔액 조회와 외부 결제 경계(충전 입금, 리더 지급)만 담당
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BalanceService {

    private final LedgerStore ledgerStore;
    private final ReaderBalanceRepository readerBalanceRepository;
    private final Clock meteringClock;
    private final MeteringProperties properties;

    /**
     * 사용자 잔액 조회
     * 리더 지급 잔액 문서가 있는 사용자는 payable/lifetimeEarnings 도 포함
     */
    public Mono<BalanceResponse> getBalance(String userId) {
        return ledgerStore.loadClientBalance(userId)
                .zipWith(readerBalanceRepository.findById(userId)
                        .map(reader -> BalanceResponse.builder()
                                .payable(reader.getPayable())
                                .lifetimeEarnings(reader.getLifetimeEarnings()))
                        .defaultIfEmpty(BalanceResponse.builder()))
                .map(tuple -> tuple.getT2()
                        .userId(userId)
                        .available(tuple.getT1().getAvailable())
                        .locked(tuple.getT1().getLocked())
                        .build());
    }

    public Mono<ClientBalance> getClientBalance(String clientId) {
        return ledgerStore.loadClientBalance(clientId);
    }

    /**
     * 충전 금액을 가용 잔액에 입금 (결제 게이트웨이 승인 후 호출)
     */
    public Mono<ClientBalance> creditTopUp(String clientId, long amount) {
        if (amount <= 0) {
            return Mono.error(new IllegalArgumentException("충전 금액은 0보다 커야 합니다: " + amount));
        }
        return Mono.defer(() -> ledgerStore.loadClientBalance(clientId)
                        .flatMap(balance -> {
                            Instant now = meteringClock.instant();
                            balance.setAvailable(Math.addExact(balance.getAvailable(), amount));
                            balance.setLastTopUpAmount(amount);
                            balance.setLastTopUpAt(now);
                            balance.setUpdatedAt(now);
                            return ledgerStore.commit(LedgerChange.builder().clientBalance(balance).build())
                                    .thenReturn(balance);
                        }))
                .retryWhen(LedgerConflictRetry.conflicts(properties.getBilling().getMaxConflictRetries()))
                .doOnSuccess(balance -> log.info("잔액 충전: clientId={}, amount={}, available={}",
                        clientId, amount, balance.getAvailable()))
                .doOnError(error -> log.error("잔액 충전 실패: clientId={}, amount={}", clientId, amount, error));
    }

    /**
     * 리더 지급 처리: 지급 예정 잔액을 0으로 차감
     *
     * @return 지급 후 리더 잔액
     */
    public Mono<ReaderBalance> settlePayout(String readerId) {
        return Mono.defer(() -> ledgerStore.loadReaderBalance(readerId)
                        .flatMap(reader -> {
                            long paid = reader.getPayable();
                            if (paid == 0) {
                                log.debug("지급할 금액 없음: readerId={}", readerId);
                                return Mono.just(reader);
                            }
                            Instant now = meteringClock.instant();
                            reader.setPayable(0L);
                            reader.setLastPayoutAt(now);
                            reader.setUpdatedAt(now);
                            return ledgerStore.commit(LedgerChange.builder().readerBalance(reader).build())
                                    .doOnSuccess(ignored -> log.info("리더 지급 처리: readerId={}, amount={}", readerId, paid))
                                    .thenReturn(reader);
                        }))
                .retryWhen(LedgerConflictRetry.conflicts(properties.getBilling().getMaxConflictRetries()))
                .doOnError(error -> log.error("리더 지급 처리 실패: readerId={}", readerId, error));
    }
}
