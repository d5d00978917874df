package com.kb.metering.ledger;

import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.Livestream;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.ReaderBalance;
import com.kb.metering.model.entity.ReaderProfile;
import com.kb.metering.model.entity.SettlementRecord;
import com.kb.metering.repository.ClientBalanceRepository;
import com.kb.metering.repository.GiftTransactionRepository;
import com.kb.metering.repository.LivestreamRepository;
import com.kb.metering.repository.MeteredSessionRepository;
import com.kb.metering.repository.ReaderBalanceRepository;
import com.kb.metering.repository.ReaderProfileRepository;
import com.kb.metering.repository.SettlementRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB 원장 저장소
 * 여러 문서 저장을 TransactionalOperator 로 묶고, 문서별 @Version 으로 동시 수정을 감지
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoLedgerStore implements LedgerStore {

    private final MeteredSessionRepository sessionRepository;
    private final ClientBalanceRepository clientBalanceRepository;
    private final ReaderBalanceRepository readerBalanceRepository;
    private final SettlementRecordRepository settlementRepository;
    private final GiftTransactionRepository giftTransactionRepository;
    private final LivestreamRepository livestreamRepository;
    private final ReaderProfileRepository readerProfileRepository;
    private final TransactionalOperator ledgerTransactionalOperator;

    @Override
    public Mono<MeteredSession> findSession(String sessionId) {
        return sessionRepository.findById(sessionId);
    }

    @Override
    public Mono<ClientBalance> loadClientBalance(String clientId) {
        return clientBalanceRepository.findById(clientId)
                .defaultIfEmpty(ClientBalance.empty(clientId));
    }

    @Override
    public Mono<ReaderBalance> loadReaderBalance(String readerId) {
        return readerBalanceRepository.findById(readerId)
                .defaultIfEmpty(ReaderBalance.empty(readerId));
    }

    @Override
    public Mono<SettlementRecord> findSettlement(String sourceReference) {
        return settlementRepository.findBySourceReference(sourceReference);
    }

    @Override
    public Mono<ReaderProfile> findReaderProfile(String readerId) {
        return readerProfileRepository.findById(readerId);
    }

    @Override
    public Mono<Livestream> findLivestream(String livestreamId) {
        return livestreamRepository.findById(livestreamId);
    }

    @Override
    public Mono<Void> commit(LedgerChange change) {
        List<Mono<?>> writes = new ArrayList<>();
        // 정산 기록을 먼저 저장하여 원천 중복 시 다른 문서가 저장되기 전에 실패
        if (change.getSettlement() != null) {
            writes.add(settlementRepository.save(change.getSettlement()));
        }
        if (change.getGiftTransaction() != null) {
            writes.add(giftTransactionRepository.save(change.getGiftTransaction()));
        }
        if (change.getClientBalance() != null) {
            writes.add(clientBalanceRepository.save(change.getClientBalance()));
        }
        if (change.getReaderBalance() != null) {
            writes.add(readerBalanceRepository.save(change.getReaderBalance()));
        }
        if (change.getSession() != null) {
            writes.add(sessionRepository.save(change.getSession()));
        }
        if (change.getLivestream() != null) {
            writes.add(livestreamRepository.save(change.getLivestream()));
        }

        return Flux.concat(writes)
                .then()
                .as(ledgerTransactionalOperator::transactional)
                .doOnError(error -> log.warn("원장 커밋 실패: sessionId={}, error={}",
                        change.getSession() != null ? change.getSession().getId() : null, error.getMessage()));
    }
}
