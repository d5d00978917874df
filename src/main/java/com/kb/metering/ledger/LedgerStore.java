package com.kb.metering.ledger;

import com.kb.metering.model.entity.ClientBalance;
import com.kb.metering.model.entity.Livestream;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.ReaderBalance;
import com.kb.metering.model.entity.ReaderProfile;
import com.kb.metering.model.entity.SettlementRecord;
import reactor.core.publisher.Mono;

/**
 * 원장 저장소
 * 잔액/세션/정산 문서의 조회와 원자적 일괄 저장 계약
 */
public interface LedgerStore {

    Mono<MeteredSession> findSession(String sessionId);

    /**
     * 고객 잔액 조회. 문서가 없으면 0 잔액 (저장 시 생성)
     */
    Mono<ClientBalance> loadClientBalance(String clientId);

    /**
     * 리더 지급 잔액 조회. 문서가 없으면 0 잔액 (저장 시 생성)
     */
    Mono<ReaderBalance> loadReaderBalance(String readerId);

    Mono<SettlementRecord> findSettlement(String sourceReference);

    Mono<ReaderProfile> findReaderProfile(String readerId);

    Mono<Livestream> findLivestream(String livestreamId);

    /**
     * 변경 묶음을 하나의 트랜잭션으로 저장
     * 버전 충돌 시 OptimisticLockingFailureException, 원천 중복 정산 시 DuplicateKeyException
     */
    Mono<Void> commit(LedgerChange change);
}
