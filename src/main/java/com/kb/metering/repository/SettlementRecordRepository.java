package com.kb.metering.repository;

import com.kb.metering.model.entity.SettlementRecord;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * 정산 기록 레포지토리
 */
@Repository
public interface SettlementRecordRepository extends ReactiveMongoRepository<SettlementRecord, String> {

    /**
     * 원천 참조로 정산 기록 조회
     * @param sourceReference session:{id} 또는 gift:{txId}
     * @return 정산 기록
     */
    Mono<SettlementRecord> findBySourceReference(String sourceReference);
}
