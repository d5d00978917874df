package com.kb.metering.repository;

import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.SessionStatus;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * 과금 세션 레포지토리
 */
@Repository
public interface MeteredSessionRepository extends ReactiveMongoRepository<MeteredSession, String> {

    /**
     * 마지막 고객 하트비트가 기준 시각 이전인 세션 조회 (liveness 점검용)
     */
    Flux<MeteredSession> findByStatusAndLastClientHeartbeatAtBefore(SessionStatus status, Instant threshold);

    Flux<MeteredSession> findByStatus(SessionStatus status);
}
