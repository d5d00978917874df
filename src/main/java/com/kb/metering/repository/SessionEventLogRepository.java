package com.kb.metering.repository;

import com.kb.metering.model.entity.SessionEventLog;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 세션 이벤트 로그 레포지토리
 */
@Repository
public interface SessionEventLogRepository extends ReactiveMongoRepository<SessionEventLog, String> {

    /**
     * 세션별 이벤트 로그 조회 (최신순)
     * @param sessionId 세션 ID
     * @return 이벤트 로그 목록
     */
    Flux<SessionEventLog> findBySessionIdOrderByTimestampDesc(String sessionId);

    Mono<Boolean> existsByEventId(String eventId);
}
