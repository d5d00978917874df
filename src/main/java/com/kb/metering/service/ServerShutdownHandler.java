package com.kb.metering.service;

import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.util.ServerInstanceIdGenerator;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * 서버 종료 시 정리 핸들러
 * 이 서버가 맡은 재조정 타이머 락을 풀어 다른 서버가 인수할 수 있게 하고 Redis 프레즌스를 정리한다.
 * 세션 자체는 종료하지 않는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ServerShutdownHandler {

    private static final Duration CLEANUP_TIMEOUT = Duration.ofSeconds(5);

    private final SessionTimerScheduler timerScheduler;
    private final RedisPresenceManager presenceManager;
    private final ConnectionHub hub;
    private final ServerInstanceIdGenerator serverInstanceIdGenerator;

    /**
     * 서버 종료 시 실행되는 정리 작업
     */
    @PreDestroy
    public void onShutdown() {
        String serverId = serverInstanceIdGenerator.getServerInstanceId();
        log.info("서버 종료 시작: serverId={}, connections={}, rooms={}",
                serverId, hub.connectionCount(), hub.roomCount());

        timerScheduler.cancelAll();

        presenceManager.cleanupServer(serverId)
                .timeout(CLEANUP_TIMEOUT)
                .doOnSuccess(unused -> log.info("서버 종료 시 Redis 정리 완료: serverId={}", serverId))
                .doOnError(error -> log.warn("서버 종료 시 Redis 정리 실패 (무시됨): serverId={}, error={}",
                        serverId, error.getMessage()))
                .onErrorComplete()
                .subscribe();
    }
}
