package com.kb.metering.service;

import com.kb.metering.config.MeteringProperties;
import com.kb.metering.util.ServerInstanceIdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 세션 타이머 스케줄러
 *
 * 세션별 재조정 타이머는 Redis 분산 락을 획득한 서버 하나만 실행한다.
 * 잔액 부족 카운트다운은 경고를 보낸 서버에서만 로컬로 실행한다.
 */
@Service
@Slf4j
public class SessionTimerScheduler {

    private static final String LOCK_KEY_PREFIX = "metering:session:timer:lock:";

    private final TaskScheduler taskScheduler;
    private final ReactiveRedisTemplate<String, String> stringRedisTemplate;
    private final ServerInstanceIdGenerator serverInstanceIdGenerator;
    private final Duration reconciliationInterval;
    private final Duration lockTtl;

    // 세션 ID -> 재조정 작업 (이 서버가 락을 가진 세션들)
    private final ConcurrentHashMap<String, ScheduledFuture<?>> reconciliations = new ConcurrentHashMap<>();

    // 세션 ID -> 잔액 부족 카운트다운
    private final ConcurrentHashMap<String, ScheduledFuture<?>> countdowns = new ConcurrentHashMap<>();

    public SessionTimerScheduler(@Qualifier("sessionTaskScheduler") TaskScheduler taskScheduler,
                                 ReactiveRedisTemplate<String, String> stringRedisTemplate,
                                 ServerInstanceIdGenerator serverInstanceIdGenerator,
                                 MeteringProperties properties) {
        this.taskScheduler = taskScheduler;
        this.stringRedisTemplate = stringRedisTemplate;
        this.serverInstanceIdGenerator = serverInstanceIdGenerator;
        this.reconciliationInterval = properties.getHeartbeat().getReconciliationInterval();
        // 재조정 주기마다 갱신되며, 서버가 죽으면 만료되어 다른 서버가 인수
        this.lockTtl = reconciliationInterval.multipliedBy(3);
    }

    /**
     * 세션 재조정 타이머 등록 (분산 락 획득 시에만)
     *
     * @param sessionId 세션 ID
     * @param task 주기마다 실행할 재조정 작업
     * @return 이 서버가 타이머를 맡았는지
     */
    public Mono<Boolean> scheduleReconciliation(String sessionId, Runnable task) {
        if (reconciliations.containsKey(sessionId)) {
            return Mono.just(true);
        }
        return tryAcquireLock(sessionId)
                .doOnNext(acquired -> {
                    if (acquired) {
                        doScheduleReconciliation(sessionId, task);
                    } else {
                        log.debug("세션 타이머 락 획득 실패 (다른 서버에서 처리 중): sessionId={}", sessionId);
                    }
                });
    }

    /**
     * 잔액 부족 카운트다운 시작. 이미 진행 중이면 기존 카운트다운 유지
     *
     * @return 새로 시작했으면 true
     */
    public boolean scheduleCountdown(String sessionId, Duration grace, Runnable onExpire) {
        boolean[] started = new boolean[1];
        // 동시 호출 시에도 세션당 카운트다운은 맵에 등록된 하나뿐
        countdowns.compute(sessionId, (id, existing) -> {
            if (existing != null && !existing.isDone()) {
                return existing;
            }
            started[0] = true;
            return taskScheduler.schedule(
                    () -> {
                        countdowns.remove(sessionId);
                        runSafely("잔액 부족 카운트다운", sessionId, onExpire);
                    },
                    Instant.now().plus(grace));
        });
        if (!started[0]) {
            log.debug("잔액 부족 카운트다운 진행 중: sessionId={}", sessionId);
            return false;
        }
        log.info("잔액 부족 카운트다운 시작: sessionId={}, graceSeconds={}", sessionId, grace.getSeconds());
        return true;
    }

    /**
     * 카운트다운 취소 (연장 성공 시)
     *
     * @return 진행 중이던 카운트다운이 있었으면 true
     */
    public boolean cancelCountdown(String sessionId) {
        ScheduledFuture<?> countdown = countdowns.remove(sessionId);
        if (countdown == null) {
            return false;
        }
        boolean cancelled = countdown.cancel(false);
        log.info("잔액 부족 카운트다운 취소: sessionId={}, cancelled={}", sessionId, cancelled);
        return true;
    }

    /**
     * 세션의 모든 타이머 취소 및 락 해제 (세션 종료 시, 정산 전에 호출)
     */
    public void cancel(String sessionId) {
        cancelCountdown(sessionId);
        ScheduledFuture<?> reconciliation = reconciliations.remove(sessionId);
        if (reconciliation != null) {
            reconciliation.cancel(false);
            log.info("세션 재조정 타이머 취소: sessionId={}", sessionId);
            releaseLock(sessionId);
        }
    }

    public int getScheduledSessionCount() {
        return reconciliations.size();
    }

    public int getCountdownCount() {
        return countdowns.size();
    }

    public boolean isReconciling(String sessionId) {
        ScheduledFuture<?> task = reconciliations.get(sessionId);
        return task != null && !task.isDone();
    }

    public boolean hasCountdown(String sessionId) {
        ScheduledFuture<?> task = countdowns.get(sessionId);
        return task != null && !task.isDone();
    }

    /**
     * 모든 타이머 및 락 정리 (서버 종료 시). 세션은 종료하지 않음
     */
    public void cancelAll() {
        log.info("모든 세션 타이머 및 락 정리 시작: 재조정 {}개, 카운트다운 {}개",
                reconciliations.size(), countdowns.size());

        countdowns.forEach((sessionId, task) -> task.cancel(false));
        countdowns.clear();

        reconciliations.forEach((sessionId, task) -> {
            task.cancel(false);
            releaseLock(sessionId);
        });
        reconciliations.clear();
        log.info("모든 세션 타이머 및 락 정리 완료");
    }

    private void doScheduleReconciliation(String sessionId, Runnable task) {
        Instant firstRun = Instant.now().plus(reconciliationInterval);
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(
                () -> {
                    refreshLock(sessionId);
                    runSafely("세션 재조정", sessionId, task);
                },
                firstRun,
                reconciliationInterval);

        ScheduledFuture<?> previous = reconciliations.put(sessionId, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("세션 재조정 타이머 등록: sessionId={}, interval={}초, 총 타이머 수={}",
                sessionId, reconciliationInterval.getSeconds(), reconciliations.size());
    }

    private void runSafely(String name, String sessionId, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("{} 실행 중 예외 발생: sessionId={}", name, sessionId, e);
        }
    }

    private Mono<Boolean> tryAcquireLock(String sessionId) {
        String serverId = serverInstanceIdGenerator.getServerInstanceId();
        return stringRedisTemplate.opsForValue()
                .setIfAbsent(LOCK_KEY_PREFIX + sessionId, serverId, lockTtl)
                .flatMap(acquired -> acquired
                        ? Mono.just(true)
                        // 재시작 전 같은 서버가 잡았던 락이면 다시 사용
                        : stringRedisTemplate.opsForValue().get(LOCK_KEY_PREFIX + sessionId)
                                .map(serverId::equals)
                                .defaultIfEmpty(false))
                .doOnNext(acquired -> log.debug("세션 타이머 락: sessionId={}, serverId={}, acquired={}",
                        sessionId, serverId, acquired))
                .onErrorResume(error -> {
                    log.error("세션 타이머 락 획득 오류: sessionId={}, error={}", sessionId, error.getMessage(), error);
                    return Mono.just(false);
                });
    }

    private void refreshLock(String sessionId) {
        stringRedisTemplate.expire(LOCK_KEY_PREFIX + sessionId, lockTtl)
                .doOnError(error -> log.warn("세션 타이머 락 갱신 실패: sessionId={}, error={}",
                        sessionId, error.getMessage()))
                .onErrorReturn(false)
                .subscribe();
    }

    private void releaseLock(String sessionId) {
        stringRedisTemplate.delete(LOCK_KEY_PREFIX + sessionId)
                .doOnNext(deleted -> log.debug("세션 타이머 락 해제: sessionId={}, deleted={}", sessionId, deleted))
                .doOnError(error -> log.error("세션 타이머 락 해제 실패: sessionId={}, error={}",
                        sessionId, error.getMessage(), error))
                .onErrorReturn(0L)
                .subscribe();
    }
}
