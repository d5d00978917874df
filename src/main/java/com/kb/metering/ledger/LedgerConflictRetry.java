package com.kb.metering.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * 원장 쓰기 충돌 재시도 정책
 * 재시도되는 연산은 매 시도마다 문서를 다시 읽어야 한다 (Mono.defer 안에서 조회)
 */
@Slf4j
public final class LedgerConflictRetry {

    private static final Duration MIN_BACKOFF = Duration.ofMillis(25);

    private LedgerConflictRetry() {
    }

    public static Retry conflicts(int maxRetries) {
        return Retry.backoff(maxRetries, MIN_BACKOFF)
                .filter(LedgerConflictRetry::isConflict)
                .doBeforeRetry(signal -> log.debug("원장 쓰기 충돌 재시도: attempt={}, error={}",
                        signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public static boolean isConflict(Throwable error) {
        return error instanceof OptimisticLockingFailureException || error instanceof DuplicateKeyException;
    }
}
