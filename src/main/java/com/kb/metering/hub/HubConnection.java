package com.kb.metering.hub;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실시간 연결 핸들
 * 연결별 송신 버퍼는 크기가 고정되어 있으며, 가득 차면 다른 참여자를 막지 않도록 연결을 닫는다.
 */
@Slf4j
public class HubConnection {

    private final String id;
    private final String userId;
    private final Instant connectedAt;
    private final Sinks.Many<String> outbound;
    private final Runnable onOverflow;

    private final AtomicBoolean closed = new AtomicBoolean();

    public HubConnection(String id, String userId, int bufferSize, Runnable onOverflow) {
        this.id = id;
        this.userId = userId;
        this.connectedAt = Instant.now();
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
        this.onOverflow = onOverflow;
    }

    public String getId() {
        return id;
    }

    /**
     * 인증된 사용자 ID (익명 시청자는 null)
     */
    public String getUserId() {
        return userId;
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 송신 프레임을 버퍼에 추가
     *
     * @return 버퍼에 들어갔으면 true
     */
    public boolean offer(String frame) {
        if (closed.get()) {
            return false;
        }
        Sinks.EmitResult result;
        synchronized (this) {
            result = outbound.tryEmitNext(frame);
        }
        if (result.isSuccess()) {
            return true;
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            // 동시에 초과한 송신자가 여럿이어도 종료 콜백은 한 번만
            if (close()) {
                log.warn("송신 버퍼 초과로 연결 종료: connectionId={}, userId={}", id, userId);
                onOverflow.run();
            }
        } else {
            log.debug("프레임 전송 실패: connectionId={}, result={}", id, result);
        }
        return false;
    }

    /**
     * 송신 스트림 (단일 구독)
     */
    public Flux<String> outbound() {
        return outbound.asFlux();
    }

    /**
     * 송신 스트림 종료
     *
     * @return 이 호출이 연결을 닫았으면 true
     */
    public boolean close() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        synchronized (this) {
            outbound.tryEmitComplete();
        }
        return true;
    }
}
