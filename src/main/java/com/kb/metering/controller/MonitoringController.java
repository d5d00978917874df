package com.kb.metering.controller;

import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.SignalingRelay;
import com.kb.metering.service.SessionLivenessMonitor;
import com.kb.metering.service.SessionTimerScheduler;
import com.kb.metering.util.ServerInstanceIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 인스턴스 실시간 상태 모니터링 API
 */
@RestController
@RequestMapping("/api/v1/monitoring")
@RequiredArgsConstructor
@Slf4j
public class MonitoringController {

    private final ConnectionHub hub;
    private final SignalingRelay signalingRelay;
    private final SessionTimerScheduler timerScheduler;
    private final SessionLivenessMonitor livenessMonitor;
    private final ServerInstanceIdGenerator serverInstanceIdGenerator;

    /**
     * 이 인스턴스의 연결/룸/타이머 현황
     *
     * @return 현황 정보
     */
    @GetMapping("/realtime")
    public Mono<Map<String, Object>> getRealtimeStatus() {
        return Mono.fromCallable(() -> {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("serverInstanceId", serverInstanceIdGenerator.getServerInstanceId());
            status.put("connections", hub.connectionCount());
            status.put("rooms", hub.roomCount());
            status.put("signalingRooms", signalingRelay.registeredRoomCount());
            status.put("scheduledSessionTimers", timerScheduler.getScheduledSessionCount());
            status.put("pendingCountdowns", timerScheduler.getCountdownCount());
            status.put("timestamp", Instant.now().toString());
            return status;
        });
    }

    /**
     * liveness 점검 수동 실행
     */
    @PostMapping("/liveness-sweep")
    public Mono<Map<String, Object>> runLivenessSweep() {
        log.info("수동 liveness 점검 실행 요청");

        return Mono.fromRunnable(livenessMonitor::sweepStaleSessions)
                .then(Mono.fromCallable(() -> {
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("message", "liveness 점검이 실행되었습니다. 로그를 확인하세요.");
                    result.put("timestamp", Instant.now().toString());
                    return result;
                }));
    }
}
