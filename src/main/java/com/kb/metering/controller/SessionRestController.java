package com.kb.metering.controller;

import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.exception.UnauthorizedParticipantException;
import com.kb.metering.model.dto.EndSessionRequest;
import com.kb.metering.model.dto.ExtendResponse;
import com.kb.metering.model.dto.ExtendSessionRequest;
import com.kb.metering.model.dto.HeartbeatRequest;
import com.kb.metering.model.dto.HeartbeatResponse;
import com.kb.metering.model.dto.SessionSnapshot;
import com.kb.metering.model.dto.SessionStartResponse;
import com.kb.metering.model.dto.SettlementSummary;
import com.kb.metering.model.dto.StartSessionRequest;
import com.kb.metering.model.entity.EndReason;
import com.kb.metering.model.entity.SessionEventLog;
import com.kb.metering.service.BillingHeartbeatDriver;
import com.kb.metering.service.MeteredSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 과금 세션 REST API 컨트롤러
 * 사용자 식별은 인증 게이트웨이가 설정하는 X-User-Id 헤더를 사용
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionRestController {

    static final String USER_HEADER = "X-User-Id";

    private final MeteredSessionService sessionService;
    private final BillingHeartbeatDriver billingDriver;

    /**
     * 세션 시작 (잔액 예치)
     *
     * @param userId 고객 ID
     * @param request 리더 ID, 세션 종류, 시간(분)
     * @return 생성된 세션 정보
     */
    @PostMapping("/start")
    public Mono<ResponseEntity<SessionStartResponse>> start(@RequestHeader(USER_HEADER) String userId,
                                                            @Valid @RequestBody StartSessionRequest request) {
        log.info("REST API - 세션 시작 요청: clientId={}, readerId={}, type={}, duration={}분",
                userId, request.getReaderId(), request.getType(), request.getDuration());

        return caller(userId)
                .flatMap(clientId -> sessionService.authorize(clientId, request))
                .map(session -> ResponseEntity.ok(SessionStartResponse.from(session)))
                .doOnSuccess(response -> log.info("REST API - 세션 시작 완료: {}", response.getBody().getSessionId()))
                .doOnError(error -> log.warn("REST API - 세션 시작 실패: clientId={}, error={}", userId, error.getMessage()));
    }

    /**
     * 하트비트 (경과 분 과금)
     */
    @PostMapping("/heartbeat")
    public Mono<ResponseEntity<HeartbeatResponse>> heartbeat(@RequestHeader(USER_HEADER) String userId,
                                                             @Valid @RequestBody HeartbeatRequest request) {
        log.debug("REST API - 하트비트: sessionId={}, userId={}", request.getSessionId(), userId);

        return caller(userId)
                .flatMap(participantId -> billingDriver.heartbeat(request.getSessionId(), participantId))
                .map(tick -> ResponseEntity.ok(HeartbeatResponse.of(tick.getSession(),
                        tick.getOutcome().getMinutesBilled(), tick.getOutcome().isNeedsMoreFunds())));
    }

    /**
     * 세션 연장 (고객만)
     */
    @PostMapping("/extend")
    public Mono<ResponseEntity<ExtendResponse>> extend(@RequestHeader(USER_HEADER) String userId,
                                                       @Valid @RequestBody ExtendSessionRequest request) {
        log.info("REST API - 세션 연장 요청: sessionId={}, userId={}, additionalMinutes={}",
                request.getSessionId(), userId, request.getAdditionalMinutes());

        return caller(userId)
                .flatMap(clientId -> billingDriver.extend(request.getSessionId(), clientId, request.getAdditionalMinutes()))
                .map(extension -> ResponseEntity.ok(ExtendResponse.of(extension.getSession(), extension.getReservedAmount())))
                .doOnError(error -> log.warn("REST API - 세션 연장 실패: sessionId={}, error={}",
                        request.getSessionId(), error.getMessage()));
    }

    /**
     * 세션 종료 및 정산 요약
     */
    @PostMapping("/end")
    public Mono<ResponseEntity<SettlementSummary>> end(@RequestHeader(USER_HEADER) String userId,
                                                       @Valid @RequestBody EndSessionRequest request) {
        log.info("REST API - 세션 종료 요청: sessionId={}, userId={}, reason={}",
                request.getSessionId(), userId, request.getReason());

        return caller(userId)
                .flatMap(participantId -> billingDriver.end(request.getSessionId(), participantId,
                        EndReason.fromParticipant(request.getReason())))
                .map(outcome -> ResponseEntity.ok(SettlementSummary.from(outcome)));
    }

    @GetMapping("/{sessionId}")
    public Mono<ResponseEntity<SessionSnapshot>> getSession(@RequestHeader(USER_HEADER) String userId,
                                                            @PathVariable String sessionId) {
        return caller(userId)
                .flatMap(participantId -> sessionService.findSession(sessionId, participantId))
                .map(session -> ResponseEntity.ok(SessionSnapshot.of(session, sessionService.now())));
    }

    /**
     * 세션 이벤트 이력 (최신순)
     */
    @GetMapping("/{sessionId}/events")
    public Flux<SessionEventLog> getSessionEvents(@RequestHeader(USER_HEADER) String userId,
                                                  @PathVariable String sessionId) {
        log.info("REST API - 세션 이벤트 이력 조회: sessionId={}, userId={}", sessionId, userId);
        return caller(userId)
                .flatMapMany(participantId -> sessionService.findEvents(sessionId, participantId));
    }

    /**
     * 헤더 사용자 ID 검증. 서버 내부 종료 주체(system)는 외부 사용자 ID 로 쓸 수 없다.
     */
    static Mono<String> caller(String userId) {
        if (userId == null || userId.isBlank() || SessionStateMachine.SYSTEM_ACTOR.equalsIgnoreCase(userId.trim())) {
            log.warn("REST API - 사용할 수 없는 사용자 ID: userId={}", userId);
            return Mono.error(new UnauthorizedParticipantException("사용할 수 없는 사용자 ID 입니다"));
        }
        return Mono.just(userId.trim());
    }
}
