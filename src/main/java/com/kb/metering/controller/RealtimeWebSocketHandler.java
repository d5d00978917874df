package com.kb.metering.controller;

import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.HubConnection;
import com.kb.metering.hub.MessageCodec;
import com.kb.metering.hub.RoomChange;
import com.kb.metering.service.BroadcastRoomService;
import com.kb.metering.service.RedisPresenceManager;
import com.kb.metering.service.SessionRoomService;
import com.kb.metering.util.ServerInstanceIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 실시간 WebSocket 핸들러 (/ws/realtime)
 *
 * 연결마다 허브에 등록하고, 수신 프레임은 순서대로 분배기로 넘기며,
 * 허브의 송신 버퍼를 그대로 WebSocket 으로 내보낸다.
 * 연결이 끊기면 모든 룸에서 제거하지만 세션은 종료하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeWebSocketHandler implements WebSocketHandler {

    static final String USER_ID_PARAM = "userId";

    private final ConnectionHub hub;
    private final MessageCodec codec;
    private final RealtimeMessageDispatcher dispatcher;
    private final SessionRoomService sessionRoomService;
    private final BroadcastRoomService broadcastRoomService;
    private final RedisPresenceManager presenceManager;
    private final ServerInstanceIdGenerator serverInstanceIdGenerator;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = session.getId();
        String userId = resolveUserId(session.getHandshakeInfo());
        HubConnection connection = hub.open(connectionId, userId, () -> session.close(CloseStatus.POLICY_VIOLATION)
                .doOnError(error -> log.warn("버퍼 초과 연결 종료 실패: connectionId={}, error={}",
                        connectionId, error.getMessage()))
                .onErrorComplete()
                .subscribe());
        log.info("WebSocket 연결됨: connectionId={}, userId={}", connectionId, userId);

        presenceManager.recordConnection(connectionId, userId, serverInstanceIdGenerator.getServerInstanceId())
                .doOnError(error -> log.warn("연결 레코드 저장 실패: connectionId={}, error={}", connectionId, error.getMessage()))
                .onErrorComplete()
                .subscribe();

        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(frame -> codec.decode(frame)
                        .map(message -> dispatcher.dispatch(connection, message))
                        .orElseGet(Mono::empty))
                .then()
                .doFinally(signal -> onDisconnect(connectionId, signal.toString()));

        Mono<Void> outbound = session.send(connection.outbound().map(session::textMessage));

        return Mono.zip(inbound, outbound).then();
    }

    /**
     * 연결 해제 처리: 룸별 퇴장 알림과 프레즌스 정리
     */
    void onDisconnect(String connectionId, String signal) {
        List<RoomChange> changes = hub.disconnect(connectionId);
        log.info("WebSocket 연결 해제됨: connectionId={}, signal={}, rooms={}", connectionId, signal, changes.size());

        for (RoomChange change : changes) {
            if (RoomChange.isSessionRoom(change.getRoomId())) {
                sessionRoomService.afterLeave(change);
            } else if (RoomChange.isBroadcastRoom(change.getRoomId())) {
                broadcastRoomService.afterLeave(change);
            }
        }

        presenceManager.removeConnection(connectionId)
                .doOnError(error -> log.warn("연결 레코드 삭제 실패: connectionId={}, error={}", connectionId, error.getMessage()))
                .onErrorComplete()
                .subscribe();
    }

    /**
     * 핸드셰이크 헤더(X-User-Id) 또는 userId 쿼리 파라미터. 둘 다 없으면 익명(null)
     */
    static String resolveUserId(HandshakeInfo handshakeInfo) {
        String header = handshakeInfo.getHeaders().getFirst(SessionRestController.USER_HEADER);
        if (header != null && !header.isBlank()) {
            return acceptable(header.trim());
        }
        String param = UriComponentsBuilder.fromUri(handshakeInfo.getUri())
                .build()
                .getQueryParams()
                .getFirst(USER_ID_PARAM);
        return param != null && !param.isBlank() ? acceptable(param.trim()) : null;
    }

    /**
     * 서버 내부 종료 주체(system)를 사칭한 연결은 익명으로 처리
     */
    private static String acceptable(String userId) {
        if (SessionStateMachine.SYSTEM_ACTOR.equalsIgnoreCase(userId)) {
            log.warn("사용할 수 없는 사용자 ID, 익명으로 연결: userId={}", userId);
            return null;
        }
        return userId;
    }
}
