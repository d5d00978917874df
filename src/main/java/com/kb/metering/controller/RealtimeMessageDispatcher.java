package com.kb.metering.controller;

import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.exception.ErrorCode;
import com.kb.metering.exception.MeteringException;
import com.kb.metering.exception.UnauthorizedParticipantException;
import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.HubConnection;
import com.kb.metering.hub.SignalingRelay;
import com.kb.metering.model.entity.EndReason;
import com.kb.metering.model.message.inbound.ChatMessage;
import com.kb.metering.model.message.inbound.ClientMessage;
import com.kb.metering.model.message.inbound.EndSessionMessage;
import com.kb.metering.model.message.inbound.HeartbeatMessage;
import com.kb.metering.model.message.inbound.JoinBroadcastMessage;
import com.kb.metering.model.message.inbound.JoinSessionMessage;
import com.kb.metering.model.message.inbound.LeaveBroadcastMessage;
import com.kb.metering.model.message.inbound.LeaveSessionMessage;
import com.kb.metering.model.message.inbound.SendGiftMessage;
import com.kb.metering.model.message.inbound.SignalMessage;
import com.kb.metering.model.message.outbound.ErrorMessage;
import com.kb.metering.service.BillingHeartbeatDriver;
import com.kb.metering.service.BroadcastRoomService;
import com.kb.metering.service.ChatFanoutService;
import com.kb.metering.service.GiftService;
import com.kb.metering.service.RedisPresenceManager;
import com.kb.metering.service.SessionRoomService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 실시간 메시지 분배기
 *
 * 디코딩된 클라이언트 메시지를 타입별 서비스로 넘긴다.
 * 처리 중 오류는 보낸 연결에만 error 메시지로 돌려주고 룸에는 전파하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeMessageDispatcher {

    private final ConnectionHub hub;
    private final SessionRoomService sessionRoomService;
    private final BroadcastRoomService broadcastRoomService;
    private final ChatFanoutService chatFanoutService;
    private final SignalingRelay signalingRelay;
    private final GiftService giftService;
    private final BillingHeartbeatDriver billingDriver;
    private final RedisPresenceManager presenceManager;

    /**
     * 메시지 처리. 오류는 error 메시지로 바꿔 항상 정상 완료
     */
    public Mono<Void> dispatch(HubConnection connection, ClientMessage message) {
        return Mono.defer(() -> route(connection, message))
                .onErrorResume(error -> {
                    replyError(connection, error);
                    return Mono.empty();
                });
    }

    private Mono<Void> route(HubConnection connection, ClientMessage message) {
        if (message instanceof JoinSessionMessage) {
            return sessionRoomService.join(connection, ((JoinSessionMessage) message).getSessionId()).then();
        }
        if (message instanceof LeaveSessionMessage) {
            sessionRoomService.leave(connection, ((LeaveSessionMessage) message).getSessionId());
            return Mono.empty();
        }
        if (message instanceof JoinBroadcastMessage) {
            return broadcastRoomService.join(connection, ((JoinBroadcastMessage) message).getBroadcastId()).then();
        }
        if (message instanceof LeaveBroadcastMessage) {
            broadcastRoomService.leave(connection, ((LeaveBroadcastMessage) message).getBroadcastId());
            return Mono.empty();
        }
        if (message instanceof ChatMessage) {
            chatFanoutService.post(connection, (ChatMessage) message);
            return Mono.empty();
        }
        if (message instanceof SignalMessage) {
            requireAuthenticated(connection, "시그널링");
            signalingRelay.relay(connection, (SignalMessage) message);
            return Mono.empty();
        }
        if (message instanceof SendGiftMessage) {
            return giftService.send(connection, (SendGiftMessage) message).then();
        }
        if (message instanceof HeartbeatMessage) {
            return heartbeat(connection, (HeartbeatMessage) message);
        }
        if (message instanceof EndSessionMessage) {
            requireAuthenticated(connection, "세션 종료");
            EndSessionMessage end = (EndSessionMessage) message;
            return billingDriver.end(end.getSessionId(), connection.getUserId(), EndReason.fromParticipant(end.getReason())).then();
        }
        log.debug("알 수 없는 메시지 무시: connectionId={}, message={}", connection.getId(), message);
        return Mono.empty();
    }

    private Mono<Void> heartbeat(HubConnection connection, HeartbeatMessage message) {
        requireAuthenticated(connection, "하트비트");
        String roomId = SessionStateMachine.roomIdOf(message.getSessionId());
        return billingDriver.heartbeat(message.getSessionId(), connection.getUserId())
                .flatMap(tick -> presenceManager.refreshRoom(roomId)
                        .then(presenceManager.touchConnection(connection.getId()))
                        .doOnError(error -> log.warn("하트비트 프레즌스 갱신 실패: connectionId={}, error={}",
                                connection.getId(), error.getMessage()))
                        .onErrorComplete())
                .then();
    }

    private void requireAuthenticated(HubConnection connection, String action) {
        if (!connection.isAuthenticated()) {
            throw new UnauthorizedParticipantException("로그인한 사용자만 " + action + " 요청을 할 수 있습니다");
        }
    }

    private void replyError(HubConnection connection, Throwable error) {
        ErrorCode code;
        if (error instanceof MeteringException) {
            code = ((MeteringException) error).getErrorCode();
            log.debug("실시간 요청 거부: connectionId={}, code={}, message={}", connection.getId(), code, error.getMessage());
        } else if (error instanceof IllegalArgumentException) {
            code = ErrorCode.INVALID_REQUEST;
            log.debug("잘못된 실시간 요청: connectionId={}, message={}", connection.getId(), error.getMessage());
        } else {
            log.error("실시간 메시지 처리 중 오류: connectionId={}", connection.getId(), error);
            hub.sendToConnection(connection.getId(), ErrorMessage.builder()
                    .code("INTERNAL_ERROR")
                    .message("서버 내부 오류가 발생했습니다")
                    .build());
            return;
        }
        hub.sendToConnection(connection.getId(), ErrorMessage.builder()
                .code(code.name())
                .message(error.getMessage())
                .build());
    }
}
