package com.kb.metering.service;

import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.exception.SessionAlreadyTerminalException;
import com.kb.metering.exception.UnauthorizedParticipantException;
import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.HubConnection;
import com.kb.metering.hub.RoomChange;
import com.kb.metering.hub.SignalingRelay;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.entity.SessionStatus;
import com.kb.metering.model.message.outbound.ParticipantPresenceMessage;
import com.kb.metering.model.message.outbound.SessionJoinedMessage;
import com.kb.metering.util.ServerInstanceIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * 세션 룸 서비스
 *
 * 세션 룸 입장/퇴장과 참여자 프레즌스를 처리한다.
 * 같은 세션 ID로 다시 입장한 연결은 재인증 없이 기존 참여자의 재개로 취급하며,
 * 연결이 끊겨도 세션은 종료하지 않는다 (종료는 상태 머신과 liveness 점검이 결정).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRoomService {

    private final ConnectionHub hub;
    private final SignalingRelay signalingRelay;
    private final MeteredSessionService sessionService;
    private final BillingHeartbeatDriver billingDriver;
    private final ChatFanoutService chatFanoutService;
    private final RedisPresenceManager presenceManager;
    private final ServerInstanceIdGenerator serverInstanceIdGenerator;

    /**
     * 세션 룸 입장 (참여자만)
     */
    public Mono<SessionJoinedMessage> join(HubConnection connection, String sessionId) {
        if (!connection.isAuthenticated()) {
            return Mono.error(new UnauthorizedParticipantException("로그인한 사용자만 세션에 입장할 수 있습니다"));
        }
        String userId = connection.getUserId();

        return sessionService.findSession(sessionId, userId)
                .flatMap(session -> {
                    if (session.isTerminal()) {
                        return Mono.error(new SessionAlreadyTerminalException(sessionId, session.getStatus()));
                    }
                    RoomChange change = hub.joinRoom(connection.getId(), session.getRoomId());
                    signalingRelay.register(session);
                    boolean resumed = session.getStatus() == SessionStatus.ACTIVE;
                    log.info("세션 룸 입장: sessionId={}, userId={}, connectionId={}, resumed={}, roomSize={}",
                            sessionId, userId, connection.getId(), resumed, change.getRoomSize());

                    return presenceManager.recordJoin(session.getRoomId(), userId, serverId())
                            .doOnError(error -> log.warn("세션 룸 입장 프레즌스 기록 실패: roomId={}, error={}",
                                    session.getRoomId(), error.getMessage()))
                            .onErrorComplete()
                            .then(Mono.defer(() -> afterJoin(connection, session, change, resumed)));
                });
    }

    /**
     * 세션 룸 퇴장 (세션은 유지)
     */
    public void leave(HubConnection connection, String sessionId) {
        RoomChange change = hub.leaveRoom(connection.getId(), SessionStateMachine.roomIdOf(sessionId));
        afterLeave(change);
    }

    /**
     * 퇴장/연결 끊김 공통 처리: 프레즌스 갱신과 상대방 알림
     */
    public void afterLeave(RoomChange change) {
        if (!change.isChanged() || change.getUserId() == null) {
            return;
        }
        boolean userStillPresent = change.getOtherUserConnections() > 0;
        String sessionId = change.getRoomId().substring(ConnectionHub.SESSION_ROOM_PREFIX.length());
        log.info("세션 룸 퇴장: sessionId={}, userId={}, connectionId={}, roomSize={}",
                sessionId, change.getUserId(), change.getConnectionId(), change.getRoomSize());

        if (!userStillPresent) {
            hub.broadcast(change.getRoomId(), ParticipantPresenceMessage.left(sessionId, change.getUserId(),
                    hub.userIdsInRoom(change.getRoomId()).size()), null);
        }
        presenceManager.recordLeave(change.getRoomId(), change.getUserId(), serverId(),
                        userStillPresent, change.getRoomSize() == 0)
                .doOnError(error -> log.warn("세션 룸 퇴장 프레즌스 기록 실패: roomId={}, error={}",
                        change.getRoomId(), error.getMessage()))
                .onErrorComplete()
                .subscribe();
    }

    private Mono<SessionJoinedMessage> afterJoin(HubConnection connection, MeteredSession session,
                                                 RoomChange change, boolean resumed) {
        String roomId = session.getRoomId();
        int participantCount = hub.userIdsInRoom(roomId).size();

        SessionJoinedMessage joined = SessionJoinedMessage.builder()
                .sessionId(session.getId())
                .roomId(roomId)
                .status(session.getStatus().getCode())
                .billedMinutes(session.getBilledMinutes())
                .billedAmount(session.getBilledAmount())
                .remainingMinutes(session.getRemainingMinutes())
                .participantCount(participantCount)
                .resumed(resumed)
                .build();
        hub.sendToConnection(connection.getId(), joined);
        chatFanoutService.replayHistory(connection.getId(), roomId);

        if (change.isChanged() && change.getOtherUserConnections() == 0) {
            hub.broadcast(roomId, ParticipantPresenceMessage.joined(session.getId(), connection.getUserId(),
                    participantCount), connection.getId());
        }

        if (resumed) {
            billingDriver.startReconciliation(session.getId());
            return Mono.just(joined);
        }
        return presenceManager.areAllPresent(roomId, session.getClientId(), session.getReaderId())
                .doOnError(error -> log.warn("프레즌스 조회 실패, 로컬 참여자 수로 판단: roomId={}, error={}",
                        roomId, error.getMessage()))
                .onErrorReturn(participantCount >= 2)
                .flatMap(allPresent -> allPresent
                        ? billingDriver.activate(session.getId(), connection.getUserId()).thenReturn(joined)
                        : Mono.just(joined));
    }

    private String serverId() {
        return serverInstanceIdGenerator.getServerInstanceId();
    }
}
