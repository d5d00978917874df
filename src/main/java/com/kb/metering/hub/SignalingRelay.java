package com.kb.metering.hub;

import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.exception.UnauthorizedParticipantException;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.message.inbound.SignalMessage;
import com.kb.metering.model.message.outbound.SignalRelayMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 통화 시그널링 중계기
 * 
 * 등록된 세션 룸의 두 참여자 사이에서만 offer/answer/candidate 를 전달한다.
 * payload 는 해석하거나 기록하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignalingRelay {

    private final ConnectionHub hub;

    // 룸 ID -> 참여자 등록 정보
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public void register(MeteredSession session) {
        Registration registration = new Registration(session.getId(), session.getClientId(), session.getReaderId());
        if (registrations.putIfAbsent(session.getRoomId(), registration) == null) {
            log.debug("시그널링 룸 등록: roomId={}", session.getRoomId());
        }
    }

    public void unregister(String roomId) {
        if (registrations.remove(roomId) != null) {
            log.debug("시그널링 룸 해제: roomId={}", roomId);
        }
    }

    public boolean isRegistered(String roomId) {
        return registrations.containsKey(roomId);
    }

    /**
     * 시그널링 메시지를 대상 참여자의 룸 내 연결에만 전달
     *
     * @return 전달된 연결 수
     * @throws UnauthorizedParticipantException 보낸 쪽이 룸 참여자가 아니거나 대상이 상대 참여자가 아님
     */
    public int relay(HubConnection sender, SignalMessage message) {
        String roomId = SessionStateMachine.roomIdOf(message.getSessionId());
        Registration registration = registrations.get(roomId);
        if (registration == null) {
            throw new UnauthorizedParticipantException("시그널링이 열려 있지 않은 세션입니다");
        }
        String senderId = sender.getUserId();
        if (!registration.isParticipant(senderId) || !hub.isMember(sender.getId(), roomId)) {
            log.warn("시그널링 거부 (룸 참여자 아님): roomId={}, connectionId={}, userId={}",
                    roomId, sender.getId(), senderId);
            throw new UnauthorizedParticipantException("세션 룸 참여자가 아닙니다");
        }
        String targetId = message.getTargetId();
        if (!registration.isParticipant(targetId) || targetId.equals(senderId)) {
            log.warn("시그널링 거부 (잘못된 대상): roomId={}, senderId={}, targetId={}", roomId, senderId, targetId);
            throw new UnauthorizedParticipantException("시그널링 대상이 세션 상대방이 아닙니다");
        }

        SignalRelayMessage relayed = SignalRelayMessage.builder()
                .signalType(message.getSignalType())
                .sessionId(registration.sessionId)
                .senderId(senderId)
                .payload(message.getPayload())
                .build();
        int delivered = hub.sendToUserInRoom(roomId, targetId, relayed);
        log.debug("시그널링 중계: roomId={}, type={}, senderId={}, targetId={}, delivered={}",
                roomId, message.getSignalType(), senderId, targetId, delivered);
        return delivered;
    }

    public int registeredRoomCount() {
        return registrations.size();
    }

    private static final class Registration {
        private final String sessionId;
        private final String clientId;
        private final String readerId;

        private Registration(String sessionId, String clientId, String readerId) {
            this.sessionId = sessionId;
            this.clientId = clientId;
            this.readerId = readerId;
        }

        private boolean isParticipant(String userId) {
            return userId != null && (userId.equals(clientId) || userId.equals(readerId));
        }
    }
}
