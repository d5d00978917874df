package com.kb.metering.service;

import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.config.MeteringProperties;
import com.kb.metering.exception.UnauthorizedParticipantException;
import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.HubConnection;
import com.kb.metering.model.message.inbound.ChatMessage;
import com.kb.metering.model.message.outbound.ChatBroadcastMessage;
import com.kb.metering.model.message.outbound.ChatHistoryMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 채팅 전파 서비스
 * 룸 단위 브로드캐스트와 룸별 최근 메시지 버퍼(고정 크기, 오래된 것부터 제거)를 관리
 */
@Slf4j
@Service
public class ChatFanoutService {

    static final int MAX_CONTENT_LENGTH = 2000;

    private final ConnectionHub hub;
    private final int historyLimit;

    private final Map<String, Deque<ChatBroadcastMessage>> histories = new HashMap<>();

    public ChatFanoutService(ConnectionHub hub, MeteringProperties properties) {
        this.hub = hub;
        this.historyLimit = properties.getHub().getChatHistoryLimit();
    }

    /**
     * 클라이언트 채팅 메시지 전파 (보낸 연결 포함 룸 전체)
     *
     * @throws UnauthorizedParticipantException 익명 연결이거나 룸 멤버가 아님
     */
    public ChatBroadcastMessage post(HubConnection sender, ChatMessage message) {
        if (!sender.isAuthenticated()) {
            throw new UnauthorizedParticipantException("로그인한 사용자만 채팅할 수 있습니다");
        }
        String roomId = resolveRoomId(message);
        if (!hub.isMember(sender.getId(), roomId)) {
            throw new UnauthorizedParticipantException("입장하지 않은 룸에는 채팅할 수 없습니다");
        }
        String content = message.getContent() != null ? message.getContent().trim() : "";
        if (content.isEmpty()) {
            throw new IllegalArgumentException("메시지 내용이 비어 있습니다");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new IllegalArgumentException("메시지는 " + MAX_CONTENT_LENGTH + "자를 넘을 수 없습니다");
        }

        ChatBroadcastMessage chat = ChatBroadcastMessage.builder()
                .roomId(roomId)
                .messageId(UUID.randomUUID().toString())
                .senderId(sender.getUserId())
                .content(content)
                .timestamp(Instant.now())
                .build();
        publish(chat);
        log.debug("채팅 전파: roomId={}, senderId={}", roomId, sender.getUserId());
        return chat;
    }

    /**
     * 버퍼에 추가 후 룸 전체에 전파 (선물 채팅 등 서버 생성 메시지 포함)
     * 이 서버에 열린 룸이 없으면 버퍼에 남기지 않는다.
     */
    public int publish(ChatBroadcastMessage chat) {
        if (!hub.hasRoom(chat.getRoomId())) {
            log.debug("열린 룸 없음, 채팅 버퍼 생략: roomId={}", chat.getRoomId());
            return 0;
        }
        synchronized (histories) {
            Deque<ChatBroadcastMessage> history = histories.computeIfAbsent(chat.getRoomId(), key -> new ArrayDeque<>());
            history.addLast(chat);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
        return hub.broadcast(chat.getRoomId(), chat, null);
    }

    /**
     * 새로 입장한 연결에 최근 메시지 재전송
     */
    public void replayHistory(String connectionId, String roomId) {
        List<ChatBroadcastMessage> messages = recentMessages(roomId);
        if (messages.isEmpty()) {
            return;
        }
        hub.sendToConnection(connectionId, ChatHistoryMessage.builder()
                .roomId(roomId)
                .messages(messages)
                .build());
    }

    public int historyRoomCount() {
        synchronized (histories) {
            return histories.size();
        }
    }

    public List<ChatBroadcastMessage> recentMessages(String roomId) {
        synchronized (histories) {
            Deque<ChatBroadcastMessage> history = histories.get(roomId);
            return history == null ? new ArrayList<>() : new ArrayList<>(history);
        }
    }

    /**
     * 룸 버퍼 삭제 (세션 종료, 방송 룸의 마지막 시청자 퇴장)
     */
    public void clearHistory(String roomId) {
        synchronized (histories) {
            histories.remove(roomId);
        }
    }

    private String resolveRoomId(ChatMessage message) {
        if (message.getSessionId() != null && !message.getSessionId().isBlank()) {
            return SessionStateMachine.roomIdOf(message.getSessionId());
        }
        if (message.getBroadcastId() != null && !message.getBroadcastId().isBlank()) {
            return ConnectionHub.broadcastRoomId(message.getBroadcastId());
        }
        throw new IllegalArgumentException("sessionId 또는 broadcastId 가 필요합니다");
    }
}
