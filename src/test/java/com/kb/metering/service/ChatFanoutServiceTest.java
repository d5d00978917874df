package com.kb.metering.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kb.metering.config.MeteringProperties;
import com.kb.metering.exception.UnauthorizedParticipantException;
import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.HubConnection;
import com.kb.metering.hub.MessageCodec;
import com.kb.metering.model.message.inbound.ChatMessage;
import com.kb.metering.model.message.outbound.ChatBroadcastMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ChatFanoutService 테스트")
class ChatFanoutServiceTest {

    private static final String SESSION_ROOM = "session:s-1";

    private ConnectionHub hub;
    private ChatFanoutService chatFanoutService;
    private HubConnection client;
    private HubConnection reader;

    @BeforeEach
    void setUp() {
        MeteringProperties properties = new MeteringProperties();
        properties.getHub().setChatHistoryLimit(3);
        hub = new ConnectionHub(new MessageCodec(new ObjectMapper()), properties);
        chatFanoutService = new ChatFanoutService(hub, properties);

        client = hub.open("c-1", "client-1", () -> { });
        reader = hub.open("c-2", "reader-1", () -> { });
        hub.joinRoom("c-1", SESSION_ROOM);
        hub.joinRoom("c-2", SESSION_ROOM);
    }

    @Test
    @DisplayName("채팅 - 보낸 연결을 포함한 룸 전체에 전달")
    void post_BroadcastsToWholeRoom() {
        // When
        ChatBroadcastMessage chat = chatFanoutService.post(client, new ChatMessage("s-1", null, "  안녕하세요  "));

        // Then
        assertThat(chat.getContent()).isEqualTo("안녕하세요");
        assertThat(chat.getSenderId()).isEqualTo("client-1");
        assertThat(chat.getRoomId()).isEqualTo(SESSION_ROOM);
        StepVerifier.create(reader.outbound())
                .expectNextMatches(frame -> frame.contains("안녕하세요"))
                .thenCancel()
                .verify();
        StepVerifier.create(client.outbound())
                .expectNextMatches(frame -> frame.contains(chat.getMessageId()))
                .thenCancel()
                .verify();
    }

    @Test
    @DisplayName("채팅 - 최근 메시지 버퍼는 한도를 넘으면 오래된 것부터 제거")
    void post_HistoryIsBounded() {
        // When
        for (int i = 1; i <= 5; i++) {
            chatFanoutService.post(client, new ChatMessage("s-1", null, "message-" + i));
        }

        // Then
        List<String> contents = chatFanoutService.recentMessages(SESSION_ROOM).stream()
                .map(ChatBroadcastMessage::getContent)
                .collect(Collectors.toList());
        assertThat(contents).containsExactly("message-3", "message-4", "message-5");
    }

    @Test
    @DisplayName("채팅 - 빈 내용이나 너무 긴 내용은 거부")
    void post_InvalidContent() {
        String tooLong = "a".repeat(ChatFanoutService.MAX_CONTENT_LENGTH + 1);

        assertThatThrownBy(() -> chatFanoutService.post(client, new ChatMessage("s-1", null, "   ")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chatFanoutService.post(client, new ChatMessage("s-1", null, tooLong)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chatFanoutService.post(client, new ChatMessage(null, null, "hi")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(chatFanoutService.recentMessages(SESSION_ROOM)).isEmpty();
    }

    @Test
    @DisplayName("채팅 - 익명 연결이나 입장하지 않은 룸은 거부")
    void post_Unauthorized() {
        // Given
        HubConnection anonymous = hub.open("c-3", null, () -> { });
        hub.joinRoom("c-3", "live:b-1");

        // When & Then
        assertThatThrownBy(() -> chatFanoutService.post(anonymous, new ChatMessage(null, "b-1", "hi")))
                .isInstanceOf(UnauthorizedParticipantException.class);
        assertThatThrownBy(() -> chatFanoutService.post(client, new ChatMessage(null, "b-1", "hi")))
                .isInstanceOf(UnauthorizedParticipantException.class);
    }

    @Test
    @DisplayName("기록 재전송 및 삭제 - 새 연결에만 재전송하고 종료 후에는 비어 있음")
    void replayAndClearHistory() {
        // Given
        chatFanoutService.post(client, new ChatMessage("s-1", null, "first"));
        HubConnection late = hub.open("c-4", "reader-1", () -> { });
        hub.joinRoom("c-4", SESSION_ROOM);

        // When
        chatFanoutService.replayHistory("c-4", SESSION_ROOM);
        chatFanoutService.clearHistory(SESSION_ROOM);

        // Then
        StepVerifier.create(late.outbound())
                .expectNextMatches(frame -> frame.contains("\"type\":\"chat_history\"") && frame.contains("first"))
                .thenCancel()
                .verify();
        assertThat(chatFanoutService.recentMessages(SESSION_ROOM)).isEmpty();
    }

    @Test
    @DisplayName("서버 생성 채팅 - 이 서버에 열린 룸이 없으면 버퍼에 남기지 않음")
    void publish_NoLocalRoomNotBuffered() {
        // When
        int delivered = chatFanoutService.publish(ChatBroadcastMessage.builder()
                .roomId("live:empty")
                .messageId("m-1")
                .senderId("viewer-1")
                .content("hello")
                .build());

        // Then
        assertThat(delivered).isZero();
        assertThat(chatFanoutService.recentMessages("live:empty")).isEmpty();
        assertThat(chatFanoutService.historyRoomCount()).isZero();
    }
}
