package com.kb.metering.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.config.MeteringProperties;
import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.HubConnection;
import com.kb.metering.hub.MessageCodec;
import com.kb.metering.hub.SignalingRelay;
import com.kb.metering.repository.LivestreamRepository;
import com.kb.metering.service.BillingHeartbeatDriver;
import com.kb.metering.service.BroadcastRoomService;
import com.kb.metering.service.ChatFanoutService;
import com.kb.metering.service.MeteredSessionService;
import com.kb.metering.service.RedisPresenceManager;
import com.kb.metering.service.SessionRoomService;
import com.kb.metering.util.ServerInstanceIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.HandshakeInfo;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * RealtimeWebSocketHandler 테스트
 *
 * 테스트 범위:
 * - 갑작스런 연결 끊김: 룸별 퇴장 처리 (세션은 유지, 방송 시청자 수 감소)
 * - 핸드셰이크 사용자 식별
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RealtimeWebSocketHandler 테스트")
class RealtimeWebSocketHandlerTest {

    private static final String SESSION_ROOM = SessionStateMachine.roomIdOf("s-1");
    private static final String BROADCAST_ROOM = ConnectionHub.broadcastRoomId("b-1");

    @Mock
    private RealtimeMessageDispatcher dispatcher;

    @Mock
    private SignalingRelay signalingRelay;

    @Mock
    private MeteredSessionService sessionService;

    @Mock
    private BillingHeartbeatDriver billingDriver;

    @Mock
    private RedisPresenceManager presenceManager;

    @Mock
    private LivestreamRepository livestreamRepository;

    @Mock
    private ServerInstanceIdGenerator serverInstanceIdGenerator;

    private ConnectionHub hub;
    private RealtimeWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        MeteringProperties properties = new MeteringProperties();
        MessageCodec codec = new MessageCodec(new ObjectMapper());
        hub = new ConnectionHub(codec, properties);
        ChatFanoutService chatFanoutService = new ChatFanoutService(hub, properties);
        SessionRoomService sessionRoomService = new SessionRoomService(hub, signalingRelay, sessionService,
                billingDriver, chatFanoutService, presenceManager, serverInstanceIdGenerator);
        BroadcastRoomService broadcastRoomService = new BroadcastRoomService(hub, chatFanoutService,
                livestreamRepository);
        handler = new RealtimeWebSocketHandler(hub, codec, dispatcher, sessionRoomService, broadcastRoomService,
                presenceManager, serverInstanceIdGenerator);

        lenient().when(serverInstanceIdGenerator.getServerInstanceId()).thenReturn("server-1");
        lenient().when(presenceManager.recordLeave(anyString(), anyString(), anyString(), anyBoolean(), anyBoolean()))
                .thenReturn(Mono.empty());
        lenient().when(presenceManager.removeConnection(anyString())).thenReturn(Mono.empty());
    }

    @Test
    @DisplayName("연결 끊김 - 상대방에게 퇴장 알림, 방송 시청자 수 감소, 세션은 종료하지 않음")
    void onDisconnect_LeavesRoomsWithoutEndingSession() {
        // Given
        hub.open("c-1", "client-1", () -> { });
        HubConnection reader = hub.open("c-2", "reader-1", () -> { });
        HubConnection viewer = hub.open("c-3", null, () -> { });
        hub.joinRoom("c-1", SESSION_ROOM);
        hub.joinRoom("c-2", SESSION_ROOM);
        hub.joinRoom("c-1", BROADCAST_ROOM);
        hub.joinRoom("c-3", BROADCAST_ROOM);

        // When
        handler.onDisconnect("c-1", "cancel");

        // Then
        assertThat(hub.getConnection("c-1")).isNull();
        assertThat(hub.roomSize(SESSION_ROOM)).isEqualTo(1);
        assertThat(hub.roomSize(BROADCAST_ROOM)).isEqualTo(1);
        StepVerifier.create(reader.outbound())
                .expectNextMatches(frame -> frame.contains("participant_left")
                        && frame.contains("client-1") && frame.contains("\"participantCount\":1"))
                .thenCancel()
                .verify();
        StepVerifier.create(viewer.outbound())
                .expectNextMatches(frame -> frame.contains("viewer_count_update") && frame.contains("\"viewerCount\":1"))
                .thenCancel()
                .verify();
        verify(presenceManager).recordLeave(SESSION_ROOM, "client-1", "server-1", false, false);
        verify(presenceManager).removeConnection("c-1");
        verifyNoInteractions(billingDriver, sessionService);
    }

    @Test
    @DisplayName("연결 끊김 - 이미 정리된 연결이면 아무 알림 없음")
    void onDisconnect_UnknownConnection() {
        // When
        handler.onDisconnect("c-404", "complete");

        // Then
        verify(presenceManager).removeConnection("c-404");
        verifyNoInteractions(billingDriver, sessionService);
    }

    @Test
    @DisplayName("사용자 식별 - 헤더 우선, 없으면 userId 쿼리 파라미터")
    void resolveUserId_HeaderThenQuery() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(SessionRestController.USER_HEADER, " client-1 ");

        assertThat(RealtimeWebSocketHandler.resolveUserId(handshake("ws://localhost/ws/realtime?userId=other", headers)))
                .isEqualTo("client-1");
        assertThat(RealtimeWebSocketHandler.resolveUserId(handshake("ws://localhost/ws/realtime?userId=reader-1",
                new HttpHeaders())))
                .isEqualTo("reader-1");
        assertThat(RealtimeWebSocketHandler.resolveUserId(handshake("ws://localhost/ws/realtime", new HttpHeaders())))
                .isNull();
    }

    @Test
    @DisplayName("사용자 식별 - 서버 내부 종료 주체(system)를 사칭하면 익명 처리")
    void resolveUserId_SystemActorBecomesAnonymous() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(SessionRestController.USER_HEADER, SessionStateMachine.SYSTEM_ACTOR);

        assertThat(RealtimeWebSocketHandler.resolveUserId(handshake("ws://localhost/ws/realtime", headers)))
                .isNull();
        assertThat(RealtimeWebSocketHandler.resolveUserId(handshake("ws://localhost/ws/realtime?userId=SYSTEM",
                new HttpHeaders())))
                .isNull();
    }

    private HandshakeInfo handshake(String uri, HttpHeaders headers) {
        return new HandshakeInfo(URI.create(uri), headers, Mono.empty(), null);
    }
}
