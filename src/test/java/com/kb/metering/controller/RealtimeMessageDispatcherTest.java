package com.kb.metering.controller;

import com.kb.metering.billing.TickOutcome;
import com.kb.metering.exception.InsufficientFundsException;
import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.HubConnection;
import com.kb.metering.hub.SignalingRelay;
import com.kb.metering.model.entity.EndReason;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.message.inbound.EndSessionMessage;
import com.kb.metering.model.message.inbound.HeartbeatMessage;
import com.kb.metering.model.message.inbound.JoinBroadcastMessage;
import com.kb.metering.model.message.inbound.JoinSessionMessage;
import com.kb.metering.model.message.inbound.SignalMessage;
import com.kb.metering.model.message.inbound.UnknownClientMessage;
import com.kb.metering.model.message.outbound.ErrorMessage;
import com.kb.metering.service.BillingHeartbeatDriver;
import com.kb.metering.service.BroadcastRoomService;
import com.kb.metering.service.ChatFanoutService;
import com.kb.metering.service.GiftService;
import com.kb.metering.service.RedisPresenceManager;
import com.kb.metering.service.SessionRoomService;
import com.kb.metering.service.SessionTick;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * RealtimeMessageDispatcher 테스트
 * 오류는 보낸 연결에만 돌려주고 스트림은 항상 정상 완료되는지 확인
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RealtimeMessageDispatcher 테스트")
class RealtimeMessageDispatcherTest {

    @Mock
    private ConnectionHub hub;

    @Mock
    private SessionRoomService sessionRoomService;

    @Mock
    private BroadcastRoomService broadcastRoomService;

    @Mock
    private ChatFanoutService chatFanoutService;

    @Mock
    private SignalingRelay signalingRelay;

    @Mock
    private GiftService giftService;

    @Mock
    private BillingHeartbeatDriver billingDriver;

    @Mock
    private RedisPresenceManager presenceManager;

    @InjectMocks
    private RealtimeMessageDispatcher dispatcher;

    private HubConnection client;
    private HubConnection anonymous;

    @BeforeEach
    void setUp() {
        client = new HubConnection("c-1", "client-1", 16, () -> { });
        anonymous = new HubConnection("c-9", null, 16, () -> { });
    }

    @Test
    @DisplayName("하트비트 - 과금 드라이버 호출 후 프레즌스 갱신")
    void dispatch_Heartbeat() {
        // Given
        MeteredSession session = MeteredSession.builder().id("s-1").clientId("client-1").readerId("reader-1").build();
        when(billingDriver.heartbeat("s-1", "client-1")).thenReturn(Mono.just(SessionTick.unchanged(session)));
        when(presenceManager.refreshRoom("session:s-1")).thenReturn(Mono.empty());
        when(presenceManager.touchConnection("c-1")).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(dispatcher.dispatch(client, new HeartbeatMessage("s-1")))
                .verifyComplete();

        verify(presenceManager).touchConnection("c-1");
        verify(hub, never()).sendToConnection(anyString(), any());
    }

    @Test
    @DisplayName("하트비트 - 프레즌스 갱신 실패는 과금 결과에 영향 없음")
    void dispatch_HeartbeatPresenceFailure() {
        // Given
        MeteredSession session = MeteredSession.builder().id("s-1").clientId("client-1").readerId("reader-1").build();
        SessionTick tick = new SessionTick(session, TickOutcome.of(TickOutcome.Status.NO_CHANGE, session, 0, 0L),
                null, false);
        when(billingDriver.heartbeat("s-1", "client-1")).thenReturn(Mono.just(tick));
        when(presenceManager.refreshRoom("session:s-1")).thenReturn(Mono.error(new IllegalStateException("redis down")));
        when(presenceManager.touchConnection("c-1")).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(dispatcher.dispatch(client, new HeartbeatMessage("s-1")))
                .verifyComplete();

        verify(hub, never()).sendToConnection(anyString(), any());
    }

    @Test
    @DisplayName("오류 - 도메인 오류는 보낸 연결에만 오류 코드로 응답")
    void dispatch_DomainErrorRepliesToSenderOnly() {
        // Given
        when(sessionRoomService.join(client, "s-1"))
                .thenReturn(Mono.error(new InsufficientFundsException(500L, 100L)));

        // When & Then
        StepVerifier.create(dispatcher.dispatch(client, new JoinSessionMessage("s-1")))
                .verifyComplete();

        verify(hub).sendToConnection(eq("c-1"), argThat(message -> message instanceof ErrorMessage
                && "INSUFFICIENT_FUNDS".equals(((ErrorMessage) message).getCode())));
        verify(hub, never()).broadcast(anyString(), any(), any());
    }

    @Test
    @DisplayName("오류 - 예상하지 못한 예외는 내부 오류로 응답")
    void dispatch_UnexpectedErrorIsInternal() {
        // Given
        when(billingDriver.end("s-1", "client-1", EndReason.NORMAL))
                .thenReturn(Mono.error(new IllegalStateException("boom")));

        // When & Then
        StepVerifier.create(dispatcher.dispatch(client, new EndSessionMessage("s-1", null)))
                .verifyComplete();

        verify(hub).sendToConnection(eq("c-1"), argThat(message -> message instanceof ErrorMessage
                && "INTERNAL_ERROR".equals(((ErrorMessage) message).getCode())));
    }

    @Test
    @DisplayName("종료 - 참여자가 보낸 서버 전용 사유는 normal 로 바꿔 전달")
    void dispatch_EndWithServerOnlyReason() {
        // Given
        when(billingDriver.end("s-1", "client-1", EndReason.NORMAL)).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(dispatcher.dispatch(client, new EndSessionMessage("s-1", "insufficient_balance")))
                .verifyComplete();

        verify(billingDriver).end("s-1", "client-1", EndReason.NORMAL);
        verify(billingDriver, never()).end("s-1", "client-1", EndReason.INSUFFICIENT_BALANCE);
    }

    @Test
    @DisplayName("방송 입장 - 없는 방송이면 INVALID_REQUEST 로 응답")
    void dispatch_JoinUnknownBroadcast() {
        // Given
        when(broadcastRoomService.join(client, "bogus"))
                .thenReturn(Mono.error(new IllegalArgumentException("방송을 찾을 수 없습니다: bogus")));

        // When & Then
        StepVerifier.create(dispatcher.dispatch(client, new JoinBroadcastMessage("bogus")))
                .verifyComplete();

        verify(hub).sendToConnection(eq("c-1"), argThat(message -> message instanceof ErrorMessage
                && "INVALID_REQUEST".equals(((ErrorMessage) message).getCode())));
    }

    @Test
    @DisplayName("인증 - 익명 연결의 시그널링은 UNAUTHORIZED 로 거부")
    void dispatch_AnonymousSignalRejected() {
        // When & Then
        StepVerifier.create(dispatcher.dispatch(anonymous,
                        new SignalMessage("signal_offer", "s-1", "reader-1", null)))
                .verifyComplete();

        verifyNoInteractions(signalingRelay);
        verify(hub).sendToConnection(eq("c-9"), argThat(message -> message instanceof ErrorMessage
                && "UNAUTHORIZED".equals(((ErrorMessage) message).getCode())));
    }

    @Test
    @DisplayName("알 수 없는 메시지 - 응답 없이 무시")
    void dispatch_UnknownMessageIgnored() {
        StepVerifier.create(dispatcher.dispatch(client, new UnknownClientMessage()))
                .verifyComplete();

        verifyNoInteractions(hub, sessionRoomService, billingDriver, giftService);
    }
}
