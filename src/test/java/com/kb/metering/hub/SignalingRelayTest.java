package com.kb.metering.hub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.config.MeteringProperties;
import com.kb.metering.exception.UnauthorizedParticipantException;
import com.kb.metering.model.entity.MeteredSession;
import com.kb.metering.model.message.inbound.SignalMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SignalingRelay 테스트")
class SignalingRelayTest {

    private static final String SESSION_ID = "s-1";
    private static final String ROOM_ID = SessionStateMachine.roomIdOf(SESSION_ID);

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ConnectionHub hub;
    private SignalingRelay relay;
    private HubConnection client;
    private HubConnection reader;

    @BeforeEach
    void setUp() {
        hub = new ConnectionHub(new MessageCodec(objectMapper), new MeteringProperties());
        relay = new SignalingRelay(hub);
        client = hub.open("c-1", "client-1", () -> { });
        reader = hub.open("c-2", "reader-1", () -> { });
        hub.joinRoom("c-1", ROOM_ID);
        hub.joinRoom("c-2", ROOM_ID);
        relay.register(MeteredSession.builder()
                .id(SESSION_ID)
                .clientId("client-1")
                .readerId("reader-1")
                .roomId(ROOM_ID)
                .build());
    }

    @Test
    @DisplayName("중계 - 대상 참여자에게만 payload 를 그대로 전달")
    void relay_DeliversOnlyToTarget() {
        // Given
        HubConnection viewer = hub.open("c-3", "viewer-1", () -> { });
        hub.joinRoom("c-3", ROOM_ID);
        ObjectNode payload = objectMapper.createObjectNode().put("sdp", "v=0");

        // When
        int delivered = relay.relay(client, new SignalMessage("signal_offer", SESSION_ID, "reader-1", payload));

        // Then
        assertThat(delivered).isEqualTo(1);
        StepVerifier.create(reader.outbound())
                .expectNextMatches(frame -> frame.contains("\"type\":\"signal_offer\"")
                        && frame.contains("\"senderId\":\"client-1\"")
                        && frame.contains("\"sdp\":\"v=0\""))
                .thenCancel()
                .verify();
        viewer.close();
        StepVerifier.create(viewer.outbound()).verifyComplete();
    }

    @Test
    @DisplayName("중계 - 세션 참여자가 아닌 사용자는 거부")
    void relay_RejectsStranger() {
        // Given
        HubConnection stranger = hub.open("c-3", "viewer-1", () -> { });
        hub.joinRoom("c-3", ROOM_ID);

        // When & Then
        assertThatThrownBy(() -> relay.relay(stranger,
                new SignalMessage("signal_ice", SESSION_ID, "reader-1", null)))
                .isInstanceOf(UnauthorizedParticipantException.class);
    }

    @Test
    @DisplayName("중계 - 자기 자신이나 제3자를 대상으로 하면 거부")
    void relay_RejectsInvalidTarget() {
        assertThatThrownBy(() -> relay.relay(client,
                new SignalMessage("signal_answer", SESSION_ID, "client-1", null)))
                .isInstanceOf(UnauthorizedParticipantException.class);
        assertThatThrownBy(() -> relay.relay(client,
                new SignalMessage("signal_answer", SESSION_ID, "viewer-1", null)))
                .isInstanceOf(UnauthorizedParticipantException.class);
    }

    @Test
    @DisplayName("중계 - 룸을 떠난 참여자 연결은 거부")
    void relay_RejectsConnectionOutsideRoom() {
        // Given
        hub.leaveRoom("c-1", ROOM_ID);

        // When & Then
        assertThatThrownBy(() -> relay.relay(client,
                new SignalMessage("signal_offer", SESSION_ID, "reader-1", null)))
                .isInstanceOf(UnauthorizedParticipantException.class);
    }

    @Test
    @DisplayName("해제 후 - 종료된 세션에는 시그널링 불가")
    void relay_AfterUnregister() {
        // Given
        relay.unregister(ROOM_ID);

        // When & Then
        assertThat(relay.isRegistered(ROOM_ID)).isFalse();
        assertThatThrownBy(() -> relay.relay(client,
                new SignalMessage("signal_offer", SESSION_ID, "reader-1", null)))
                .isInstanceOf(UnauthorizedParticipantException.class);
    }
}
