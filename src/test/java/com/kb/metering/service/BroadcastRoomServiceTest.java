package com.kb.metering.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kb.metering.config.MeteringProperties;
import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.HubConnection;
import com.kb.metering.hub.MessageCodec;
import com.kb.metering.hub.RoomChange;
import com.kb.metering.model.entity.Livestream;
import com.kb.metering.model.message.inbound.ChatMessage;
import com.kb.metering.repository.LivestreamRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * BroadcastRoomService 테스트
 *
 * 테스트 범위:
 * - 입장/퇴장/연결 끊김 직후의 시청자 수 전파
 * - 등록되지 않은 방송 입장 거부
 * - 마지막 시청자 퇴장 시 채팅 버퍼 정리
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("BroadcastRoomService 방송 룸 테스트")
class BroadcastRoomServiceTest {

    private static final String BROADCAST_ID = "live-1";
    private static final String ROOM_ID = ConnectionHub.broadcastRoomId(BROADCAST_ID);

    @Mock
    private LivestreamRepository livestreamRepository;

    private ConnectionHub hub;
    private ChatFanoutService chatFanoutService;
    private BroadcastRoomService broadcastRoomService;

    @BeforeEach
    void setUp() {
        MeteringProperties properties = new MeteringProperties();
        hub = new ConnectionHub(new MessageCodec(new ObjectMapper()), properties);
        chatFanoutService = new ChatFanoutService(hub, properties);
        broadcastRoomService = new BroadcastRoomService(hub, chatFanoutService, livestreamRepository);
    }

    @Test
    @DisplayName("입장 - 입장이 반영된 시청자 수를 룸 전체에 전파 (익명 시청 허용)")
    void join_PublishesViewerCount() {
        // Given
        when(livestreamRepository.findById(BROADCAST_ID)).thenReturn(Mono.just(livestream(BROADCAST_ID)));
        HubConnection first = hub.open("c-1", null, () -> { });
        HubConnection second = hub.open("c-2", "viewer-2", () -> { });

        // When & Then
        StepVerifier.create(broadcastRoomService.join(first, BROADCAST_ID))
                .expectNext(1)
                .verifyComplete();
        StepVerifier.create(broadcastRoomService.join(second, BROADCAST_ID))
                .expectNext(2)
                .verifyComplete();

        StepVerifier.create(first.outbound())
                .expectNextMatches(frame -> frame.contains("viewer_count_update") && frame.contains("\"viewerCount\":1"))
                .expectNextMatches(frame -> frame.contains("\"viewerCount\":2"))
                .thenCancel()
                .verify();
        StepVerifier.create(second.outbound())
                .expectNextMatches(frame -> frame.contains("\"viewerCount\":2"))
                .thenCancel()
                .verify();
    }

    @Test
    @DisplayName("퇴장 - 남은 시청자에게 줄어든 시청자 수 전파")
    void leave_PublishesDecrementedCount() {
        // Given
        when(livestreamRepository.findById(BROADCAST_ID)).thenReturn(Mono.just(livestream(BROADCAST_ID)));
        HubConnection staying = hub.open("c-1", "viewer-1", () -> { });
        HubConnection leaving = hub.open("c-2", "viewer-2", () -> { });
        broadcastRoomService.join(staying, BROADCAST_ID).block();
        broadcastRoomService.join(leaving, BROADCAST_ID).block();

        // When
        broadcastRoomService.leave(leaving, BROADCAST_ID);

        // Then
        assertThat(hub.roomSize(ROOM_ID)).isEqualTo(1);
        StepVerifier.create(staying.outbound())
                .expectNextMatches(frame -> frame.contains("\"viewerCount\":1"))
                .expectNextMatches(frame -> frame.contains("\"viewerCount\":2"))
                .expectNextMatches(frame -> frame.contains("\"viewerCount\":1"))
                .thenCancel()
                .verify();
    }

    @Test
    @DisplayName("연결 끊김 - 명시적 퇴장과 같이 시청자 수 전파")
    void afterLeave_DisconnectPublishesCount() {
        // Given
        when(livestreamRepository.findById(BROADCAST_ID)).thenReturn(Mono.just(livestream(BROADCAST_ID)));
        HubConnection staying = hub.open("c-1", "viewer-1", () -> { });
        HubConnection dropped = hub.open("c-2", "viewer-2", () -> { });
        broadcastRoomService.join(staying, BROADCAST_ID).block();
        broadcastRoomService.join(dropped, BROADCAST_ID).block();

        // When
        List<RoomChange> changes = hub.disconnect("c-2");
        changes.forEach(broadcastRoomService::afterLeave);

        // Then
        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).getRoomSize()).isEqualTo(1);
        StepVerifier.create(staying.outbound())
                .expectNextMatches(frame -> frame.contains("\"viewerCount\":1"))
                .expectNextMatches(frame -> frame.contains("\"viewerCount\":2"))
                .expectNextMatches(frame -> frame.contains("\"viewerCount\":1"))
                .thenCancel()
                .verify();
    }

    @Test
    @DisplayName("입장 - 등록되지 않은 방송이면 거부하고 룸을 만들지 않음")
    void join_UnknownBroadcastRejected() {
        // Given
        when(livestreamRepository.findById("bogus")).thenReturn(Mono.empty());
        HubConnection viewer = hub.open("c-1", "viewer-1", () -> { });

        // When & Then
        StepVerifier.create(broadcastRoomService.join(viewer, "bogus"))
                .expectError(IllegalArgumentException.class)
                .verify();

        assertThat(hub.hasRoom(ConnectionHub.broadcastRoomId("bogus"))).isFalse();
        assertThat(chatFanoutService.historyRoomCount()).isZero();
    }

    @Test
    @DisplayName("마지막 시청자 퇴장 - 방송 룸마다 채팅 버퍼가 남지 않음")
    void afterLeave_LastViewerClearsHistory() {
        // Given
        when(livestreamRepository.findById(anyString()))
                .thenAnswer(invocation -> Mono.just(livestream(invocation.getArgument(0))));

        // When
        for (int i = 0; i < 200; i++) {
            String connectionId = "c-" + i;
            String broadcastId = "live-" + i;
            HubConnection viewer = hub.open(connectionId, "viewer-" + i, () -> { });
            broadcastRoomService.join(viewer, broadcastId).block();
            chatFanoutService.post(viewer, new ChatMessage(null, broadcastId, "hello " + i));
            hub.disconnect(connectionId).forEach(broadcastRoomService::afterLeave);
        }

        // Then
        assertThat(hub.roomCount()).isZero();
        assertThat(chatFanoutService.historyRoomCount()).isZero();
    }

    private Livestream livestream(String id) {
        return Livestream.builder()
                .id(id)
                .hostId("host-1")
                .title("오늘의 타로")
                .status("live")
                .build();
    }
}
