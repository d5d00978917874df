package com.kb.metering.service;

import com.kb.metering.hub.ConnectionHub;
import com.kb.metering.hub.HubConnection;
import com.kb.metering.hub.RoomChange;
import com.kb.metering.model.message.outbound.ViewerCountMessage;
import com.kb.metering.repository.LivestreamRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * 방송 시청 룸 서비스
 * 익명 시청 허용. 입장/퇴장이 반영된 직후의 룸 크기로 시청자 수를 전파
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastRoomService {

    private final ConnectionHub hub;
    private final ChatFanoutService chatFanoutService;
    private final LivestreamRepository livestreamRepository;

    /**
     * 방송 입장 (등록된 방송만)
     *
     * @return 입장 후 시청자 수
     */
    public Mono<Integer> join(HubConnection connection, String broadcastId) {
        if (broadcastId == null || broadcastId.isBlank()) {
            return Mono.error(new IllegalArgumentException("broadcastId 가 필요합니다"));
        }
        return livestreamRepository.findById(broadcastId)
                .switchIfEmpty(Mono.error(() -> new IllegalArgumentException("방송을 찾을 수 없습니다: " + broadcastId)))
                .map(livestream -> enter(connection, broadcastId));
    }

    public void leave(HubConnection connection, String broadcastId) {
        afterLeave(hub.leaveRoom(connection.getId(), ConnectionHub.broadcastRoomId(broadcastId)));
    }

    /**
     * 퇴장/연결 끊김 공통 처리
     * 마지막 시청자가 나가면 룸의 채팅 버퍼도 정리한다.
     */
    public void afterLeave(RoomChange change) {
        if (!change.isChanged()) {
            return;
        }
        String broadcastId = change.getRoomId().substring(ConnectionHub.BROADCAST_ROOM_PREFIX.length());
        log.info("방송 퇴장: broadcastId={}, userId={}, viewers={}", broadcastId, change.getUserId(), change.getRoomSize());
        if (change.getRoomSize() == 0) {
            chatFanoutService.clearHistory(change.getRoomId());
            return;
        }
        publishViewerCount(broadcastId, change.getRoomSize());
    }

    private int enter(HubConnection connection, String broadcastId) {
        String roomId = ConnectionHub.broadcastRoomId(broadcastId);
        RoomChange change = hub.joinRoom(connection.getId(), roomId);
        log.info("방송 입장: broadcastId={}, userId={}, viewers={}", broadcastId, connection.getUserId(), change.getRoomSize());

        chatFanoutService.replayHistory(connection.getId(), roomId);
        if (change.isChanged()) {
            publishViewerCount(broadcastId, change.getRoomSize());
        }
        return change.getRoomSize();
    }

    private void publishViewerCount(String broadcastId, int viewerCount) {
        hub.broadcast(ConnectionHub.broadcastRoomId(broadcastId), ViewerCountMessage.builder()
                .broadcastId(broadcastId)
                .viewerCount(viewerCount)
                .build(), null);
    }
}
