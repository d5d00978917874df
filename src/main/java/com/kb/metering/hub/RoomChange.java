package com.kb.metering.hub;

import lombok.Value;

/**
 * 룸 멤버십 변경 결과
 * roomSize 는 변경이 반영된 직후의 값
 */
@Value
public class RoomChange {

    String roomId;

    String connectionId;

    String userId;

    /**
     * 실제로 멤버십이 바뀌었는지 (중복 입장/퇴장이면 false)
     */
    boolean changed;

    int roomSize;

    /**
     * 같은 사용자의 다른 연결이 룸에 남아 있는(또는 이미 있던) 수
     */
    int otherUserConnections;

    public static boolean isSessionRoom(String roomId) {
        return roomId != null && roomId.startsWith(ConnectionHub.SESSION_ROOM_PREFIX);
    }

    public static boolean isBroadcastRoom(String roomId) {
        return roomId != null && roomId.startsWith(ConnectionHub.BROADCAST_ROOM_PREFIX);
    }
}
