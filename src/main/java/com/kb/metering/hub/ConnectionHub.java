package com.kb.metering.hub;

import com.kb.metering.config.MeteringProperties;
import com.kb.metering.model.message.outbound.ServerMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 실시간 연결 허브
 * 
 * 연결 ID -> 연결, 룸 ID -> 연결 ID 집합, 사용자 ID -> 연결 ID 집합(메일박스)을 하나의 락으로 관리한다.
 * 룸은 첫 입장 시 생성되고 마지막 퇴장 시 제거된다.
 * 전송은 락 밖에서 수행하므로 느린 연결이 다른 참여자나 멤버십 변경을 막지 않는다.
 */
@Slf4j
@Component
public class ConnectionHub {

    public static final String SESSION_ROOM_PREFIX = "session:";
    public static final String BROADCAST_ROOM_PREFIX = "live:";

    private final MessageCodec codec;
    private final int outboundBufferSize;

    private final Object lock = new Object();
    private final Map<String, HubConnection> connections = new HashMap<>();
    private final Map<String, Set<String>> rooms = new HashMap<>();
    private final Map<String, Set<String>> memberships = new HashMap<>();
    private final Map<String, Set<String>> mailboxes = new HashMap<>();

    public ConnectionHub(MessageCodec codec, MeteringProperties properties) {
        this.codec = codec;
        this.outboundBufferSize = properties.getHub().getOutboundBufferSize();
    }

    public static String broadcastRoomId(String broadcastId) {
        return BROADCAST_ROOM_PREFIX + broadcastId;
    }

    /**
     * 새 연결 등록
     *
     * @param connectionId 전송 계층 연결 ID
     * @param userId 인증된 사용자 ID (익명이면 null)
     * @param onOverflow 송신 버퍼 초과 시 전송 계층 연결을 닫는 콜백
     */
    public HubConnection open(String connectionId, String userId, Runnable onOverflow) {
        HubConnection connection = new HubConnection(connectionId, userId, outboundBufferSize, onOverflow);
        synchronized (lock) {
            connections.put(connectionId, connection);
            memberships.put(connectionId, new LinkedHashSet<>());
            if (userId != null) {
                mailboxes.computeIfAbsent(userId, key -> new LinkedHashSet<>()).add(connectionId);
            }
        }
        log.debug("연결 등록: connectionId={}, userId={}", connectionId, userId);
        return connection;
    }

    public RoomChange joinRoom(String connectionId, String roomId) {
        synchronized (lock) {
            HubConnection connection = connections.get(connectionId);
            if (connection == null) {
                throw new IllegalStateException("등록되지 않은 연결입니다: " + connectionId);
            }
            Set<String> members = rooms.computeIfAbsent(roomId, key -> new LinkedHashSet<>());
            int otherUserConnections = countUserConnections(members, connection.getUserId(), connectionId);
            boolean added = members.add(connectionId);
            memberships.get(connectionId).add(roomId);
            return new RoomChange(roomId, connectionId, connection.getUserId(), added, members.size(),
                    otherUserConnections);
        }
    }

    public RoomChange leaveRoom(String connectionId, String roomId) {
        synchronized (lock) {
            HubConnection connection = connections.get(connectionId);
            String userId = connection != null ? connection.getUserId() : null;
            Set<String> joined = memberships.get(connectionId);
            if (joined != null) {
                joined.remove(roomId);
            }
            return removeFromRoom(connectionId, userId, roomId);
        }
    }

    /**
     * 연결 해제 (명시적 퇴장 없이 끊긴 경우 포함)
     * 모든 룸에서 제거하고 각 룸의 변경 결과를 반환. 세션 종료 여부는 호출부가 판단
     */
    public List<RoomChange> disconnect(String connectionId) {
        HubConnection connection;
        List<RoomChange> changes = new ArrayList<>();
        synchronized (lock) {
            connection = connections.remove(connectionId);
            if (connection == null) {
                return Collections.emptyList();
            }
            Set<String> joined = memberships.remove(connectionId);
            if (joined != null) {
                for (String roomId : joined) {
                    changes.add(removeFromRoom(connectionId, connection.getUserId(), roomId));
                }
            }
            if (connection.getUserId() != null) {
                Set<String> mailbox = mailboxes.get(connection.getUserId());
                if (mailbox != null) {
                    mailbox.remove(connectionId);
                    if (mailbox.isEmpty()) {
                        mailboxes.remove(connection.getUserId());
                    }
                }
            }
        }
        connection.close();
        log.debug("연결 해제: connectionId={}, userId={}, rooms={}", connectionId, connection.getUserId(), changes.size());
        return changes;
    }

    /**
     * 룸 전체 연결에 메시지 전송
     *
     * @param excludeConnectionId 제외할 연결 (없으면 null)
     * @return 전송된 연결 수
     */
    public int broadcast(String roomId, ServerMessage message, String excludeConnectionId) {
        List<HubConnection> targets;
        synchronized (lock) {
            Set<String> members = rooms.get(roomId);
            if (members == null) {
                return 0;
            }
            targets = resolve(members, excludeConnectionId, null);
        }
        return deliver(targets, message);
    }

    /**
     * 사용자 메일박스(해당 사용자의 모든 연결)로 전송. 룸 멤버십과 무관
     */
    public int sendToUser(String userId, ServerMessage message) {
        List<HubConnection> targets;
        synchronized (lock) {
            Set<String> mailbox = mailboxes.get(userId);
            if (mailbox == null) {
                return 0;
            }
            targets = resolve(mailbox, null, null);
        }
        return deliver(targets, message);
    }

    /**
     * 특정 룸에 속한 특정 사용자의 연결에만 전송
     */
    public int sendToUserInRoom(String roomId, String userId, ServerMessage message) {
        List<HubConnection> targets;
        synchronized (lock) {
            Set<String> members = rooms.get(roomId);
            if (members == null || userId == null) {
                return 0;
            }
            targets = resolve(members, null, userId);
        }
        return deliver(targets, message);
    }

    public boolean sendToConnection(String connectionId, ServerMessage message) {
        HubConnection connection;
        synchronized (lock) {
            connection = connections.get(connectionId);
        }
        return connection != null && deliver(Collections.singletonList(connection), message) == 1;
    }

    /**
     * 룸의 모든 멤버십 제거 (연결은 유지)
     *
     * @return 제거된 연결 ID 목록
     */
    public List<String> closeRoom(String roomId) {
        synchronized (lock) {
            Set<String> members = rooms.remove(roomId);
            if (members == null) {
                return Collections.emptyList();
            }
            for (String connectionId : members) {
                Set<String> joined = memberships.get(connectionId);
                if (joined != null) {
                    joined.remove(roomId);
                }
            }
            log.debug("룸 닫힘: roomId={}, members={}", roomId, members.size());
            return new ArrayList<>(members);
        }
    }

    public int roomSize(String roomId) {
        synchronized (lock) {
            Set<String> members = rooms.get(roomId);
            return members == null ? 0 : members.size();
        }
    }

    public boolean isMember(String connectionId, String roomId) {
        synchronized (lock) {
            Set<String> members = rooms.get(roomId);
            return members != null && members.contains(connectionId);
        }
    }

    public boolean hasRoom(String roomId) {
        synchronized (lock) {
            return rooms.containsKey(roomId);
        }
    }

    /**
     * 룸에 연결된 사용자 ID 목록 (익명 제외, 중복 제거)
     */
    public Set<String> userIdsInRoom(String roomId) {
        synchronized (lock) {
            Set<String> members = rooms.get(roomId);
            if (members == null) {
                return Collections.emptySet();
            }
            Set<String> userIds = new LinkedHashSet<>();
            for (String connectionId : members) {
                HubConnection connection = connections.get(connectionId);
                if (connection != null && connection.getUserId() != null) {
                    userIds.add(connection.getUserId());
                }
            }
            return userIds;
        }
    }

    public HubConnection getConnection(String connectionId) {
        synchronized (lock) {
            return connections.get(connectionId);
        }
    }

    public int connectionCount() {
        synchronized (lock) {
            return connections.size();
        }
    }

    public int roomCount() {
        synchronized (lock) {
            return rooms.size();
        }
    }

    private RoomChange removeFromRoom(String connectionId, String userId, String roomId) {
        Set<String> members = rooms.get(roomId);
        if (members == null) {
            return new RoomChange(roomId, connectionId, userId, false, 0, 0);
        }
        boolean removed = members.remove(connectionId);
        int size = members.size();
        int otherUserConnections = countUserConnections(members, userId, connectionId);
        if (members.isEmpty()) {
            rooms.remove(roomId);
        }
        return new RoomChange(roomId, connectionId, userId, removed, size, otherUserConnections);
    }

    private int countUserConnections(Set<String> members, String userId, String excludeConnectionId) {
        if (userId == null) {
            return 0;
        }
        int count = 0;
        for (String memberId : members) {
            if (memberId.equals(excludeConnectionId)) {
                continue;
            }
            HubConnection member = connections.get(memberId);
            if (member != null && userId.equals(member.getUserId())) {
                count++;
            }
        }
        return count;
    }

    private List<HubConnection> resolve(Set<String> connectionIds, String excludeConnectionId, String onlyUserId) {
        List<HubConnection> targets = new ArrayList<>(connectionIds.size());
        for (String connectionId : connectionIds) {
            if (connectionId.equals(excludeConnectionId)) {
                continue;
            }
            HubConnection connection = connections.get(connectionId);
            if (connection == null) {
                continue;
            }
            if (onlyUserId != null && !onlyUserId.equals(connection.getUserId())) {
                continue;
            }
            targets.add(connection);
        }
        return targets;
    }

    private int deliver(List<HubConnection> targets, ServerMessage message) {
        if (targets.isEmpty()) {
            return 0;
        }
        String frame = codec.encode(message);
        int delivered = 0;
        for (HubConnection target : targets) {
            if (target.offer(frame)) {
                delivered++;
            }
        }
        return delivered;
    }
}
