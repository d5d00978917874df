package com.kb.metering.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kb.metering.model.dto.ConnectionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Redis 프레즌스 관리 서비스
 * 여러 서버 인스턴스에 흩어진 연결의 룸 참여 현황을 Redis 에 기록
 *
 * 키 구조:
 * - metering:room:{roomId}:users     룸에 접속 중인 사용자 ID 집합
 * - metering:server:{serverId}:rooms 서버가 로컬 멤버를 가진 룸 ID 집합
 * - metering:connection:{id}         연결 레코드
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisPresenceManager {

    private static final String KEY_PREFIX = "metering:";

    // TTL 설정 상수들
    private static final Duration CONNECTION_TTL = Duration.ofHours(2);
    private static final Duration ROOM_USERS_TTL = Duration.ofMinutes(30);
    private static final Duration SERVER_ROOMS_TTL = Duration.ofMinutes(45);

    private final ReactiveRedisTemplate<String, Object> redisTemplate;
    private final ReactiveRedisTemplate<String, String> stringRedisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * 연결 레코드 저장 (실시간 연결 수립 시)
     */
    public Mono<Void> recordConnection(String connectionId, String userId, String serverId) {
        Instant now = Instant.now();
        ConnectionRecord record = ConnectionRecord.builder()
                .connectionId(connectionId)
                .userId(userId)
                .serverId(serverId)
                .connectedAt(now)
                .lastSeenAt(now)
                .build();

        return redisTemplate.opsForValue().set(connectionKey(connectionId), record, CONNECTION_TTL)
                .doOnNext(saved -> log.debug("연결 레코드 저장: connectionId={}, userId={}, serverId={}",
                        connectionId, userId, serverId))
                .then();
    }

    public Mono<ConnectionRecord> getConnection(String connectionId) {
        return redisTemplate.opsForValue().get(connectionKey(connectionId))
                .map(value -> objectMapper.convertValue(value, ConnectionRecord.class));
    }

    /**
     * 연결 레코드 TTL 갱신 (하트비트 수신 시)
     */
    public Mono<Void> touchConnection(String connectionId) {
        return getConnection(connectionId)
                .flatMap(record -> {
                    record.setLastSeenAt(Instant.now());
                    return redisTemplate.opsForValue().set(connectionKey(connectionId), record, CONNECTION_TTL);
                })
                .then();
    }

    public Mono<Void> removeConnection(String connectionId) {
        return redisTemplate.delete(connectionKey(connectionId))
                .doOnNext(deleted -> log.debug("연결 레코드 삭제: connectionId={}, deleted={}", connectionId, deleted))
                .then();
    }

    /**
     * 룸 입장 기록
     */
    public Mono<Void> recordJoin(String roomId, String userId, String serverId) {
        String roomUsersKey = roomUsersKey(roomId);
        String serverRoomsKey = serverRoomsKey(serverId);

        return Mono.when(
                stringRedisTemplate.opsForSet().add(roomUsersKey, userId)
                        .then(stringRedisTemplate.expire(roomUsersKey, ROOM_USERS_TTL)),
                stringRedisTemplate.opsForSet().add(serverRoomsKey, roomId)
                        .then(stringRedisTemplate.expire(serverRoomsKey, SERVER_ROOMS_TTL))
        ).doOnSuccess(ignored -> log.debug("룸 입장 기록: roomId={}, userId={}, serverId={}", roomId, userId, serverId))
         .doOnError(error -> log.error("룸 입장 기록 실패: roomId={}, userId={}, error={}",
                 roomId, userId, error.getMessage(), error));
    }

    /**
     * 룸 퇴장 기록
     *
     * @param userStillPresent 같은 사용자의 다른 연결이 이 서버의 룸에 남아 있으면 true
     * @param roomEmptyLocally 이 서버에 해당 룸 멤버가 더 없으면 true
     */
    public Mono<Void> recordLeave(String roomId, String userId, String serverId,
                                  boolean userStillPresent, boolean roomEmptyLocally) {
        Mono<Long> removeUser = userStillPresent
                ? Mono.empty()
                : stringRedisTemplate.opsForSet().remove(roomUsersKey(roomId), userId);
        Mono<Long> removeRoom = roomEmptyLocally
                ? stringRedisTemplate.opsForSet().remove(serverRoomsKey(serverId), roomId)
                : Mono.empty();

        return Mono.when(removeUser, removeRoom)
                .doOnSuccess(ignored -> log.debug("룸 퇴장 기록: roomId={}, userId={}, serverId={}", roomId, userId, serverId))
                .doOnError(error -> log.error("룸 퇴장 기록 실패: roomId={}, userId={}, error={}",
                        roomId, userId, error.getMessage(), error));
    }

    /**
     * 룸에 접속 중인 사용자 (전체 서버 기준)
     */
    public Flux<String> getOnlineUsers(String roomId) {
        return stringRedisTemplate.opsForSet().members(roomUsersKey(roomId));
    }

    /**
     * 두 사용자가 모두 룸에 접속 중인지 (전체 서버 기준)
     */
    public Mono<Boolean> areAllPresent(String roomId, String firstUserId, String secondUserId) {
        String key = roomUsersKey(roomId);
        return Mono.zip(stringRedisTemplate.opsForSet().isMember(key, firstUserId),
                        stringRedisTemplate.opsForSet().isMember(key, secondUserId))
                .map(tuple -> tuple.getT1() && tuple.getT2())
                .defaultIfEmpty(false);
    }

    /**
     * 룸 사용자 집합 TTL 갱신 (하트비트 수신 시)
     */
    public Mono<Void> refreshRoom(String roomId) {
        return stringRedisTemplate.expire(roomUsersKey(roomId), ROOM_USERS_TTL).then();
    }

    /**
     * 룸 사용자 집합 삭제 (세션 종료 후)
     */
    public Mono<Void> clearRoom(String roomId) {
        return stringRedisTemplate.delete(roomUsersKey(roomId))
                .doOnNext(deleted -> log.debug("룸 프레즌스 삭제: roomId={}, deleted={}", roomId, deleted))
                .then();
    }

    /**
     * 서버 종료 시 해당 서버의 룸 목록 정리
     * 룸 사용자 집합은 다른 서버의 사용자도 담고 있으므로 TTL 만료에 맡긴다.
     */
    public Mono<Void> cleanupServer(String serverId) {
        return stringRedisTemplate.delete(serverRoomsKey(serverId))
                .doOnNext(deleted -> log.info("서버 룸 목록 키 삭제: serverId={}, deleted={}", serverId, deleted))
                .then();
    }

    private String roomUsersKey(String roomId) {
        return KEY_PREFIX + "room:" + roomId + ":users";
    }

    private String serverRoomsKey(String serverId) {
        return KEY_PREFIX + "server:" + serverId + ":rooms";
    }

    private String connectionKey(String connectionId) {
        return KEY_PREFIX + "connection:" + connectionId;
    }
}
