package com.kb.metering.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * 분당 과금 세션 엔티티
 * 
 * 불변식:
 * - billedAmount = billedMinutes × ratePerMinute
 * - billedMinutes ≤ authorizedMinutes
 * - 상태는 단방향으로만 전이 (종료 상태에서 되돌아가지 않음)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "sessions")
@CompoundIndex(def = "{'status': 1, 'lastClientHeartbeatAt': 1}")
public class MeteredSession {

    @Id
    private String id;

    /**
     * 과금 대상 고객 ID
     */
    @Indexed
    private String clientId;

    /**
     * 상담사(리더) ID
     */
    @Indexed
    private String readerId;

    private SessionKind kind;

    @Builder.Default
    private SessionStatus status = SessionStatus.INITIALIZED;

    /**
     * 분당 요금 (최소 통화 단위)
     */
    private long ratePerMinute;

    /**
     * 예치된(승인된) 총 분
     */
    private int authorizedMinutes;

    /**
     * 예치된 총 금액
     */
    private long authorizedAmount;

    private int billedMinutes;

    private long billedAmount;

    /**
     * 마지막으로 과금한 분 경계 (시작 시각 기준). 과금 중복 방지의 유일한 기준
     */
    private int lastBilledMinute;

    /**
     * 세션 룸 ID (session:{id})
     */
    private String roomId;

    private Instant createdAt;

    private Instant startedAt;

    private Instant endedAt;

    private EndReason endReason;

    /**
     * 종료 요청자 ID (시스템 종료 시 "system")
     */
    private String endedBy;

    /**
     * 마지막 고객 하트비트 시각 (liveness 판단용)
     */
    private Instant lastClientHeartbeatAt;

    private Instant lastBilledAt;

    @Version
    private Long version;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean isParticipant(String userId) {
        return userId != null && (userId.equals(clientId) || userId.equals(readerId));
    }

    public boolean isClient(String userId) {
        return userId != null && userId.equals(clientId);
    }

    public int getRemainingMinutes() {
        return Math.max(0, authorizedMinutes - billedMinutes);
    }

    /**
     * 아직 과금되지 않은 예치금 (고객 locked 에 남아 있는 몫)
     */
    public long getUnbilledAmount() {
        return authorizedAmount - billedAmount;
    }
}
