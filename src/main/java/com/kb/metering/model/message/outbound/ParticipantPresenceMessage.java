package com.kb.metering.model.message.outbound;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 세션 참여자 입장/퇴장 알림
 * 연결이 끊긴 경우에도 퇴장으로 알리지만 세션은 종료되지 않음
 */
@Data
@Builder
@EqualsAndHashCode(callSuper = false)
public class ParticipantPresenceMessage extends ServerMessage {

    public static final String JOINED = "participant_joined";
    public static final String LEFT = "participant_left";

    @JsonIgnore
    private String presenceType;

    private String sessionId;

    private String userId;

    /**
     * 변경이 반영된 현재 룸 연결 수
     */
    private int participantCount;

    public static ParticipantPresenceMessage joined(String sessionId, String userId, int participantCount) {
        return ParticipantPresenceMessage.builder()
                .presenceType(JOINED)
                .sessionId(sessionId)
                .userId(userId)
                .participantCount(participantCount)
                .build();
    }

    public static ParticipantPresenceMessage left(String sessionId, String userId, int participantCount) {
        return ParticipantPresenceMessage.builder()
                .presenceType(LEFT)
                .sessionId(sessionId)
                .userId(userId)
                .participantCount(participantCount)
                .build();
    }

    @Override
    public String getType() {
        return presenceType;
    }
}
