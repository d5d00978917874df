package com.kb.metering.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 실시간 연결 정보
 * Redis에 저장되는 연결 상태 정보
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionRecord {
    
    /**
     * WebSocket 연결 ID
     */
    private String connectionId;
    
    private String userId;
    
    /**
     * 연결된 서버 ID
     */
    private String serverId;
    
    private Instant connectedAt;
    
    private Instant lastSeenAt;
}
