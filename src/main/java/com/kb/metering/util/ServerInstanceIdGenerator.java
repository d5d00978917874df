package com.kb.metering.util;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 서버 인스턴스 ID 제공자
 * Kafka 이벤트 출처, Redis 타이머 락 소유자, 프레즌스 키 구분에 사용
 */
@Component
public class ServerInstanceIdGenerator {

    @Value("${server.instance.id}")
    private String serverInstanceId;

    /**
     * 현재 서버의 인스턴스 ID
     */
    public String getServerInstanceId() {
        return serverInstanceId;
    }

    /**
     * 이벤트가 현재 서버에서 발생했는지 확인
     */
    public boolean isLocal(String originServerId) {
        return serverInstanceId != null && serverInstanceId.equals(originServerId);
    }
}
