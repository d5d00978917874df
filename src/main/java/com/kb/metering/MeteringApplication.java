package com.kb.metering;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 분당 과금 실시간 세션 엔진 메인 애플리케이션
 * 
 * 주요 기능:
 * - 선결제 잔액 예치(lock) 및 분 단위 과금
 * - 세션 종료 시 환불 및 리더/플랫폼 정산
 * - WebSocket 기반 세션/방송 룸 실시간 통신
 * - 통화 시그널링 중계 및 채팅/선물 전파
 * - Kafka 기반 분산 이벤트, Redis 기반 연결 상태 관리
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class MeteringApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(MeteringApplication.class, args);
    }
}
