package com.kb.metering.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 과금 엔진 설정 (prefix: metering)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "metering")
public class MeteringProperties {

    @Valid
    private Billing billing = new Billing();

    @Valid
    private Heartbeat heartbeat = new Heartbeat();

    @Valid
    private Hub hub = new Hub();

    /**
     * 선물 카탈로그 (giftId -> 정의)
     */
    @Valid
    private Map<String, GiftDefinition> gifts = new LinkedHashMap<>();

    @Data
    public static class Billing {
        /**
         * 세션 정산 시 리더 몫 (%), 나머지는 플랫폼 몫
         */
        @Min(0)
        @Max(100)
        private int readerSharePercent = 70;

        /**
         * 선물 정산 시 수신자 몫 (%)
         */
        @Min(0)
        @Max(100)
        private int giftReaderSharePercent = 70;

        @Positive
        private int defaultExtensionMinutes = 5;

        /**
         * 남은 분이 이 값 이하이면 minute_billed 에 lowBalance 표시
         */
        @Min(0)
        private int lowBalanceThresholdMinutes = 2;

        /**
         * 낙관적 락 충돌 시 재시도 횟수
         */
        @Min(0)
        private int maxConflictRetries = 5;
    }

    @Data
    public static class Heartbeat {
        /**
         * 클라이언트 하트비트가 이 시간 이상 없으면 세션 강제 종료
         */
        @NotNull
        private Duration livenessTimeout = Duration.ofSeconds(90);

        /**
         * 서버측 경과시간 재조정 주기
         */
        @NotNull
        private Duration reconciliationInterval = Duration.ofSeconds(60);

        /**
         * 잔액 부족 경고 후 자동 종료까지 유예 시간
         */
        @NotNull
        private Duration insufficientFundsGrace = Duration.ofSeconds(60);

        @Positive
        private long livenessSweepIntervalMs = 15000L;
    }

    @Data
    public static class Hub {
        /**
         * 연결별 송신 버퍼 크기 (초과 시 연결 종료)
         */
        @Positive
        private int outboundBufferSize = 256;

        @Positive
        private int chatHistoryLimit = 100;
    }

    @Data
    public static class GiftDefinition {
        @NotBlank
        private String label;

        @Positive
        private long price;

        @NotBlank
        private String animation;
    }
}
