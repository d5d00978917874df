package com.kb.metering.config;

import com.kb.metering.billing.RevenueSplit;
import com.kb.metering.billing.SessionStateMachine;
import com.kb.metering.billing.SettlementPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 과금 로직 설정
 * 순수 상태 머신과 정산 정책을 설정값으로 구성
 */
@Slf4j
@Configuration
public class BillingConfig {

    @Bean
    public SettlementPolicy settlementPolicy(MeteringProperties properties) {
        MeteringProperties.Billing billing = properties.getBilling();
        log.info("정산 비율 설정: 세션 리더 몫={}%, 선물 수신자 몫={}%",
                billing.getReaderSharePercent(), billing.getGiftReaderSharePercent());
        return new SettlementPolicy(
                new RevenueSplit(billing.getReaderSharePercent()),
                new RevenueSplit(billing.getGiftReaderSharePercent()));
    }

    @Bean
    public SessionStateMachine sessionStateMachine(SettlementPolicy settlementPolicy) {
        return new SessionStateMachine(settlementPolicy);
    }
}
