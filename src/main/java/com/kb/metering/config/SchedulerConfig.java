package com.kb.metering.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * 스케줄러 설정
 * 세션별 재조정 타이머와 잔액 부족 카운트다운용 TaskScheduler
 */
@Configuration
public class SchedulerConfig {

    /**
     * 세션 타이머용 TaskScheduler
     * 
     * @return TaskScheduler 빈
     */
    @Bean
    public TaskScheduler sessionTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(10);
        scheduler.setThreadNamePrefix("session-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * 과금 기준 시각 (서버 시각이 기준)
     */
    @Bean
    public Clock meteringClock() {
        return Clock.systemUTC();
    }
}
