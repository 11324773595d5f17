package com.textworld.adventureservice.clock;

import com.textworld.adventureservice.clock.scheduler.TimeoutScheduler;
import com.textworld.adventureservice.clock.scheduler.TimeoutSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 计时相关 Bean 的装配：把调度线程池注入到通用超时调度引擎中，并提供统一的时间源。
 */
@Configuration
public class ClockAutoConfig {

    /**
     * 注册通用超时调度器。
     * @param roomTimerScheduler 调度线程池（守护线程）
     * @return TimeoutScheduler 实例
     */
    @Bean
    public TimeoutScheduler timeoutScheduler(@Qualifier("roomTimerScheduler") ScheduledThreadPoolExecutor roomTimerScheduler) {
        return new TimeoutSchedulerImpl(roomTimerScheduler); // 纯引擎，无业务逻辑
    }

    /**
     * 时间源：房间、回合、向导的时间戳都从这里取，测试中可替换为固定/可调时钟。
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
