package com.textworld.adventureservice.clock;

import com.textworld.adventureservice.config.TextworldProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 房间计时线程池配置：回合超时与角色创建超时共用。
 *
 * 线程数：
 *   - scheduler.clock.corePoolSize > 0 时直接使用；
 *   - 否则按房间上限估算，每个房间同一时刻最多一个计时在跑（回合或角色创建），
 *     回调只做锁内状态变更，每 {@link #ROOMS_PER_THREAD} 个房间一条线程即可，上限 {@link #MAX_AUTO_THREADS}。
 *
 * 已取消的计时立即从队列移除；关闭后提交的计时直接丢弃。
 */
@Slf4j
@Configuration
public class ClockSchedulerConfig {

    static final int ROOMS_PER_THREAD = 5;
    static final int MAX_AUTO_THREADS = 4;

    @Value("${scheduler.clock.corePoolSize:0}")
    private int corePoolSize;

    @Bean(name = "roomTimerScheduler")
    public ScheduledThreadPoolExecutor roomTimerScheduler(TextworldProperties properties) {
        int size = poolSize(corePoolSize, properties.getMaxRooms());
        AtomicInteger seq = new AtomicInteger(1);
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(size, r -> {
            Thread t = new Thread(r, "room-timer-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        log.info("房间计时线程池: threads={}, maxRooms={}", size, properties.getMaxRooms());
        return executor;
    }

    static int poolSize(int configured, int maxRooms) {
        if (configured > 0) {
            return configured;
        }
        int byRooms = (Math.max(1, maxRooms) + ROOMS_PER_THREAD - 1) / ROOMS_PER_THREAD;
        return Math.min(MAX_AUTO_THREADS, byRooms);
    }
}
