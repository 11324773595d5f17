package com.textworld.adventureservice.clock;

import com.textworld.adventureservice.config.TextworldProperties;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class ClockSchedulerConfigTest {

    @Test
    void explicitPoolSizeWins() {
        assertThat(ClockSchedulerConfig.poolSize(3, 100)).isEqualTo(3);
    }

    @Test
    void poolSizeFollowsRoomLimitWhenUnset() {
        assertThat(ClockSchedulerConfig.poolSize(0, 1)).isEqualTo(1);
        assertThat(ClockSchedulerConfig.poolSize(0, 10)).isEqualTo(2);
        assertThat(ClockSchedulerConfig.poolSize(0, 11)).isEqualTo(3);
        assertThat(ClockSchedulerConfig.poolSize(0, 500)).isEqualTo(ClockSchedulerConfig.MAX_AUTO_THREADS);
        assertThat(ClockSchedulerConfig.poolSize(0, 0)).isEqualTo(1);
    }

    @Test
    void schedulerUsesDaemonRoomTimerThreads() throws Exception {
        TextworldProperties props = new TextworldProperties();
        ScheduledThreadPoolExecutor executor = new ClockSchedulerConfig().roomTimerScheduler(props);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getRemoveOnCancelPolicy()).isTrue();
            Thread worker = executor.submit((Callable<Thread>) Thread::currentThread).get();
            assertThat(worker.getName()).startsWith("room-timer-");
            assertThat(worker.isDaemon()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }
}
