package com.textworld.adventureservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * TimeoutSchedulerImpl
 * ---------------------------------------
 * 一次性超时调度引擎的默认实现（纯内存）。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 调度到期任务。
 *  - 以 activeTasks 表记录每个 key 当前的任务句柄；到期与取消通过对表的原子移除竞争，
 *    谁先移除成功谁生效，保证两者恰好发生其一。
 *
 * 不做的事：
 *  - 不做任何业务逻辑（如广播、结算），也不持有任何业务锁。
 */
public class TimeoutSchedulerImpl implements TimeoutScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimeoutSchedulerImpl.class);

    // 调度器
    private final ScheduledThreadPoolExecutor scheduler;

    // key -> 任务句柄
    private final ConcurrentMap<String, ScheduledTask> activeTasks = new ConcurrentHashMap<>();

    public TimeoutSchedulerImpl(ScheduledThreadPoolExecutor scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start(String key, Duration delay, String version, TimeoutHandler onTimeout) {
        synchronized (activeTasks) {
            // 防止重复任务：先取消老任务
            cancelQuietly(activeTasks.remove(key));
            if (scheduler.isShutdown()) {
                log.warn("调度器已关闭，忽略计时: key={}", key);
                return;
            }
            ScheduledTask task = new ScheduledTask(key, version, onTimeout);
            // 先登记再调度，到期任务一定能在表里找到自己
            activeTasks.put(key, task);
            task.future = scheduler.schedule(() -> fire(task), Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        }
        log.debug("计时启动: key={}, delay={}s, version={}", key, delay.toSeconds(), version);
    }

    @Override
    public boolean cancel(String key) {
        ScheduledTask task;
        synchronized (activeTasks) {
            task = activeTasks.remove(key);
            cancelQuietly(task);
        }
        if (task != null) {
            log.debug("计时取消: key={}, version={}", key, task.version);
        }
        return task != null;
    }

    @Override
    public boolean isScheduled(String key) {
        return activeTasks.containsKey(key);
    }

    @Override
    public int cancelAll() {
        int cancelled = 0;
        synchronized (activeTasks) {
            for (String key : activeTasks.keySet()) {
                ScheduledTask task = activeTasks.remove(key);
                if (task != null) {
                    cancelQuietly(task);
                    cancelled++;
                }
            }
        }
        return cancelled;
    }

    /**
     * 容器关闭时由 Spring 推断调用：取消所有计时。
     */
    public void shutdown() {
        int cancelled = cancelAll();
        log.info("超时调度器关闭，取消计时 {} 个", cancelled);
    }

    /**
     * 到期任务：只有仍是表中当前任务时才回调，被取消或被新计时替换的任务直接结束。
     */
    private void fire(ScheduledTask task) {
        if (!activeTasks.remove(task.key, task)) {
            return;
        }
        safeTimeout(task);
    }

    /**
     * 安全触发超时回调（捕获并记录回调中的异常）。
     */
    private void safeTimeout(ScheduledTask task) {
        if (task.onTimeout == null) return;
        try {
            task.onTimeout.onTimeout(task.key, task.version);
        } catch (Throwable ex) {
            log.error("超时回调执行失败: key={}, version={}", task.key, task.version, ex);
        }
    }

    private static void cancelQuietly(ScheduledTask task) {
        // 不打断正在运行的回调
        if (task != null && task.future != null) task.future.cancel(false);
    }

    /**
     * 单次计时的登记信息
     */
    private static final class ScheduledTask {
        final String key;
        final String version;
        final TimeoutHandler onTimeout;
        volatile ScheduledFuture<?> future;

        ScheduledTask(String key, String version, TimeoutHandler onTimeout) {
            this.key = key;
            this.version = version;
            this.onTimeout = onTimeout;
        }
    }
}
