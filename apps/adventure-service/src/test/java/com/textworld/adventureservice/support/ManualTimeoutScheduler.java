package com.textworld.adventureservice.support;

import com.textworld.adventureservice.clock.scheduler.TimeoutScheduler;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 测试用调度器：不真正计时，由测试显式触发到期。
 */
public class ManualTimeoutScheduler implements TimeoutScheduler {

    public record Pending(String key, Duration delay, String version, TimeoutHandler handler) {
    }

    private final Map<String, Pending> pending = new HashMap<>();
    private int started;
    private int cancelled;

    @Override
    public synchronized void start(String key, Duration delay, String version, TimeoutHandler onTimeout) {
        pending.put(key, new Pending(key, delay, version, onTimeout));
        started++;
    }

    @Override
    public synchronized boolean cancel(String key) {
        boolean removed = pending.remove(key) != null;
        if (removed) {
            cancelled++;
        }
        return removed;
    }

    @Override
    public synchronized boolean isScheduled(String key) {
        return pending.containsKey(key);
    }

    @Override
    public synchronized int cancelAll() {
        int n = pending.size();
        pending.clear();
        return n;
    }

    public synchronized Pending get(String key) {
        return pending.get(key);
    }

    public synchronized int startedCount() {
        return started;
    }

    public synchronized int cancelledCount() {
        return cancelled;
    }

    /**
     * 触发到期：与真实实现一样，先从表中移除再在锁外回调。
     *
     * @return 是否真的有计时被触发
     */
    public boolean fire(String key) {
        Pending p;
        synchronized (this) {
            p = pending.remove(key);
        }
        if (p == null) {
            return false;
        }
        p.handler().onTimeout(p.key(), p.version());
        return true;
    }
}
