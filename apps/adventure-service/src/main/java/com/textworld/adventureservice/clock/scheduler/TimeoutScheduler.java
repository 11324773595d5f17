package com.textworld.adventureservice.clock.scheduler;

import java.time.Duration;

/**
 * TimeoutScheduler
 * ---------------------------------------
 * 通用的“一次性超时调度器”接口，完全独立于具体业务（房间、回合、角色创建）。
 *
 * 约定：
 *  - 同一 key 同时最多一个计时；重复 start 会先取消旧计时。
 *  - 对同一次计时，“到期回调”和“取消成功”恰好发生其一。
 *  - 回调中的异常由实现捕获并记录，key 之后仍可正常使用。
 */
public interface TimeoutScheduler {

    /**
     * TimeoutHandler
     * ---------------------------------------
     * 到期时回调一次，由上层做权威业务处理。
     */
    interface TimeoutHandler {
        /**
         * 计时到期时触发。
         * @param key     业务键
         * @param version 启动时携带的版本（用于上层识别过期回调，格式由上层定义）
         */
        void onTimeout(String key, String version);
    }

    /**
     * 启动（或重启）指定 key 的计时。
     * @param key       业务键（如 "round:{roomId}"）
     * @param delay     延迟
     * @param version   版本
     * @param onTimeout 到期回调
     */
    void start(String key, Duration delay, String version, TimeoutHandler onTimeout);

    /**
     * 取消指定 key 的计时。不等待已在执行的回调，调用方可以在持有业务锁时调用。
     * @param key 业务键
     * @return true 表示取消了一个尚未触发的计时
     */
    boolean cancel(String key);

    /**
     * @param key 业务键
     * @return 该 key 是否有尚未触发的计时
     */
    boolean isScheduled(String key);

    /**
     * 取消全部计时（进程关闭时使用）。
     * @return 被取消的数量
     */
    int cancelAll();
}
