package com.textworld.adventureservice.games.textworld.application;

import com.textworld.adventureservice.clock.scheduler.TimeoutScheduler;
import com.textworld.adventureservice.games.textworld.domain.model.Room;
import com.textworld.adventureservice.games.textworld.domain.registry.RoomLifecycleListener;
import com.textworld.adventureservice.games.textworld.domain.registry.RoomRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * RoomClockCoordinator
 * -------------------------------------------------
 * 房间计时协调器（应用编排层）：把通用超时引擎与房间的两个计时（回合、角色创建）对接。
 *
 * 职责与边界：
 * 1) 统一计时 key 的命名（round:{roomId} / character:{roomId}）；
 * 2) 每次启动或取消计时都递增房间上的计时令牌，到期回调带着启动时的令牌回来，
 *    上层在房间锁内比对令牌即可识别“已被取消/替换”的过期回调；
 * 3) 房间关闭时取消该房间的全部计时。
 *
 * 本类的所有方法都要求调用方已持有房间锁；取消不等待正在执行的回调，因此在锁内调用不会死锁。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomClockCoordinator implements RoomLifecycleListener {

    static final String ROUND_PREFIX = "round:";
    static final String CHARACTER_PREFIX = "character:";

    private final TimeoutScheduler scheduler;
    private final RoomRegistry registry;

    /**
     * 到期回调：roomId + 启动时的令牌
     */
    @FunctionalInterface
    public interface RoomTimeoutHandler {
        void onTimeout(String roomId, long token);
    }

    @PostConstruct
    public void register() {
        registry.addLifecycleListener(this);
    }

    // ================= 回合计时 =================

    public void startRoundTimer(Room room, RoomTimeoutHandler handler) {
        long token = room.nextRoundTimerToken();
        scheduler.start(roundKey(room.getId()), Duration.ofSeconds(room.getRoundTimeoutSeconds()),
                String.valueOf(token), (key, version) -> handler.onTimeout(extractRoomId(key), Long.parseLong(version)));
        log.debug("回合计时启动: roomId={}, round={}, timeout={}s, token={}",
                room.getId(), room.getCurrentRound(), room.getRoundTimeoutSeconds(), token);
    }

    public void cancelRoundTimer(Room room) {
        room.invalidateRoundTimer();
        scheduler.cancel(roundKey(room.getId()));
    }

    public boolean isRoundTimerScheduled(String roomId) {
        return scheduler.isScheduled(roundKey(roomId));
    }

    // ================= 角色创建计时 =================

    public void startCharacterTimer(Room room, RoomTimeoutHandler handler) {
        long token = room.nextCharacterTimerToken();
        scheduler.start(characterKey(room.getId()), Duration.ofSeconds(room.getCharacterTimeoutSeconds()),
                String.valueOf(token), (key, version) -> handler.onTimeout(extractRoomId(key), Long.parseLong(version)));
        log.debug("角色创建计时启动: roomId={}, timeout={}s, token={}",
                room.getId(), room.getCharacterTimeoutSeconds(), token);
    }

    public void cancelCharacterTimer(Room room) {
        room.invalidateCharacterTimer();
        scheduler.cancel(characterKey(room.getId()));
    }

    public boolean isCharacterTimerScheduled(String roomId) {
        return scheduler.isScheduled(characterKey(roomId));
    }

    // ================= 生命周期 =================

    @Override
    public void onRoomClosed(Room room) {
        cancelRoundTimer(room);
        cancelCharacterTimer(room);
        log.debug("房间关闭，计时已取消: roomId={}", room.getId());
    }

    static String roundKey(String roomId) { return ROUND_PREFIX + roomId; }

    static String characterKey(String roomId) { return CHARACTER_PREFIX + roomId; }

    static String extractRoomId(String key) {
        int idx = key.indexOf(':');
        return idx < 0 ? key : key.substring(idx + 1);
    }
}
