package com.textworld.adventureservice.games.textworld.domain.registry;

import com.textworld.adventureservice.config.TextworldProperties;
import com.textworld.adventureservice.games.textworld.domain.enums.RoomPhase;
import com.textworld.adventureservice.games.textworld.domain.error.RoomRejection;
import com.textworld.adventureservice.games.textworld.domain.error.StateConflictException;
import com.textworld.adventureservice.games.textworld.domain.model.Player;
import com.textworld.adventureservice.games.textworld.domain.model.Room;
import com.textworld.web.common.CurrentPlayerInfo;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 房间注册表：房间表 + 玩家→房间反向索引。
 * <p>
 * 不变式：任意时刻，反向索引恰好包含所有房间（正式 + 候补）成员，每个玩家最多属于一个房间。
 * <p>
 * 加锁顺序：先房间锁、后注册表锁，任何路径都不得反过来。
 */
@Slf4j
@Component
public class RoomRegistry {

    private final TextworldProperties properties;
    private final Clock clock;

    /** 保护 rooms 与 playerIndex 的短锁 */
    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<String, Room> rooms = new LinkedHashMap<>();
    private final Map<String, String> playerIndex = new HashMap<>();

    private final List<RoomLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public RoomRegistry(TextworldProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public void addLifecycleListener(RoomLifecycleListener listener) {
        listeners.add(listener);
    }

    // ================= 查询 =================

    public Optional<Room> findRoom(String roomId) {
        registryLock.lock();
        try {
            return Optional.ofNullable(rooms.get(roomId));
        } finally {
            registryLock.unlock();
        }
    }

    public Optional<Room> findRoomByPlayer(String playerId) {
        registryLock.lock();
        try {
            String roomId = playerIndex.get(playerId);
            return roomId == null ? Optional.empty() : Optional.ofNullable(rooms.get(roomId));
        } finally {
            registryLock.unlock();
        }
    }

    public boolean isInRoom(String playerId) {
        registryLock.lock();
        try {
            return playerIndex.containsKey(playerId);
        } finally {
            registryLock.unlock();
        }
    }

    public boolean canCreateRoom() {
        registryLock.lock();
        try {
            return rooms.size() < properties.getMaxRooms();
        } finally {
            registryLock.unlock();
        }
    }

    public int roomCount() {
        registryLock.lock();
        try {
            return rooms.size();
        } finally {
            registryLock.unlock();
        }
    }

    /** 全部房间，按创建时间先后 */
    public List<Room> allRooms() {
        registryLock.lock();
        try {
            List<Room> all = new ArrayList<>(rooms.values());
            all.sort(Comparator.comparingLong(Room::getCreatedAt));
            return all;
        } finally {
            registryLock.unlock();
        }
    }

    /** 反向索引快照：玩家 ID → 房间 ID */
    public Map<String, String> playerIndexSnapshot() {
        registryLock.lock();
        try {
            return Map.copyOf(playerIndex);
        } finally {
            registryLock.unlock();
        }
    }

    // ================= 创建 =================

    /**
     * 创建房间，房主作为首个正式成员加入。
     *
     * @throws StateConflictException AT_CAPACITY / CREATOR_ALREADY_IN_ROOM
     */
    public Room createRoom(RoomDraft draft) {
        CurrentPlayerInfo host = draft.host();
        long now = clock.millis();
        registryLock.lock();
        try {
            if (rooms.size() >= properties.getMaxRooms()) {
                throw new StateConflictException(RoomRejection.AT_CAPACITY);
            }
            if (playerIndex.containsKey(host.playerId())) {
                throw new StateConflictException(RoomRejection.CREATOR_ALREADY_IN_ROOM);
            }
            String roomId = newRoomId();
            Room room = new Room(roomId, draft.name(), host.playerId(), host.replyAddress(),
                    draft.worldSetting(), draft.originalWorldSetting(),
                    draft.roundTimeoutSeconds(), draft.characterTimeoutSeconds(), now);
            room.addActivePlayer(Player.of(host, now));
            rooms.put(roomId, room);
            playerIndex.put(host.playerId(), roomId);
            log.info("房间创建: roomId={}, name={}, host={}, rooms={}", roomId, draft.name(), host.playerId(), rooms.size());
            return room;
        } finally {
            registryLock.unlock();
        }
    }

    private String newRoomId() {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (rooms.containsKey(id));
        return id;
    }

    // ================= 加入/离开 =================

    /**
     * 加入房间：等待中加入为正式成员，暂停中加入为候补。
     *
     * @throws StateConflictException NOT_FOUND / CLOSED / ALREADY_STARTED / ALREADY_IN_A_ROOM / FULL
     */
    public JoinOutcome joinRoom(String roomId, CurrentPlayerInfo player, int maxPerRoom) {
        Room room = findRoom(roomId).orElseThrow(() -> new StateConflictException(RoomRejection.NOT_FOUND));
        room.lock();
        try {
            if (room.isClosed()) {
                throw new StateConflictException(RoomRejection.CLOSED);
            }
            if (room.getPhase().started()) {
                throw new StateConflictException(RoomRejection.ALREADY_STARTED);
            }
            Player joined = Player.of(player, clock.millis());
            boolean pending = room.isPaused();
            registryLock.lock();
            try {
                if (playerIndex.containsKey(player.playerId())) {
                    throw new StateConflictException(RoomRejection.ALREADY_IN_A_ROOM);
                }
                if (room.memberCount() >= maxPerRoom) {
                    throw new StateConflictException(RoomRejection.FULL);
                }
                if (pending) {
                    room.stagePendingPlayer(joined);
                } else {
                    room.addActivePlayer(joined);
                }
                playerIndex.put(player.playerId(), roomId);
            } finally {
                registryLock.unlock();
            }
            log.info("玩家加入: roomId={}, playerId={}, pending={}", roomId, player.playerId(), pending);
            return new JoinOutcome(room, joined, pending, room.getActivePlayers().size());
        } finally {
            room.unlock();
        }
    }

    /**
     * 离开房间；房主离开则关闭房间。
     *
     * @throws StateConflictException NOT_IN_ROOM
     */
    public LeaveOutcome leaveRoom(String playerId) {
        Room room = findRoomByPlayer(playerId).orElseThrow(() -> new StateConflictException(RoomRejection.NOT_IN_ROOM));
        room.lock();
        try {
            Player removed;
            registryLock.lock();
            try {
                // 加锁前房间可能已被关闭或玩家已离开
                if (!room.getId().equals(playerIndex.get(playerId))) {
                    throw new StateConflictException(RoomRejection.NOT_IN_ROOM);
                }
                removed = room.removePlayer(playerId)
                        .orElseThrow(() -> new StateConflictException(RoomRejection.NOT_IN_ROOM));
                playerIndex.remove(playerId);
            } finally {
                registryLock.unlock();
            }
            boolean closed = false;
            if (room.isHost(playerId)) {
                closed = closeLocked(room);
            }
            log.info("玩家离开: roomId={}, playerId={}, roomClosed={}", room.getId(), playerId, closed);
            return new LeaveOutcome(room, removed, closed);
        } finally {
            room.unlock();
        }
    }

    // ================= 关闭 =================

    /**
     * 关闭房间：标记关闭、取消计时（由监听器完成）、从注册表移除并清理全部成员索引。
     *
     * @return true 表示本次调用完成了关闭；房间不存在或已关闭返回 false
     */
    public boolean closeRoom(String roomId) {
        Optional<Room> found = findRoom(roomId);
        if (found.isEmpty()) {
            return false;
        }
        Room room = found.get();
        room.lock();
        try {
            return closeLocked(room);
        } finally {
            room.unlock();
        }
    }

    /** 调用方必须已持有房间锁 */
    private boolean closeLocked(Room room) {
        if (room.isClosed()) {
            return false;
        }
        room.markClosed();
        for (RoomLifecycleListener l : listeners) {
            try {
                l.onRoomClosed(room);
            } catch (RuntimeException e) {
                log.error("房间关闭回调失败: roomId={}", room.getId(), e);
            }
        }
        registryLock.lock();
        try {
            rooms.remove(room.getId());
            for (Player p : room.allPlayers()) {
                playerIndex.remove(p.getId(), room.getId());
            }
            // 房主离开时已先从成员中移除，这里一并清理
            playerIndex.remove(room.getHostId(), room.getId());
        } finally {
            registryLock.unlock();
        }
        log.info("房间关闭: roomId={}, name={}", room.getId(), room.getName());
        return true;
    }

    /**
     * 进程关闭时清空所有房间（计时由调度器统一取消）。
     */
    @PreDestroy
    public int clear() {
        List<Room> all = allRooms();
        int closed = 0;
        for (Room room : all) {
            if (closeRoom(room.getId())) {
                closed++;
            }
        }
        return closed;
    }

    // ================= 暂停/恢复 =================

    /**
     * @throws StateConflictException NOT_FOUND / NOT_HOST / ALREADY_PAUSED
     */
    public Room pauseRoom(String roomId, String requesterId) {
        Room room = findRoom(roomId).orElseThrow(() -> new StateConflictException(RoomRejection.NOT_FOUND));
        room.lock();
        try {
            if (room.isClosed()) {
                throw new StateConflictException(RoomRejection.NOT_FOUND);
            }
            if (!room.isHost(requesterId)) {
                throw new StateConflictException(RoomRejection.NOT_HOST);
            }
            if (room.isPaused()) {
                throw new StateConflictException(RoomRejection.ALREADY_PAUSED);
            }
            room.pause();
            for (RoomLifecycleListener l : listeners) {
                l.onRoomPaused(room);
            }
            log.info("房间暂停: roomId={}, phaseBeforePause={}", roomId, room.getPhaseBeforePause());
            return room;
        } finally {
            room.unlock();
        }
    }

    /**
     * 恢复：暂存配置生效、候补成为正式成员、回到暂停前的阶段，三者在同一次持锁内完成。
     *
     * @throws StateConflictException NOT_FOUND / NOT_HOST / NOT_PAUSED
     */
    public ResumeResult resumeRoom(String roomId, String requesterId) {
        Room room = findRoom(roomId).orElseThrow(() -> new StateConflictException(RoomRejection.NOT_FOUND));
        ResumeResult result;
        room.lock();
        try {
            if (room.isClosed()) {
                throw new StateConflictException(RoomRejection.NOT_FOUND);
            }
            if (!room.isHost(requesterId)) {
                throw new StateConflictException(RoomRejection.NOT_HOST);
            }
            if (!room.isPaused()) {
                throw new StateConflictException(RoomRejection.NOT_PAUSED);
            }
            Room.ResumeOutcome outcome = room.resume();
            for (RoomLifecycleListener l : listeners) {
                l.onRoomResumed(room);
            }
            log.info("房间恢复: roomId={}, phase={}, admitted={}", roomId, room.getPhase(), outcome.admittedPlayers().size());
            result = new ResumeResult(room, outcome, room.getPhase(), room.getCurrentRound());
        } finally {
            room.unlock();
        }
        for (RoomLifecycleListener l : listeners) {
            l.afterRoomResumed(room);
        }
        return result;
    }

    // ================= 结果 =================

    /**
     * 创建房间所需的参数
     */
    public record RoomDraft(CurrentPlayerInfo host, String name, String worldSetting, String originalWorldSetting,
                            int roundTimeoutSeconds, int characterTimeoutSeconds) {
    }

    /**
     * @param activeCount 加入后的正式成员数
     */
    public record JoinOutcome(Room room, Player player, boolean pending, int activeCount) {
    }

    public record LeaveOutcome(Room room, Player player, boolean roomClosed) {
    }

    public record ResumeResult(Room room, Room.ResumeOutcome outcome, RoomPhase phase, int currentRound) {
    }
}
