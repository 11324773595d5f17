package com.textworld.adventureservice.games.textworld.application;

import com.textworld.adventureservice.config.TextworldProperties;
import com.textworld.adventureservice.engine.core.GenerationBackend;
import com.textworld.adventureservice.engine.core.GenerationResult;
import com.textworld.adventureservice.games.textworld.domain.constants.GameMessages;
import com.textworld.adventureservice.games.textworld.domain.enums.PlayerStatus;
import com.textworld.adventureservice.games.textworld.domain.enums.RoomPhase;
import com.textworld.adventureservice.games.textworld.domain.error.RoomRejection;
import com.textworld.adventureservice.games.textworld.domain.error.StateConflictException;
import com.textworld.adventureservice.games.textworld.domain.error.UserInputException;
import com.textworld.adventureservice.games.textworld.domain.model.CharacterSheet;
import com.textworld.adventureservice.games.textworld.domain.model.GameRound;
import com.textworld.adventureservice.games.textworld.domain.model.Player;
import com.textworld.adventureservice.games.textworld.domain.model.Room;
import com.textworld.adventureservice.games.textworld.domain.registry.RoomLifecycleListener;
import com.textworld.adventureservice.games.textworld.domain.registry.RoomRegistry;
import com.textworld.adventureservice.platform.transport.Broadcaster;
import com.textworld.web.common.CurrentPlayerInfo;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * 回合编排：角色创建 → 开场 → 行动收集 → 结算 → 下一轮。
 * <p>
 * 所有状态变更在房间锁内完成；叙事生成在锁外的叙事线程池中执行，返回后重新加锁并复核房间状态。
 * 广播统一在释放房间锁之后发出。
 * <p>
 * 同一轮只会结算一次：进入结算时在锁内置位 resolving 并取消回合计时，
 * 之后到达的行动、超时回调、离开触发的检查都会看到该标记而放弃。
 */
@Slf4j
@Component
public class RoundOrchestrator implements RoomLifecycleListener {

    private final RoomRegistry registry;
    private final RoomClockCoordinator roomClock;
    private final GenerationBackend generationBackend;
    private final Broadcaster broadcaster;
    private final NarrationPrompts prompts;
    private final LongTextFormatter formatter;
    private final TextworldProperties properties;
    private final Executor narrationExecutor;
    private final Clock clock;

    public RoundOrchestrator(RoomRegistry registry,
                             RoomClockCoordinator roomClock,
                             GenerationBackend generationBackend,
                             Broadcaster broadcaster,
                             NarrationPrompts prompts,
                             LongTextFormatter formatter,
                             TextworldProperties properties,
                             @Qualifier("narrationExecutor") Executor narrationExecutor,
                             Clock clock) {
        this.registry = registry;
        this.roomClock = roomClock;
        this.generationBackend = generationBackend;
        this.broadcaster = broadcaster;
        this.prompts = prompts;
        this.formatter = formatter;
        this.properties = properties;
        this.narrationExecutor = narrationExecutor;
        this.clock = clock;
    }

    @PostConstruct
    public void register() {
        registry.addLifecycleListener(this);
    }

    // ================= 角色创建 =================

    /**
     * 房主开始游戏：进入角色创建阶段并启动角色创建计时。
     */
    public String beginCharacterCreation(CurrentPlayerInfo requester) {
        Room room = roomOf(requester.playerId());
        Outbox outbox = new Outbox();
        room.lock();
        try {
            requireOpen(room);
            if (!room.isHost(requester.playerId())) {
                throw new StateConflictException(RoomRejection.NOT_HOST);
            }
            if (room.isPaused()) {
                throw new StateConflictException(RoomRejection.ROOM_PAUSED);
            }
            if (room.getPhase() != RoomPhase.WAITING || room.getActivePlayers().isEmpty()) {
                throw new StateConflictException(RoomRejection.CANNOT_BEGIN);
            }
            room.startCharacterCreation(clock.millis());
            roomClock.startCharacterTimer(room, this::onCharacterTimeout);
            outbox.broadcast(room, GameMessages.formatCharacterCreationStarted(
                    room.getName(), room.getWorldSetting(), room.getCharacterTimeoutSeconds()));
            log.info("角色创建开始: roomId={}, players={}", room.getId(), room.getActivePlayers().size());
        } finally {
            room.unlock();
        }
        outbox.dispatch();
        return GameMessages.BEGIN_REPLY;
    }

    /**
     * 角色设定输入。
     *
     * @return 回复；发送者当前不在创建角色时返回 empty，由调用方继续路由
     * @throws UserInputException 格式或长度不合法
     */
    public Optional<String> submitCharacter(CurrentPlayerInfo sender, String text) {
        Optional<Room> found = registry.findRoomByPlayer(sender.playerId());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Room room = found.get();
        Outbox outbox = new Outbox();
        String reply;
        room.lock();
        try {
            if (room.isClosed() || room.getPhase() != RoomPhase.CHARACTER_CREATION) {
                return Optional.empty();
            }
            Player player = room.findActivePlayer(sender.playerId()).orElse(null);
            if (player == null || player.getStatus() != PlayerStatus.CREATING_CHARACTER) {
                return Optional.empty();
            }
            CharacterSheet sheet = parseCharacter(text);
            player.setCharacter(sheet);
            player.setStatus(PlayerStatus.CHARACTER_DONE);
            outbox.broadcast(room, GameMessages.formatCharacterBroadcast(player.getDisplayName(), sheet.name()));
            if (room.allCharactersDone()) {
                roomClock.cancelCharacterTimer(room);
                startGame(room, outbox);
            }
            reply = GameMessages.formatCharacterDone(sheet.name(), sheet.setting());
        } finally {
            room.unlock();
        }
        outbox.dispatch();
        return Optional.of(reply);
    }

    /**
     * 解析 “角色名：设定” / “角色名:设定” / “角色名\n设定”
     */
    CharacterSheet parseCharacter(String text) {
        String[] parts;
        if (text.contains("：")) {
            parts = text.split("：", 2);
        } else if (text.contains(":")) {
            parts = text.split(":", 2);
        } else if (text.contains("\n")) {
            parts = text.split("\n", 2);
        } else {
            throw new UserInputException(GameMessages.CHARACTER_FORMAT_INVALID);
        }
        String name = parts[0].strip();
        String setting = parts.length > 1 ? parts[1].strip() : "";
        if (name.isEmpty() || name.length() > 20) {
            throw new UserInputException(GameMessages.CHARACTER_NAME_INVALID);
        }
        if (setting.length() < 5) {
            throw new UserInputException(GameMessages.CHARACTER_SETTING_TOO_SHORT);
        }
        int max = properties.getCharacterSettingMaxLength();
        if (setting.length() > max) {
            setting = setting.substring(0, max) + "...";
        }
        return new CharacterSheet(name, setting);
    }

    /**
     * 角色创建计时到期：未完成者使用默认角色，随后开始游戏。
     */
    void onCharacterTimeout(String roomId, long token) {
        Room room = registry.findRoom(roomId).orElse(null);
        if (room == null) {
            log.debug("角色创建计时到期但房间已不存在: roomId={}", roomId);
            return;
        }
        Outbox outbox = new Outbox();
        room.lock();
        try {
            if (room.isClosed() || !room.isCharacterTimerCurrent(token) || room.getPhase() != RoomPhase.CHARACTER_CREATION) {
                log.debug("忽略过期的角色创建计时: roomId={}, token={}", roomId, token);
                return;
            }
            room.invalidateCharacterTimer();
            List<String> assigned = room.assignDefaultCharacters(GameMessages.DEFAULT_CHARACTER_SETTING);
            if (!assigned.isEmpty()) {
                outbox.broadcast(room, GameMessages.formatCharacterTimeout(assigned));
            }
            log.info("角色创建超时: roomId={}, defaulted={}", roomId, assigned);
            startGame(room, outbox);
        } finally {
            room.unlock();
        }
        outbox.dispatch();
    }

    /**
     * 调用方持有房间锁：进入游戏阶段、开始第 1 轮，开场叙事在锁外生成。
     */
    private void startGame(Room room, Outbox outbox) {
        room.enterActivePhase();
        room.startNewRound(clock.millis());
        String prompt = prompts.opening(room.getWorldSetting(), room.charactersInfo());
        String roster = roster(room);
        int round = room.getCurrentRound();
        log.info("游戏开始: roomId={}, players={}", room.getId(), room.getActivePlayers().size());
        outbox.async(() -> completeGameStart(room, prompt, roster, round));
    }

    private void completeGameStart(Room room, String prompt, String roster, int round) {
        String opening = generate(prompt, GameMessages.OPENING_FALLBACK, room.getId());
        Outbox outbox = new Outbox();
        room.lock();
        try {
            if (room.isClosed()) {
                log.debug("开场生成完成时房间已关闭: roomId={}", room.getId());
                return;
            }
            outbox.broadcast(room, GameMessages.formatGameStart(room.getName(), roster,
                    formatter.format(opening, null), room.getRoundTimeoutSeconds()));
            // 生成期间可能已暂停、已恢复（恢复时会启动计时）或本轮已进入结算
            if (room.getPhase() == RoomPhase.ACTIVE && !room.isResolving()
                    && room.getCurrentRound() == round && !roomClock.isRoundTimerScheduled(room.getId())) {
                roomClock.startRoundTimer(room, this::onRoundTimeout);
            }
        } finally {
            room.unlock();
        }
        outbox.dispatch();
    }

    private static String roster(Room room) {
        StringBuilder sb = new StringBuilder();
        for (Player p : room.getActivePlayers()) {
            sb.append("• ").append(p.narrativeName()).append("（").append(p.getDisplayName()).append("）\n");
        }
        return sb.toString();
    }

    // ================= 行动与超时 =================

    /**
     * 提交本轮行动；全部在场玩家都脱离等待状态时立即结算。
     */
    public String submitAction(CurrentPlayerInfo sender, String action) {
        if (StringUtils.isBlank(action)) {
            throw new UserInputException(GameMessages.USAGE_ACT);
        }
        Room room = roomOf(sender.playerId());
        Outbox outbox = new Outbox();
        String reply;
        room.lock();
        try {
            requireOpen(room);
            if (room.isPaused()) {
                throw new StateConflictException(RoomRejection.ROOM_PAUSED);
            }
            if (room.getPhase() != RoomPhase.ACTIVE) {
                throw new StateConflictException(RoomRejection.GAME_NOT_STARTED);
            }
            Player player = room.findActivePlayer(sender.playerId())
                    .orElseThrow(() -> new StateConflictException(RoomRejection.NOT_ACTIVE_PLAYER));
            if (room.isResolving()) {
                throw new StateConflictException(RoomRejection.ROUND_RESOLVING);
            }
            if (player.getStatus() == PlayerStatus.ACTED) {
                throw new StateConflictException(RoomRejection.ALREADY_ACTED);
            }
            player.recordAction(action.strip(), clock.millis());
            reply = GameMessages.formatActionRecorded(player.narrativeName());
            if (room.allPlayersActed()) {
                beginResolution(room, outbox);
            }
        } finally {
            room.unlock();
        }
        outbox.dispatch();
        return reply;
    }

    /**
     * 回合计时到期：未行动者标记超时；全员超时则关闭房间，否则按已有行动结算。
     */
    void onRoundTimeout(String roomId, long token) {
        Room room = registry.findRoom(roomId).orElse(null);
        if (room == null) {
            log.debug("回合计时到期但房间已不存在: roomId={}", roomId);
            return;
        }
        Outbox outbox = new Outbox();
        room.lock();
        try {
            if (room.isClosed() || !room.isRoundTimerCurrent(token) || room.isPaused()
                    || room.getPhase() != RoomPhase.ACTIVE || room.isResolving()) {
                log.debug("忽略过期的回合计时: roomId={}, token={}", roomId, token);
                return;
            }
            List<String> timedOut = room.markIdlePlayersTimedOut();
            log.info("回合超时: roomId={}, round={}, timedOut={}", roomId, room.getCurrentRound(), timedOut);
            if (!timedOut.isEmpty()) {
                outbox.broadcast(room, GameMessages.formatRoundTimeout(timedOut));
            }
            if (room.allPlayersTimedOut()) {
                outbox.broadcast(room, GameMessages.ALL_TIMED_OUT);
                registry.closeRoom(roomId);
            } else {
                beginResolution(room, outbox);
            }
        } finally {
            room.unlock();
        }
        outbox.dispatch();
    }

    // ================= 结算 =================

    /**
     * 调用方持有房间锁。收集行动并把结算交给叙事线程；没有任何行动时不推进轮次，重新计时。
     */
    private void beginResolution(Room room, Outbox outbox) {
        Map<String, String> actions = room.roundActions();
        if (actions.isEmpty()) {
            if (room.getActivePlayers().isEmpty()) {
                registry.closeRoom(room.getId());
                return;
            }
            log.info("本轮没有有效行动，重新计时: roomId={}, round={}", room.getId(), room.getCurrentRound());
            room.reopenRound(clock.millis());
            outbox.broadcast(room, GameMessages.NO_VALID_ACTIONS);
            roomClock.startRoundTimer(room, this::onRoundTimeout);
            return;
        }
        room.beginResolution();
        roomClock.cancelRoundTimer(room);
        int round = room.getCurrentRound();
        String note = room.getCorrectionNote();
        String prompt = prompts.round(room.buildGameContext(properties.getHistoryRoundsInContext()), round, actions);
        log.info("开始结算: roomId={}, round={}, actions={}", room.getId(), round, actions.size());
        outbox.async(() -> completeResolution(room, round, actions, note, prompt));
    }

    private void completeResolution(Room room, int round, Map<String, String> actions, String noteUsed, String prompt) {
        String narration = generate(prompt, GameMessages.NARRATION_PLACEHOLDER, room.getId());
        Outbox outbox = new Outbox();
        room.lock();
        try {
            if (room.isClosed()) {
                log.info("结算完成时房间已关闭，丢弃叙事: roomId={}, round={}", room.getId(), round);
                return;
            }
            if (!room.isResolving() || room.getCurrentRound() != round) {
                log.warn("结算状态不一致，放弃本次结果: roomId={}, expectRound={}, currentRound={}",
                        room.getId(), round, room.getCurrentRound());
                room.finishResolution();
                return;
            }
            room.appendRound(new GameRound(round, actions, narration, clock.millis()));
            if (Objects.equals(room.getCorrectionNote(), noteUsed)) {
                room.consumeCorrectionNote();
            }
            room.finishResolution();
            room.startNewRound(clock.millis());

            String actionLines = actions.entrySet().stream()
                    .map(e -> "  • " + e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining("\n"));
            outbox.broadcast(room, GameMessages.formatRoundResult(round, actionLines,
                    formatter.format(narration, null), room.getCurrentRound(), room.getRoundTimeoutSeconds()));
            if (!room.isPaused() && room.getPhase() == RoomPhase.ACTIVE) {
                roomClock.startRoundTimer(room, this::onRoundTimeout);
            }
            log.info("结算完成: roomId={}, round={}, nextRound={}", room.getId(), round, room.getCurrentRound());
        } finally {
            room.unlock();
        }
        outbox.dispatch();
    }

    /**
     * 有玩家离开后复核：剩余玩家若都已完成角色/行动，则推进被卡住的流程。
     */
    public void reconcileAfterLeave(Room room) {
        advanceIfSettled(room);
    }

    private void advanceIfSettled(Room room) {
        Outbox outbox = new Outbox();
        room.lock();
        try {
            if (room.isClosed() || room.isPaused() || room.getActivePlayers().isEmpty()) {
                return;
            }
            if (room.getPhase() == RoomPhase.CHARACTER_CREATION && room.allCharactersDone()) {
                roomClock.cancelCharacterTimer(room);
                startGame(room, outbox);
            } else if (roundSettled(room)) {
                beginResolution(room, outbox);
            }
        } finally {
            room.unlock();
        }
        outbox.dispatch();
    }

    private static boolean roundSettled(Room room) {
        return room.getPhase() == RoomPhase.ACTIVE && !room.isResolving()
                && room.getCurrentRound() > 0 && room.allPlayersActed();
    }

    // ================= 生命周期 =================

    @Override
    public void onRoomPaused(Room room) {
        roomClock.cancelRoundTimer(room);
        roomClock.cancelCharacterTimer(room);
    }

    /**
     * 暂停期间可能有人离开，剩余玩家已全部完成时不再计时，交给 {@link #afterRoomResumed} 推进。
     */
    @Override
    public void onRoomResumed(Room room) {
        if (room.getPhase() == RoomPhase.ACTIVE && !room.isResolving() && room.getCurrentRound() > 0) {
            if (!room.allPlayersActed()) {
                roomClock.startRoundTimer(room, this::onRoundTimeout);
            }
        } else if (room.getPhase() == RoomPhase.CHARACTER_CREATION && !room.allCharactersDone()) {
            roomClock.startCharacterTimer(room, this::onCharacterTimeout);
        }
    }

    @Override
    public void afterRoomResumed(Room room) {
        advanceIfSettled(room);
    }

    // ================= 工具 =================

    private Room roomOf(String playerId) {
        return registry.findRoomByPlayer(playerId)
                .orElseThrow(() -> new StateConflictException(RoomRejection.NOT_IN_ROOM));
    }

    private static void requireOpen(Room room) {
        if (room.isClosed()) {
            throw new StateConflictException(RoomRejection.NOT_IN_ROOM);
        }
    }

    private String generate(String prompt, String fallback, String roomId) {
        try {
            GenerationResult result = generationBackend.generate(prompt);
            if (!result.ok()) {
                log.warn("叙事生成失败，使用兜底: roomId={}, error={}", roomId, result.error());
            }
            return result.textOr(fallback);
        } catch (RuntimeException e) {
            log.warn("叙事生成异常，使用兜底: roomId={}, ex={}", roomId, e.toString());
            return fallback;
        }
    }

    private void submit(Runnable job) {
        try {
            narrationExecutor.execute(() -> {
                try {
                    job.run();
                } catch (RuntimeException e) {
                    log.error("叙事任务执行失败", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("叙事线程池拒绝任务（可能正在关闭）: {}", e.getMessage());
        }
    }

    /**
     * 锁内登记、锁外发出的副作用：广播（地址在登记时快照）与叙事任务。
     */
    private final class Outbox {
        private final List<Map.Entry<Collection<String>, String>> broadcasts = new ArrayList<>();
        private final List<Runnable> jobs = new ArrayList<>();

        void broadcast(Room room, String text) {
            broadcasts.add(Map.entry(List.copyOf(room.uniqueAddresses()), text));
        }

        void async(Runnable job) {
            jobs.add(job);
        }

        void dispatch() {
            for (Map.Entry<Collection<String>, String> b : broadcasts) {
                broadcaster.broadcast(b.getKey(), b.getValue());
            }
            for (Runnable job : jobs) {
                submit(job);
            }
        }
    }
}
