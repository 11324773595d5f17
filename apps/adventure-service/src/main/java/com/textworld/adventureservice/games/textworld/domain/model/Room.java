package com.textworld.adventureservice.games.textworld.domain.model;

import com.textworld.adventureservice.games.textworld.domain.enums.PlayerStatus;
import com.textworld.adventureservice.games.textworld.domain.enums.RoomPhase;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 一局多人文字冒险的全部状态。
 * <p>
 * 所有读写都必须持有 {@link #lock()}；需要同时持有注册表锁时，先房间锁、后注册表锁。
 * 持锁期间不做 AI 调用、文件下载等耗时 I/O。
 */
@Getter
public class Room {

    // ---- 基本信息 ----
    private final String id;
    private final String name;
    private final String hostId;
    private final String hostAddress;
    private final String worldSetting;
    /** 创建时被截断/总结前的原文；未变换时为空 */
    private final String originalWorldSetting;
    private final long createdAt;

    // ---- 阶段 ----
    private RoomPhase phase = RoomPhase.WAITING;
    private RoomPhase phaseBeforePause;
    private boolean paused;
    /** 本轮叙事生成中；置位期间拒绝行动、不再触发第二次结算 */
    private boolean resolving;

    // ---- 成员 ----
    @Getter(AccessLevel.NONE)
    private final Map<String, Player> activePlayers = new LinkedHashMap<>();
    @Getter(AccessLevel.NONE)
    private final Map<String, Player> pendingPlayers = new LinkedHashMap<>();

    // ---- 计时 ----
    private int roundTimeoutSeconds;
    private final int characterTimeoutSeconds;
    /** 计时令牌：每次启动/取消计时器时递增，过期回调凭此识别自己已失效 */
    private long roundTimerToken;
    private long characterTimerToken;

    // ---- 回合 ----
    private int currentRound;
    private long roundStartedAt;
    private long characterCreationStartedAt;
    @Getter(AccessLevel.NONE)
    private final List<GameRound> history = new ArrayList<>();
    private final PendingConfig pendingConfig = new PendingConfig();
    /** 已生效的房主补充说明，被下一次结算消费 */
    private String correctionNote;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    public Room(String id, String name, String hostId, String hostAddress,
                String worldSetting, String originalWorldSetting,
                int roundTimeoutSeconds, int characterTimeoutSeconds, long createdAt) {
        this.id = id;
        this.name = name;
        this.hostId = hostId;
        this.hostAddress = hostAddress;
        this.worldSetting = worldSetting;
        this.originalWorldSetting = originalWorldSetting;
        this.roundTimeoutSeconds = roundTimeoutSeconds;
        this.characterTimeoutSeconds = characterTimeoutSeconds;
        this.createdAt = createdAt;
    }

    // ================= 锁 =================

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isLockedByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    // ================= 成员 =================

    public boolean isHost(String playerId) {
        return hostId.equals(playerId);
    }

    public boolean isClosed() {
        return phase == RoomPhase.CLOSED;
    }

    public Collection<Player> getActivePlayers() {
        return Collections.unmodifiableCollection(activePlayers.values());
    }

    public Collection<Player> getPendingPlayers() {
        return Collections.unmodifiableCollection(pendingPlayers.values());
    }

    public Optional<Player> findActivePlayer(String playerId) {
        return Optional.ofNullable(activePlayers.get(playerId));
    }

    public Optional<Player> findPlayer(String playerId) {
        Player p = activePlayers.get(playerId);
        return Optional.ofNullable(p != null ? p : pendingPlayers.get(playerId));
    }

    public boolean hasMember(String playerId) {
        return activePlayers.containsKey(playerId) || pendingPlayers.containsKey(playerId);
    }

    public int memberCount() {
        return activePlayers.size() + pendingPlayers.size();
    }

    public List<Player> allPlayers() {
        List<Player> all = new ArrayList<>(activePlayers.values());
        all.addAll(pendingPlayers.values());
        return all;
    }

    /** 去重后的回复地址，广播按地址发送，同一地址只发一次 */
    public Set<String> uniqueAddresses() {
        Set<String> addresses = new LinkedHashSet<>();
        for (Player p : allPlayers()) {
            addresses.add(p.getReplyAddress());
        }
        return addresses;
    }

    public void addActivePlayer(Player player) {
        activePlayers.put(player.getId(), player);
    }

    public void stagePendingPlayer(Player player) {
        player.setStatus(PlayerStatus.PENDING);
        pendingPlayers.put(player.getId(), player);
    }

    public Optional<Player> removePlayer(String playerId) {
        Player removed = activePlayers.remove(playerId);
        if (removed == null) {
            removed = pendingPlayers.remove(playerId);
        }
        return Optional.ofNullable(removed);
    }

    // ================= 阶段切换 =================

    public void markClosed() {
        phase = RoomPhase.CLOSED;
        resolving = false;
    }

    public void pause() {
        phaseBeforePause = phase;
        phase = RoomPhase.PAUSED;
        paused = true;
    }

    /**
     * 恢复：应用暂存配置、接纳候补玩家、回到暂停前的阶段。
     *
     * @return 本次恢复的结果（生效的超时、被接纳的玩家）
     */
    public ResumeOutcome resume() {
        Integer appliedTimeout = pendingConfig.getTimeoutSeconds();
        if (appliedTimeout != null) {
            roundTimeoutSeconds = appliedTimeout;
        }
        if (pendingConfig.getCorrectionNote() != null) {
            correctionNote = pendingConfig.getCorrectionNote();
        }
        String appliedNote = pendingConfig.getCorrectionNote();
        pendingConfig.clear();

        phase = phaseBeforePause != null ? phaseBeforePause : RoomPhase.ACTIVE;
        phaseBeforePause = null;
        paused = false;

        PlayerStatus admittedStatus = switch (phase) {
            case CHARACTER_CREATION -> PlayerStatus.CREATING_CHARACTER;
            default -> PlayerStatus.ACTIVE;
        };
        List<Player> admitted = new ArrayList<>(pendingPlayers.values());
        for (Player p : admitted) {
            p.setStatus(admittedStatus);
            activePlayers.put(p.getId(), p);
        }
        pendingPlayers.clear();
        return new ResumeOutcome(appliedTimeout, appliedNote, admitted);
    }

    public void startCharacterCreation(long now) {
        phase = RoomPhase.CHARACTER_CREATION;
        characterCreationStartedAt = now;
        for (Player p : activePlayers.values()) {
            p.setStatus(PlayerStatus.CREATING_CHARACTER);
        }
    }

    public boolean allCharactersDone() {
        return !activePlayers.isEmpty() && activePlayers.values().stream()
                .allMatch(p -> p.getStatus() == PlayerStatus.CHARACTER_DONE);
    }

    /**
     * 角色创建超时：为未完成的玩家分配默认角色。
     *
     * @return 被自动分配的玩家名
     */
    public List<String> assignDefaultCharacters(String defaultSetting) {
        List<String> assigned = new ArrayList<>();
        for (Player p : activePlayers.values()) {
            if (p.getStatus() == PlayerStatus.CREATING_CHARACTER) {
                p.setCharacter(new CharacterSheet(p.getDisplayName(), defaultSetting));
                p.setStatus(PlayerStatus.CHARACTER_DONE);
                assigned.add(p.getDisplayName());
            }
        }
        return assigned;
    }

    public void enterActivePhase() {
        phase = RoomPhase.ACTIVE;
    }

    public void startNewRound(long now) {
        currentRound++;
        roundStartedAt = now;
        for (Player p : activePlayers.values()) {
            p.resetForNewRound();
        }
    }

    /** 在场玩家是否都已脱离“等待行动”状态（已行动或已超时） */
    public boolean allPlayersActed() {
        return activePlayers.values().stream().noneMatch(p -> p.getStatus() == PlayerStatus.ACTIVE);
    }

    public boolean allPlayersTimedOut() {
        return !activePlayers.isEmpty() && activePlayers.values().stream()
                .allMatch(p -> p.getStatus() == PlayerStatus.TIMED_OUT);
    }

    /**
     * 回合超时：把还在等待行动的玩家标记为超时。
     *
     * @return 被标记玩家的叙事名
     */
    public List<String> markIdlePlayersTimedOut() {
        List<String> names = new ArrayList<>();
        for (Player p : activePlayers.values()) {
            if (p.getStatus() == PlayerStatus.ACTIVE) {
                p.setStatus(PlayerStatus.TIMED_OUT);
                names.add(p.narrativeName());
            }
        }
        return names;
    }

    /** 无人行动的空回合重开：所有玩家回到等待行动，轮次不变 */
    public void reopenRound(long now) {
        roundStartedAt = now;
        for (Player p : activePlayers.values()) {
            p.resetForNewRound();
        }
    }

    /** 本轮已提交的行动：叙事名 → 行动文本 */
    public Map<String, String> roundActions() {
        Map<String, String> actions = new LinkedHashMap<>();
        for (Player p : activePlayers.values()) {
            if (p.getStatus() == PlayerStatus.ACTED && p.getLastAction() != null) {
                actions.put(p.narrativeName(), p.getLastAction());
            }
        }
        return actions;
    }

    // ================= 结算 =================

    public void beginResolution() {
        resolving = true;
    }

    public void finishResolution() {
        resolving = false;
    }

    public void appendRound(GameRound round) {
        history.add(round);
    }

    public List<GameRound> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /** 最近 k 轮历史，按时间先后 */
    public List<GameRound> recentRounds(int k) {
        if (k <= 0) {
            return List.of();
        }
        int from = Math.max(0, history.size() - k);
        return List.copyOf(history.subList(from, history.size()));
    }

    public void consumeCorrectionNote() {
        correctionNote = null;
    }

    // ================= 计时令牌 =================

    public long nextRoundTimerToken() {
        return ++roundTimerToken;
    }

    public void invalidateRoundTimer() {
        roundTimerToken++;
    }

    public boolean isRoundTimerCurrent(long token) {
        return roundTimerToken == token;
    }

    public long nextCharacterTimerToken() {
        return ++characterTimerToken;
    }

    public void invalidateCharacterTimer() {
        characterTimerToken++;
    }

    public boolean isCharacterTimerCurrent(long token) {
        return characterTimerToken == token;
    }

    // ================= 上下文 =================

    /** 已建卡角色的列表文本；没有角色时返回空串 */
    public String charactersInfo() {
        StringBuilder sb = new StringBuilder();
        for (Player p : activePlayers.values()) {
            if (p.hasCharacter()) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append("- ").append(p.getCharacter().name())
                        .append("（玩家：").append(p.getDisplayName()).append("）：")
                        .append(p.getCharacter().setting());
            }
        }
        return sb.toString();
    }

    /**
     * 叙事上下文：世界观、角色、房主补充、最近 k 轮历史（DM 回应截取前 100 字）。
     */
    public String buildGameContext(int historyRounds) {
        StringBuilder sb = new StringBuilder();
        sb.append("【世界观设定】\n").append(worldSetting);

        String characters = charactersInfo();
        if (!characters.isEmpty()) {
            sb.append("\n\n【角色信息】\n").append(characters);
        }
        if (correctionNote != null && !correctionNote.isBlank()) {
            sb.append("\n\n【房主补充】\n").append(correctionNote);
        }

        List<GameRound> recent = recentRounds(historyRounds);
        if (!recent.isEmpty()) {
            sb.append("\n\n【历史记录】");
            for (GameRound r : recent) {
                sb.append("\n第").append(r.roundNumber()).append("轮：");
                r.playerActions().forEach((who, what) ->
                        sb.append("\n  ").append(who).append("：").append(what));
                String narration = r.narration();
                if (narration.length() > 100) {
                    narration = narration.substring(0, 100) + "...";
                }
                sb.append("\n  DM：").append(narration);
            }
        }
        return sb.toString();
    }

    /**
     * 恢复结果
     *
     * @param appliedTimeoutSeconds 本次生效的回合超时，未修改为空
     * @param appliedNote           本次生效的补充说明，未设置为空
     * @param admittedPlayers       被接纳为正式玩家的候补
     */
    public record ResumeOutcome(Integer appliedTimeoutSeconds, String appliedNote, List<Player> admittedPlayers) {
    }
}
