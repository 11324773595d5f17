package com.textworld.adventureservice.games.textworld.service.impl;

import com.textworld.adventureservice.config.TextworldProperties;
import com.textworld.adventureservice.games.textworld.application.CreationWizard;
import com.textworld.adventureservice.games.textworld.application.LongTextFormatter;
import com.textworld.adventureservice.games.textworld.application.RoundOrchestrator;
import com.textworld.adventureservice.games.textworld.domain.constants.GameMessages;
import com.textworld.adventureservice.games.textworld.domain.dto.RoomSummary;
import com.textworld.adventureservice.games.textworld.domain.error.RoomRejection;
import com.textworld.adventureservice.games.textworld.domain.error.StateConflictException;
import com.textworld.adventureservice.games.textworld.domain.error.UserInputException;
import com.textworld.adventureservice.games.textworld.domain.model.Player;
import com.textworld.adventureservice.games.textworld.domain.model.Room;
import com.textworld.adventureservice.games.textworld.domain.registry.RoomRegistry;
import com.textworld.adventureservice.games.textworld.service.TextworldService;
import com.textworld.adventureservice.platform.transport.Broadcaster;
import com.textworld.adventureservice.platform.transport.InboundMessage;
import com.textworld.web.common.CurrentPlayerInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

@Slf4j
@Service
@RequiredArgsConstructor
public class TextworldServiceImpl implements TextworldService {

    private final RoomRegistry registry;
    private final CreationWizard wizard;
    private final RoundOrchestrator orchestrator;
    private final Broadcaster broadcaster;
    private final LongTextFormatter formatter;
    private final TextworldProperties properties;

    // ================= 创建 =================

    @Override
    public String createRoom(CurrentPlayerInfo player) {
        return wizard.start(player);
    }

    @Override
    public String quickCreate(CurrentPlayerInfo player, String roomName) {
        if (registry.isInRoom(player.playerId())) {
            throw new StateConflictException(RoomRejection.ALREADY_IN_A_ROOM);
        }
        String name = StringUtils.defaultIfBlank(roomName, GameMessages.QUICKSTART_ROOM_NAME).strip();
        if (name.length() > 30) {
            throw new UserInputException(GameMessages.ROOM_NAME_INVALID);
        }
        wizard.discard(player.playerId());
        String world = StringUtils.defaultIfBlank(properties.getWorldTemplate(), GameMessages.QUICKSTART_WORLD);
        Room room = registry.createRoom(new RoomRegistry.RoomDraft(player, name, world, null,
                properties.getDefaultTimeout(), properties.getCharCreationTimeout()));
        return GameMessages.formatQuickCreated(room.getName(), room.getId());
    }

    @Override
    public String cancelCreation(CurrentPlayerInfo player) {
        if (!wizard.discard(player.playerId())) {
            throw new StateConflictException(RoomRejection.NO_PENDING_CREATION);
        }
        return GameMessages.WIZARD_CANCELLED;
    }

    // ================= 加入/离开 =================

    @Override
    public String join(CurrentPlayerInfo player, String roomId) {
        if (StringUtils.isBlank(roomId)) {
            throw new UserInputException(GameMessages.USAGE_JOIN);
        }
        wizard.discard(player.playerId());
        RoomRegistry.JoinOutcome outcome = registry.joinRoom(roomId.strip(), player, properties.getMaxPlayersPerRoom());
        Room room = outcome.room();
        if (outcome.pending()) {
            announce(room, GameMessages.formatJoinPendingBroadcast(player.displayName()));
            return GameMessages.formatJoinedAsPending(room.getName());
        }
        announce(room, GameMessages.formatJoinBroadcast(player.displayName(), outcome.activeCount()));
        return GameMessages.formatJoined(room.getName());
    }

    @Override
    public String leave(CurrentPlayerInfo player) {
        RoomRegistry.LeaveOutcome outcome = registry.leaveRoom(player.playerId());
        Room room = outcome.room();
        if (outcome.roomClosed()) {
            announce(room, GameMessages.formatClosedByHost(room.getName()));
        } else {
            announce(room, GameMessages.formatLeaveBroadcast(player.displayName()));
            orchestrator.reconcileAfterLeave(room);
        }
        return GameMessages.formatLeft(room.getName());
    }

    // ================= 游戏 =================

    @Override
    public String begin(CurrentPlayerInfo player) {
        return orchestrator.beginCharacterCreation(player);
    }

    @Override
    public String act(CurrentPlayerInfo player, String action) {
        return orchestrator.submitAction(player, action);
    }

    @Override
    public String pause(CurrentPlayerInfo player) {
        Room room = roomOf(player);
        registry.pauseRoom(room.getId(), player.playerId());
        announce(room, GameMessages.PAUSED_BROADCAST);
        return GameMessages.PAUSED_REPLY;
    }

    @Override
    public String resume(CurrentPlayerInfo player) {
        Room room = roomOf(player);
        RoomRegistry.ResumeResult result = registry.resumeRoom(room.getId(), player.playerId());
        List<String> admitted = result.outcome().admittedPlayers().stream().map(Player::getDisplayName).toList();
        announce(room, GameMessages.formatResumed(result.currentRound(), result.outcome().appliedTimeoutSeconds(), admitted));
        return GameMessages.RESUMED_REPLY;
    }

    @Override
    public String stageTimeout(CurrentPlayerInfo player, String seconds) {
        if (StringUtils.isBlank(seconds)) {
            throw new UserInputException(GameMessages.USAGE_TIMEOUT);
        }
        int value = CreationWizard.parseTimeout(seconds);
        withPausedRoomAsHost(player, room -> room.getPendingConfig().setTimeoutSeconds(value));
        return String.format(GameMessages.TIMEOUT_STAGED, value);
    }

    @Override
    public String stageNote(CurrentPlayerInfo player, String note) {
        if (StringUtils.isBlank(note)) {
            throw new UserInputException(GameMessages.USAGE_NOTE);
        }
        withPausedRoomAsHost(player, room -> room.getPendingConfig().setCorrectionNote(note.strip()));
        return GameMessages.NOTE_STAGED;
    }

    private void withPausedRoomAsHost(CurrentPlayerInfo player, Consumer<Room> action) {
        Room room = roomOf(player);
        room.lock();
        try {
            if (room.isClosed()) {
                throw new StateConflictException(RoomRejection.NOT_IN_ROOM);
            }
            if (!room.isHost(player.playerId())) {
                throw new StateConflictException(RoomRejection.NOT_HOST);
            }
            if (!room.isPaused()) {
                throw new StateConflictException(RoomRejection.NOT_PAUSED);
            }
            action.accept(room);
        } finally {
            room.unlock();
        }
    }

    // ================= 查询 =================

    @Override
    public String status(CurrentPlayerInfo player, String roomId) {
        Optional<Room> found = StringUtils.isBlank(roomId)
                ? registry.findRoomByPlayer(player.playerId())
                : registry.findRoom(roomId.strip());
        Room room = found.orElseThrow(() -> new StateConflictException(RoomRejection.NOT_FOUND));
        room.lock();
        try {
            StringBuilder sb = new StringBuilder();
            sb.append("📊 ").append(room.getName()).append('\n')
                    .append(GameMessages.DIVIDER).append('\n')
                    .append("🆔 ").append(room.getId()).append('\n')
                    .append("👑 ").append(hostName(room)).append('\n')
                    .append("📊 ").append(room.getPhase().icon()).append(room.getPhase().label()).append('\n')
                    .append("🔄 第").append(room.getCurrentRound()).append("轮 | ⏱️")
                    .append(room.getRoundTimeoutSeconds()).append("秒\n")
                    .append("👥 玩家(").append(room.getActivePlayers().size()).append("):\n");
            for (Player p : room.getActivePlayers()) {
                sb.append("  ").append(p.getStatus().icon()).append(' ').append(p.getDisplayName());
                if (p.hasCharacter()) {
                    sb.append(" 【").append(p.getCharacter().name()).append('】');
                }
                sb.append('\n');
            }
            if (!room.getPendingPlayers().isEmpty()) {
                sb.append("🕓 候补(").append(room.getPendingPlayers().size()).append("):\n");
                for (Player p : room.getPendingPlayers()) {
                    sb.append("  ").append(p.getStatus().icon()).append(' ').append(p.getDisplayName()).append('\n');
                }
            }
            return sb.toString().strip();
        } finally {
            room.unlock();
        }
    }

    @Override
    public String world(CurrentPlayerInfo player) {
        Room room = roomOf(player);
        String world = room.getWorldSetting();
        return formatter.format(world, "🌍 世界观 (" + world.length() + "字)");
    }

    @Override
    public String characters(CurrentPlayerInfo player) {
        Room room = roomOf(player);
        String info;
        room.lock();
        try {
            info = room.charactersInfo();
        } finally {
            room.unlock();
        }
        if (info.isEmpty()) {
            return GameMessages.ERROR_PREFIX + GameMessages.NO_CHARACTERS;
        }
        return formatter.format(info, "👥 角色列表");
    }

    @Override
    public String list() {
        List<RoomSummary> rooms = listRooms();
        if (rooms.isEmpty()) {
            return GameMessages.NO_ROOMS;
        }
        List<String> lines = new ArrayList<>();
        lines.add("🏠 房间列表");
        lines.add(GameMessages.DIVIDER);
        for (RoomSummary r : rooms) {
            lines.add(r.phase().icon() + " " + r.name() + "\n   ID: " + r.roomId() + " | 👥" + r.activePlayers());
        }
        return String.join("\n", lines);
    }

    @Override
    public String help() {
        return GameMessages.HELP;
    }

    @Override
    public List<RoomSummary> listRooms() {
        List<RoomSummary> result = new ArrayList<>();
        for (Room room : registry.allRooms()) {
            room.lock();
            try {
                if (room.isClosed()) {
                    continue;
                }
                result.add(new RoomSummary(room.getId(), room.getName(), hostName(room), room.getPhase(),
                        room.getActivePlayers().size(), room.getPendingPlayers().size(),
                        room.getCurrentRound(), room.getRoundTimeoutSeconds()));
            } finally {
                room.unlock();
            }
        }
        return result;
    }

    // ================= 关闭 =================

    @Override
    public String close(CurrentPlayerInfo player) {
        Room room = roomOf(player);
        if (!room.isHost(player.playerId())) {
            throw new StateConflictException(RoomRejection.NOT_HOST);
        }
        Set<String> addresses = addressesOf(room);
        if (registry.closeRoom(room.getId())) {
            broadcaster.broadcast(addresses, GameMessages.formatClosedByHost(room.getName()));
        }
        return GameMessages.ROOM_CLOSED_REPLY;
    }

    @Override
    public String adminClose(CurrentPlayerInfo player, String roomId) {
        requireAdmin(player);
        if (StringUtils.isBlank(roomId)) {
            throw new UserInputException(GameMessages.USAGE_ADMIN);
        }
        Room room = registry.findRoom(roomId.strip())
                .orElseThrow(() -> new StateConflictException(RoomRejection.NOT_FOUND));
        Set<String> addresses = addressesOf(room);
        if (!registry.closeRoom(room.getId())) {
            throw new StateConflictException(RoomRejection.NOT_FOUND);
        }
        log.info("管理员关闭房间: admin={}, roomId={}", player.playerId(), room.getId());
        broadcaster.broadcast(addresses, GameMessages.formatClosedByAdmin(room.getName()));
        return GameMessages.formatAdminClosed(room.getName());
    }

    @Override
    public String adminList(CurrentPlayerInfo player) {
        requireAdmin(player);
        List<RoomSummary> rooms = listRooms();
        if (rooms.isEmpty()) {
            return GameMessages.NO_ROOMS_ADMIN;
        }
        List<String> lines = new ArrayList<>();
        lines.add("🔧 管理员视图");
        lines.add(GameMessages.DIVIDER);
        for (RoomSummary r : rooms) {
            lines.add("📍 " + r.name() + "\n"
                    + "   ID: " + r.roomId() + "\n"
                    + "   房主: " + r.hostName() + "\n"
                    + "   状态: " + r.phase().label() + "\n"
                    + "   玩家: " + r.activePlayers() + (r.pendingPlayers() > 0 ? " (+" + r.pendingPlayers() + " 候补)" : ""));
        }
        return String.join("\n", lines);
    }

    // ================= 自由文本 =================

    @Override
    public List<String> handleFreeText(InboundMessage message) {
        CurrentPlayerInfo sender = message.sender();
        if (wizard.hasPending(sender.playerId())) {
            return wizard.handleInput(sender, message.text(), message.fileAttachment());
        }
        if (message.text().isEmpty()) {
            return List.of();
        }
        return orchestrator.submitCharacter(sender, message.text()).map(List::of).orElse(List.of());
    }

    // ================= 工具 =================

    private Room roomOf(CurrentPlayerInfo player) {
        return registry.findRoomByPlayer(player.playerId())
                .orElseThrow(() -> new StateConflictException(RoomRejection.NOT_IN_ROOM));
    }

    private void requireAdmin(CurrentPlayerInfo player) {
        if (!properties.isAdmin(player.playerId())) {
            throw new StateConflictException(RoomRejection.NOT_ADMIN);
        }
    }

    private static String hostName(Room room) {
        return room.findPlayer(room.getHostId()).map(Player::getDisplayName).orElse("?");
    }

    private static Set<String> addressesOf(Room room) {
        room.lock();
        try {
            return room.uniqueAddresses();
        } finally {
            room.unlock();
        }
    }

    /** 锁内快照地址、锁外广播 */
    private void announce(Room room, String text) {
        broadcaster.broadcast(addressesOf(room), text);
    }
}
