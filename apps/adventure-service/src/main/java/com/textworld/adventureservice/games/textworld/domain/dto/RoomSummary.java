package com.textworld.adventureservice.games.textworld.domain.dto;

import com.textworld.adventureservice.games.textworld.domain.enums.RoomPhase;

/**
 * 大厅列表中的一个房间（只读快照）
 */
public record RoomSummary(String roomId,
                          String name,
                          String hostName,
                          RoomPhase phase,
                          int activePlayers,
                          int pendingPlayers,
                          int currentRound,
                          int roundTimeoutSeconds) {
}
