package com.textworld.adventureservice.games.textworld.domain.model;

import com.textworld.adventureservice.games.textworld.domain.enums.CreationStep;
import lombok.Getter;
import lombok.Setter;

/**
 * 某个玩家正在进行中的房间创建向导
 */
@Getter
@Setter
public class PendingCreation {
    private final String playerId;
    private final String playerName;
    private final String replyAddress;

    private CreationStep step = CreationStep.ROOM_NAME;
    private String roomName;
    private Integer timeoutSeconds;
    private String worldSetting;
    /** 世界观过长时暂存的原文；被新输入替换后清空 */
    private String originalWorldSetting;
    /** 向导开始时间（毫秒），用于惰性超时判断 */
    private long createdAt;

    public PendingCreation(String playerId, String playerName, String replyAddress, long createdAt) {
        this.playerId = playerId;
        this.playerName = playerName;
        this.replyAddress = replyAddress;
        this.createdAt = createdAt;
    }

    /** 重来：清空已填内容，保留身份 */
    public void restart(long now) {
        step = CreationStep.ROOM_NAME;
        roomName = null;
        timeoutSeconds = null;
        worldSetting = null;
        originalWorldSetting = null;
        createdAt = now;
    }

    public boolean expired(long now, long timeoutMillis) {
        return now - createdAt > timeoutMillis;
    }
}
