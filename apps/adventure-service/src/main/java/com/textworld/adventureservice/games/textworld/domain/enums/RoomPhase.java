package com.textworld.adventureservice.games.textworld.domain.enums;

/**
 * 房间生命周期阶段
 */
public enum RoomPhase {

    WAITING("⏳", "等待中"),                 // 等待开始（可加入）
    CHARACTER_CREATION("🎭", "角色创建"),    // 角色创建中（不可加入）
    ACTIVE("🎮", "游戏中"),                  // 回合进行中（允许行动）
    PAUSED("⏸️", "已暂停"),                  // 房主暂停（加入者进入候补）
    CLOSED("🚫", "已关闭");                  // 已关闭（随即从注册表移除）

    private final String icon;
    private final String label;

    RoomPhase(String icon, String label) {
        this.icon = icon;
        this.label = label;
    }

    public String icon() { return icon; }
    public String label() { return label; }

    /** 游戏是否已经开始（不再接受普通加入） */
    public boolean started() {
        return this == CHARACTER_CREATION || this == ACTIVE;
    }
}
