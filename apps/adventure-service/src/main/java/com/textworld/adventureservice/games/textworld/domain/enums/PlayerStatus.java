package com.textworld.adventureservice.games.textworld.domain.enums;

/**
 * 玩家状态。合法取值由所在房间的阶段决定：
 * 角色创建阶段只有 CREATING_CHARACTER / CHARACTER_DONE；
 * 游戏阶段只有 ACTIVE / ACTED / TIMED_OUT。
 */
public enum PlayerStatus {
    ACTIVE("⏳"),
    PENDING("🕓"),
    TIMED_OUT("⏰"),
    ACTED("✅"),
    CREATING_CHARACTER("📝"),
    CHARACTER_DONE("✅");

    private final String icon;

    PlayerStatus(String icon) {
        this.icon = icon;
    }

    public String icon() { return icon; }
}
