package com.textworld.adventureservice.games.textworld.domain.enums;

/**
 * 创建向导步骤
 */
public enum CreationStep {
    ROOM_NAME,
    TIMEOUT,
    WORLD_SETTING,
    WORLD_TOO_LONG,
    SUMMARIZING,    // 等待 AI 总结返回，期间的输入一律提示稍候
    CONFIRM
}
