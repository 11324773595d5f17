package com.textworld.adventureservice.games.textworld.domain.model;

import lombok.Data;

/**
 * 暂停期间由房主暂存、恢复时一次性生效的配置
 */
@Data
public class PendingConfig {
    /** 新的回合超时（秒），为空表示不修改 */
    private Integer timeoutSeconds;
    /** 房主补充说明，恢复后并入下一轮的叙事上下文 */
    private String correctionNote;

    public boolean isEmpty() {
        return timeoutSeconds == null && correctionNote == null;
    }

    public void clear() {
        timeoutSeconds = null;
        correctionNote = null;
    }
}
