package com.textworld.adventureservice.games.textworld.domain.error;

/**
 * 房间/回合操作被拒绝的原因。拒绝不改变任何状态，只回复给发起者。
 */
public enum RoomRejection {

    // ---- 创建 ----
    AT_CAPACITY("房间数量已满，请稍后再试"),
    CREATOR_ALREADY_IN_ROOM("你已在其他房间中，请先退出再创建"),
    CREATION_IN_PROGRESS("你有正在进行的房间创建，请先完成或发送 /tw cancel 取消"),
    NO_PENDING_CREATION("你没有正在进行的房间创建"),

    // ---- 加入/离开 ----
    NOT_FOUND("房间不存在", true),
    CLOSED("房间已关闭", true),
    ALREADY_STARTED("游戏已经开始，无法加入"),
    ALREADY_IN_A_ROOM("你已在房间中，请先 /tw leave"),
    FULL("房间已满"),
    NOT_IN_ROOM("你不在任何房间中", true),

    // ---- 房主操作 ----
    NOT_HOST("只有房主可以执行此操作"),
    NOT_ADMIN("仅管理员可以执行此操作"),
    ALREADY_PAUSED("房间已经处于暂停状态"),
    NOT_PAUSED("房间未暂停"),
    CANNOT_BEGIN("当前阶段无法开始游戏"),

    // ---- 行动 ----
    ROOM_PAUSED("房间已暂停，请等待房主恢复"),
    GAME_NOT_STARTED("游戏尚未开始"),
    NOT_ACTIVE_PLAYER("你是候补玩家，房间恢复后才能行动"),
    ALREADY_ACTED("你本轮已经行动过了，请等待其他玩家"),
    ROUND_RESOLVING("DM 正在书写本轮结果，请稍候");

    private final String message;
    private final boolean notFound;

    RoomRejection(String message) {
        this(message, false);
    }

    RoomRejection(String message, boolean notFound) {
        this.message = message;
        this.notFound = notFound;
    }

    public String message() { return message; }

    /** 是否属于“找不到目标”一类（HTTP 映射为 404） */
    public boolean notFound() { return notFound; }
}
