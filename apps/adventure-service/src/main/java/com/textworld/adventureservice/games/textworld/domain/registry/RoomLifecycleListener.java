package com.textworld.adventureservice.games.textworld.domain.registry;

import com.textworld.adventureservice.games.textworld.domain.model.Room;

/**
 * 房间生命周期回调。除 {@link #afterRoomResumed} 外，所有回调都在持有该房间锁时同步调用，实现不得做阻塞 I/O。
 */
public interface RoomLifecycleListener {

    /** 房间已标记关闭，即将从注册表移除 */
    default void onRoomClosed(Room room) {}

    /** 房间已暂停 */
    default void onRoomPaused(Room room) {}

    /** 房间已恢复（暂存配置已生效、候补已接纳） */
    default void onRoomResumed(Room room) {}

    /** 恢复完成且房间锁已释放，可在此推进暂停期间被搁置的流程 */
    default void afterRoomResumed(Room room) {}
}
