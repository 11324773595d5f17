package com.textworld.adventureservice.platform.transport;

import java.util.Collection;

/**
 * 房间广播出口。尽力送达：单个地址发送失败只记录日志，不影响其他地址，也不抛给调用方。
 * 调用方不得在持有房间锁时调用。
 */
public interface Broadcaster {

    /**
     * @param addresses 回复地址（调用方已去重）
     * @param text      消息文本
     */
    void broadcast(Collection<String> addresses, String text);
}
