package com.textworld.adventureservice.platform.transport;

import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳
 * - kind：REPLY=给发起者的直接回复，BROADCAST=房间广播，ERROR=拒绝/错误通知
 * - channel：目标回复地址
 *
 * 用法示例：
 *   Envelope<String> msg = Envelope.broadcast(address, text);
 *   Envelope<String> err = Envelope.error(address, "房间已满");
 */
public record Envelope<T>(Kind kind, String channel, T payload, long ts) {

    public enum Kind { REPLY, BROADCAST, ERROR }

    public Envelope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(channel, "channel");
    }

    public static <T> Envelope<T> of(Kind kind, String channel, T payload) {
        return new Envelope<>(kind, channel, payload, Instant.now().toEpochMilli());
    }

    public static <T> Envelope<T> reply(String channel, T payload) {
        return of(Kind.REPLY, channel, payload);
    }

    public static <T> Envelope<T> broadcast(String channel, T payload) {
        return of(Kind.BROADCAST, channel, payload);
    }

    public static <T> Envelope<T> error(String channel, T payload) {
        return of(Kind.ERROR, channel, payload);
    }
}
