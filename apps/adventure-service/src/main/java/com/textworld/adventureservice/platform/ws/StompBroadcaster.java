package com.textworld.adventureservice.platform.ws;

import com.textworld.adventureservice.platform.transport.Broadcaster;
import com.textworld.adventureservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * 基于 STOMP 简单代理的广播：每个回复地址对应一个收件箱主题 /topic/inbox.{address}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompBroadcaster implements Broadcaster {

    public static final String INBOX_PREFIX = "/topic/inbox.";

    private final SimpMessagingTemplate messaging;

    @Override
    public void broadcast(Collection<String> addresses, String text) {
        for (String address : addresses) {
            try {
                messaging.convertAndSend(INBOX_PREFIX + address, Envelope.broadcast(address, text));
            } catch (Exception e) {
                log.warn("广播失败: address={}, error={}", address, e.getMessage());
            }
        }
    }
}
