/**
 * 通信协议适配层：服务器与客户端之间交换的消息结构。
 * <p>
 * 入站：STOMP / HTTP 收到的文本与附件先转换成 {@link com.textworld.adventureservice.platform.transport.InboundMessage}，
 * 交给命令分发；出站：直接回复与房间广播都包装成 {@link com.textworld.adventureservice.platform.transport.Envelope}。
 * 本层不关心任何房间/回合逻辑。
 */
package com.textworld.adventureservice.platform.transport;
