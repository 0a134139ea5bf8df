package com.dinoroyale.matchservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * WebSocket 断连工具类：同一玩家重复连接时通知并断开旧连接。
 */
@Slf4j
@Component
public class WebSocketDisconnectHelper {

    /** 踢人消息的目标队列地址 */
    private static final String KICK_DESTINATION = "/queue/system.kick";

    private final SimpMessagingTemplate messagingTemplate;

    /** 客户端入站消息通道，用于强制断开连接 */
    private final MessageChannel clientInboundChannel;

    public WebSocketDisconnectHelper(SimpMessagingTemplate messagingTemplate,
                                     @Qualifier("clientInboundChannel") MessageChannel clientInboundChannel) {
        this.messagingTemplate = messagingTemplate;
        this.clientInboundChannel = clientInboundChannel;
    }

    /**
     * 只发给指定会话的踢人通知。
     */
    public void sendKickMessage(String playerId, String sessionId, String reason) {
        try {
            SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
            headerAccessor.setSessionId(sessionId);
            headerAccessor.setLeaveMutable(true);
            messagingTemplate.convertAndSendToUser(
                    playerId,
                    KICK_DESTINATION,
                    Map.of("type", "WS_KICK", "reason", reason),
                    headerAccessor.getMessageHeaders());
        } catch (Exception e) {
            log.warn("发送踢人通知失败: playerId={}, sessionId={}", playerId, sessionId, e);
        }
    }

    /**
     * 向入站通道投递 DISCONNECT，由框架关闭该会话。
     */
    public void forceDisconnect(String sessionId) {
        try {
            StompHeaderAccessor header = StompHeaderAccessor.create(StompCommand.DISCONNECT);
            header.setSessionId(sessionId);
            header.setLeaveMutable(true);
            clientInboundChannel.send(MessageBuilder.createMessage(new byte[0], header.getMessageHeaders()));
        } catch (Exception e) {
            log.warn("强制断开连接失败: sessionId={}", sessionId, e);
        }
    }
}
