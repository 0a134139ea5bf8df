package com.dinoroyale.matchservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * WebSocket STOMP 玩家身份拦截器
 *
 * 在 STOMP CONNECT 阶段读取 player-id（可选 player-name）头并设置会话用户。
 * 身份由上游可信组件下发，这里不做签名校验。
 * 缺少 player-id 时不设置用户，后续连接登记与指令处理都会忽略该会话。
 */
@Slf4j
@Component
public class WebSocketPlayerChannelInterceptor implements ChannelInterceptor {

    public static final String PLAYER_ID_HEADER = "player-id";
    public static final String PLAYER_NAME_HEADER = "player-name";

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }
        String playerId = StringUtils.trimToNull(firstHeader(accessor, PLAYER_ID_HEADER));
        if (playerId == null) {
            log.warn("STOMP CONNECT 缺少 {} 头，session={}", PLAYER_ID_HEADER, accessor.getSessionId());
            return message;
        }
        String name = StringUtils.defaultIfBlank(firstHeader(accessor, PLAYER_NAME_HEADER), playerId);
        accessor.setUser(new PlayerPrincipal(playerId, name));
        return message;
    }

    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
