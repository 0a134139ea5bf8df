package com.dinoroyale.matchservice.platform.ws;

import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.messaging.support.MessageHeaderAccessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class WebSocketPlayerChannelInterceptorTest {

    private final WebSocketPlayerChannelInterceptor interceptor = new WebSocketPlayerChannelInterceptor();
    private final MessageChannel channel = mock(MessageChannel.class);

    private static Message<byte[]> connect(String playerId, String playerName) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
        if (playerId != null) accessor.addNativeHeader("player-id", playerId);
        if (playerName != null) accessor.addNativeHeader("player-name", playerName);
        accessor.setSessionId("s1");
        accessor.setLeaveMutable(true);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    private static StompHeaderAccessor accessorOf(Message<?> message) {
        return MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
    }

    @Test
    void connectHeaderEstablishesPlayer() {
        Message<?> out = interceptor.preSend(connect(" p1 ", "Alice"), channel);

        assertThat(accessorOf(out).getUser()).isEqualTo(new PlayerPrincipal("p1", "Alice"));
        assertThat(accessorOf(out).getUser().getName()).isEqualTo("p1");
    }

    @Test
    void nameDefaultsToPlayerId() {
        Message<?> out = interceptor.preSend(connect("p2", null), channel);

        assertThat(accessorOf(out).getUser()).isEqualTo(new PlayerPrincipal("p2", "p2"));
    }

    @Test
    void missingPlayerIdLeavesSessionAnonymous() {
        Message<?> out = interceptor.preSend(connect(null, "Alice"), channel);

        assertThat(accessorOf(out).getUser()).isNull();
    }
}
