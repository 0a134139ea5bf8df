package com.dinoroyale.matchservice.platform.ws;

import java.security.Principal;

/**
 * STOMP 会话上的玩家身份。getName() 即玩家 ID，也是 /user/{id}/... 点对点路由的依据。
 */
public record PlayerPrincipal(String playerId, String displayName) implements Principal {

    @Override
    public String getName() {
        return playerId;
    }
}
