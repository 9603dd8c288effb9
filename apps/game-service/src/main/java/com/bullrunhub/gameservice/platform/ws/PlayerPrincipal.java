package com.bullrunhub.gameservice.platform.ws;

import java.security.Principal;

/**
 * 连接级玩家身份：name 即 playerId（STOMP 会话 id），私有队列按它路由。
 */
public record PlayerPrincipal(String playerId) implements Principal {

    @Override
    public String getName() {
        return playerId;
    }
}
