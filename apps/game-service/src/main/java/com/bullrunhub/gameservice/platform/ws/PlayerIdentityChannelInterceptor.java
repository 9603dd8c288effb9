package com.bullrunhub.gameservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

/**
 * STOMP 身份拦截器
 *
 * 在 CONNECT 阶段把连接的会话 id 设为玩家身份，供后续指令和私有队列使用。
 * 仅处理 CONNECT 命令，其他消息直接放行。
 */
@Slf4j
@Component
public class PlayerIdentityChannelInterceptor implements ChannelInterceptor {

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null) {
            accessor = StompHeaderAccessor.wrap(message);
        }
        if (StompCommand.CONNECT.equals(accessor.getCommand()) && accessor.getUser() == null) {
            String sessionId = accessor.getSessionId();
            if (sessionId != null) {
                accessor.setUser(new PlayerPrincipal(sessionId));
                log.debug("连接已绑定玩家身份: session={}", sessionId);
            }
        }
        return message;
    }
}
