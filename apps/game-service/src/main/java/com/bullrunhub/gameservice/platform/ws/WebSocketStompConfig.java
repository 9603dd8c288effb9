package com.bullrunhub.gameservice.platform.ws;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket + STOMP 配置类
 * ----------------------------------------
 * 客户端通过 /ws 端点连接，
 * 使用 /app 前缀发送指令、/topic 订阅房间广播、/user/queue 接收私有消息。
 *
 * 用途：
 *   - /app/bullrun.* : 客户端指令（如 /app/bullrun.joinRoom）
 *   - /topic/bullrun.room.{code} : 房间广播
 *   - /user/queue/bullrun.events、/user/queue/bullrun.reply : 私有事件与指令应答
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    private final PlayerIdentityChannelInterceptor identityInterceptor;

    public WebSocketStompConfig(PlayerIdentityChannelInterceptor identityInterceptor) {
        this.identityInterceptor = identityInterceptor;
    }

    /**
     * 心跳用的 TaskScheduler。
     * 使用不同的 bean 名称避免与 Spring 自动配置冲突。
     */
    @Bean(name = "wsHeartbeatTaskScheduler")
    public TaskScheduler wsHeartbeatTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*");
        // SockJS 回退
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }

    /**
     * 消息路由：内存 broker 负责 /topic 与 /queue，心跳 [客户端, 服务端] 各 5 秒
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(new long[]{5000, 5000})
                .setTaskScheduler(wsHeartbeatTaskScheduler());
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    /**
     * CONNECT 阶段为连接绑定玩家身份
     */
    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(identityInterceptor);
    }
}
