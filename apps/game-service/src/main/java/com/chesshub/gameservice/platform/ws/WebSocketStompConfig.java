package com.chesshub.gameservice.platform.ws;

import org.springframework.beans.factory.annotation.Value;
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
 *   - /ws        : 连接端点（原生 WebSocket 与 SockJS 回退）
 *   - /app/...   : 客户端发送（如 /app/tactics.submit）
 *   - /topic/... : 房间广播（/topic/room.{roomId}）
 *   - /user/queue/... : 点对点回复（创建、加入、错误、对手走子）
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    private final ParticipantChannelInterceptor participantInterceptor;
    private final String[] allowedOrigins;
    private final long heartbeatMs;

    public WebSocketStompConfig(ParticipantChannelInterceptor participantInterceptor,
                                @Value("${tactics.ws.allowed-origins:*}") String[] allowedOrigins,
                                @Value("${tactics.ws.heartbeat-ms:5000}") long heartbeatMs) {
        this.participantInterceptor = participantInterceptor;
        this.allowedOrigins = allowedOrigins;
        this.heartbeatMs = heartbeatMs;
    }

    /**
     * 心跳用 TaskScheduler。
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
                .setAllowedOriginPatterns(allowedOrigins);
        // SockJS 回退
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();
    }

    /**
     * 心跳 [客户端发送间隔, 服务端发送间隔]，单位毫秒；配置为 0 时关闭。
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        var broker = registry.enableSimpleBroker("/topic", "/queue");
        if (heartbeatMs > 0) {
            broker.setHeartbeatValue(new long[]{heartbeatMs, heartbeatMs})
                    .setTaskScheduler(wsHeartbeatTaskScheduler());
        }
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    /**
     * CONNECT 阶段为连接分配参与者身份
     */
    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(participantInterceptor);
    }
}
