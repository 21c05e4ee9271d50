package com.chesshub.gameservice.platform.ws;

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
import java.util.UUID;

/**
 * WebSocket STOMP 身份拦截器
 *
 * 不做认证：在 CONNECT 阶段为连接分配参与者身份，供后续消息处理使用。
 * 客户端可通过 participant-id 头沿用自己的ID，否则分配随机 UUID。
 * 仅处理 CONNECT 命令，其他消息直接放行。
 * <p>participant-id 由客户端自报、服务端照单全收：持有相同ID的连接即被视为同一参与者（包括座位与断线处理）。
 */
@Slf4j
@Component
public class ParticipantChannelInterceptor implements ChannelInterceptor {

    static final String PARTICIPANT_HEADER = "participant-id";
    private static final int MAX_ID_LENGTH = 64;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null) {
            accessor = StompHeaderAccessor.wrap(message);
        }
        if (StompCommand.CONNECT.equals(accessor.getCommand()) && accessor.getUser() == null) {
            String requested = StringUtils.trimToNull(firstHeader(accessor, PARTICIPANT_HEADER));
            String id = (requested != null && requested.length() <= MAX_ID_LENGTH)
                    ? requested
                    : UUID.randomUUID().toString();
            accessor.setUser(new ParticipantPrincipal(id));
            log.debug("STOMP 连接分配参与者: session={}, participant={}", accessor.getSessionId(), id);
        }
        return message;
    }

    /**
     * 从 STOMP header 中提取指定 key 的第一个值
     */
    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
