package com.chesshub.gameservice.platform.ws;

import com.chesshub.gameservice.games.tactics.domain.constants.TacticsMessages;
import com.chesshub.gameservice.games.tactics.interfaces.ws.dto.TacticsWsMessages;
import com.chesshub.gameservice.games.tactics.service.TacticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;
import java.util.List;

/**
 * 监听 STOMP 断开事件：参与者离开即丢弃其所在房间，并通知房间内其他人。
 *
 * 基于 TCP 连接断开检测，覆盖正常关闭、强制关闭、网络中断等情况。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSessionManager {

    private final TacticsService tacticsService;
    private final SimpMessagingTemplate messagingTemplate;

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        Principal principal = event.getUser();
        if (principal == null) {
            log.warn("【WebSocket断开检测】收到断开事件但无法获取参与者: sessionId={}", event.getSessionId());
            return;
        }
        String participantId = principal.getName();
        List<String> discarded = tacticsService.leaveAll(participantId);
        log.info("【WebSocket断开检测】参与者断开: sessionId={}, participant={}, 丢弃房间={}",
                event.getSessionId(), participantId, discarded);

        for (String roomId : discarded) {
            TacticsWsMessages.BroadcastEvent evt = new TacticsWsMessages.BroadcastEvent(
                    roomId, TacticsWsMessages.PLAYER_LEFT, TacticsMessages.OPPONENT_LEFT);
            try {
                messagingTemplate.convertAndSend("/topic/room." + roomId, evt);
            } catch (MessagingException e) {
                log.warn("【WebSocket断开检测】广播 PLAYER_LEFT 失败: roomId={}", roomId, e);
            }
        }
    }
}
