package com.example.matrixgame.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationContext;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.user.SimpUserRegistry;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketMessageBroadcaster {

    private final SimpMessagingTemplate messagingTemplate;
    private final ApplicationContext applicationContext;

    /**
     * Everyone subscribed to the game.
     */
    public void broadcastToGame(Long gameId, Object message) {
        messagingTemplate.convertAndSend("/topic/game." + gameId, message);
    }

    /**
     * One player, through their private queue.
     */
    public void sendToUser(String userId, Object message) {
        if (!isUserConnected(userId)) {
            log.debug("Recipient is not connected over WebSocket: {}", userId);
            return;
        }

        try {
            messagingTemplate.convertAndSendToUser(userId, "/queue/private", message);
        } catch (Exception e) {
            log.error("Private message delivery failed: userId={}, error: {}", userId, e.getMessage());
        }
    }

    private boolean isUserConnected(String userId) {
        SimpUserRegistry userRegistry = getSimpUserRegistry();
        if (userRegistry == null) {
            return true; // no registry, try anyway
        }
        return userRegistry.getUser(userId) != null;
    }

    private SimpUserRegistry getSimpUserRegistry() {
        try {
            return applicationContext.getBean(SimpUserRegistry.class);
        } catch (Exception e) {
            log.warn("SimpUserRegistry is not available: {}", e.getMessage());
            return null;
        }
    }
}
