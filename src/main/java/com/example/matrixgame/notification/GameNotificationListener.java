package com.example.matrixgame.notification;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Slf4j
@Component
@RequiredArgsConstructor
public class GameNotificationListener {

    private final WebSocketMessageBroadcaster broadcaster;

    /**
     * Delivered only once the triggering transaction committed. Failures stay here.
     */
    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotification(GameNotification notification) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", notification.kind().name());
        message.put("gameId", notification.gameId());
        message.put("payload", notification.payload() != null ? notification.payload() : Map.of());

        try {
            if (notification.isDirect()) {
                broadcaster.sendToUser(notification.targetUserId(), message);
            } else {
                broadcaster.broadcastToGame(notification.gameId(), message);
            }
        } catch (Exception e) {
            log.error("Notification delivery failed: kind={}, gameId={}, error: {}",
                    notification.kind(), notification.gameId(), e.getMessage());
        }
    }
}
