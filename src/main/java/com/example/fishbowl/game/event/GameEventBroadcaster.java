package com.example.fishbowl.game.event;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 게임 이벤트를 WebSocket(STOMP)으로 전달.
 * 트랜잭션이 커밋된 뒤에만 전송되므로 롤백된 전이는 클라이언트에 보이지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameEventBroadcaster {

    private static final String GAME_TOPIC_PREFIX = "/topic/game.";

    private final SimpMessagingTemplate messagingTemplate;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onGameEvent(GameEvent event) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", event.type());
        message.put("payload", event);

        try {
            messagingTemplate.convertAndSend(GAME_TOPIC_PREFIX + event.gameId(), message);
            log.debug("게임 이벤트 전송: gameId={}, type={}", event.gameId(), event.type());
        } catch (MessagingException e) {
            // 커밋은 이미 끝났으므로 전송 실패가 상태를 되돌리지는 않는다
            log.error("게임 이벤트 전송 실패: gameId={}, type={}", event.gameId(), event.type(), e);
        }
    }
}
