package com.example.fishbowl.presence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import com.example.fishbowl.global.error.CommonException;

/**
 * STOMP 연결/해제 이벤트를 접속 상태로 반영.
 * CONNECT 프레임의 gameId, playerId 헤더로 플레이어를 식별한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PresenceEventListener {

    static final String GAME_ID_HEADER = "gameId";
    static final String PLAYER_ID_HEADER = "playerId";

    private final PresenceService presenceService;

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();
        String gameId = accessor.getFirstNativeHeader(GAME_ID_HEADER);
        String playerId = accessor.getFirstNativeHeader(PLAYER_ID_HEADER);

        if (!StringUtils.hasText(gameId) || !StringUtils.hasText(playerId)) {
            log.warn("플레이어 정보 없는 WebSocket 연결: sessionId={}", sessionId);
            return;
        }

        try {
            presenceService.connect(gameId, playerId, sessionId);
        } catch (CommonException e) {
            log.warn("WebSocket 연결 등록 실패: sessionId={}, gameId={}, playerId={}, code={}", sessionId, gameId,
                    playerId, e.getErrorCode().getCode());
        }
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        presenceService.disconnect(event.getSessionId());
    }
}
