package com.example.fishbowl.presence;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.example.fishbowl.game.domain.entity.Player;
import com.example.fishbowl.game.event.PlayerPresenceEvent;
import com.example.fishbowl.game.repository.PlayerRepository;
import com.example.fishbowl.game.service.GameFlowFacade;
import com.example.fishbowl.global.error.CommonException;
import com.example.fishbowl.global.error.ErrorCode;

/**
 * 플레이어 접속 상태 관리.
 * Player.connected 의 유일한 작성자이며, 턴 순서 탐색은 이 값을 읽기만 한다.
 *
 * - 현재 턴 플레이어가 진행 중(turn_active)에 끊기면 턴 자동 일시정지
 * - 같은 플레이어가 다시 접속하면 자동 재개
 * - 여러 기기: 가장 최근 세션만 플레이어 키에 기록되고, 예전 세션이 끊겨도 접속 상태는 유지된다
 *   최신 세션이 먼저 끊기면 남은 세션의 하트비트가 플레이어 키와 접속 상태를 되살린다
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PresenceService {

    private final PlayerSessionRepository sessionRepository;
    private final PlayerRepository playerRepository;
    private final GameFlowFacade gameFlowFacade;
    private final ApplicationEventPublisher eventPublisher;

    public void connect(String gameId, String playerId, String sessionId) {
        Player player = playerRepository.findByIdAndGameId(playerId, gameId)
                .orElseThrow(() -> ErrorCode.PLAYER_NOT_IN_GAME.commonException(
                        Map.of("gameId", gameId, "playerId", playerId)));

        sessionRepository.save(PlayerSession.builder()
                .sessionId(sessionId)
                .gameId(gameId)
                .playerId(playerId)
                .connectedAt(System.currentTimeMillis())
                .build());

        if (!player.isConnected()) {
            markConnected(gameId, playerId, sessionId);
        } else {
            log.debug("플레이어 세션 등록: gameId={}, playerId={}, sessionId={}", gameId, playerId, sessionId);
        }
    }

    public void disconnect(String sessionId) {
        sessionRepository.findBySessionId(sessionId).ifPresentOrElse(session -> {
            sessionRepository.deleteSession(sessionId);

            // 다른 기기로 이미 다시 접속한 경우에는 접속 상태를 유지
            boolean latestSession = sessionRepository.findSessionIdByPlayerId(session.getPlayerId())
                    .map(sessionId::equals)
                    .orElse(true);
            if (!latestSession) {
                log.debug("이전 세션 종료, 최신 세션 유지: playerId={}, sessionId={}", session.getPlayerId(), sessionId);
                return;
            }
            sessionRepository.deletePlayerIndex(session.getPlayerId());
            markDisconnected(session.getGameId(), session.getPlayerId());
        }, () -> log.debug("알 수 없는 세션 종료 무시: sessionId={}", sessionId));
    }

    /**
     * 살아 있는 세션의 TTL을 연장한다.
     * 최신 세션이 끊겨 끊김 처리된 플레이어라도 남은 기기의 하트비트가 오면 다시 접속 상태로 되돌린다.
     *
     * @return 세션이 살아 있어 TTL을 연장했으면 true
     */
    public boolean heartbeat(String sessionId) {
        Optional<PlayerSession> found = sessionRepository.findBySessionId(sessionId);
        if (found.isEmpty() || !sessionRepository.touch(found.get())) {
            return false;
        }
        PlayerSession session = found.get();
        playerRepository.findByIdAndGameId(session.getPlayerId(), session.getGameId())
                .filter(player -> !player.isConnected())
                .ifPresent(player -> markConnected(session.getGameId(), session.getPlayerId(), sessionId));
        return true;
    }

    /**
     * 명시적 나가기 (모든 기기)
     */
    public void leave(String gameId, String playerId) {
        sessionRepository.findSessionIdByPlayerId(playerId).ifPresent(sessionRepository::deleteSession);
        sessionRepository.deletePlayerIndex(playerId);
        markDisconnected(gameId, playerId);
    }

    /**
     * TTL이 지나 Redis에서 사라진 플레이어를 끊김 처리
     *
     * @return 끊김 처리한 플레이어 수
     */
    public int expireStaleSessions() {
        List<Player> connected = playerRepository.findAllByConnectedTrue();
        int expired = 0;
        for (Player player : connected) {
            if (!sessionRepository.existsByPlayerId(player.getId())) {
                markDisconnected(player.getGameId(), player.getId());
                expired++;
            }
        }
        if (expired > 0) {
            log.info("만료된 접속 정리: expired={}", expired);
        }
        return expired;
    }

    private void markConnected(String gameId, String playerId, String sessionId) {
        playerRepository.updateConnected(playerId, true, LocalDateTime.now());
        eventPublisher.publishEvent(new PlayerPresenceEvent(gameId, playerId, true));
        log.info("플레이어 재접속: gameId={}, playerId={}, sessionId={}", gameId, playerId, sessionId);
        resumeIfPausedByDisconnect(gameId, playerId);
    }

    private void markDisconnected(String gameId, String playerId) {
        int updated = playerRepository.updateConnected(playerId, false, LocalDateTime.now());
        if (updated == 0) {
            log.warn("접속 해제 대상 플레이어 없음: gameId={}, playerId={}", gameId, playerId);
            return;
        }
        eventPublisher.publishEvent(new PlayerPresenceEvent(gameId, playerId, false));
        log.info("플레이어 접속 끊김: gameId={}, playerId={}", gameId, playerId);

        try {
            if (gameFlowFacade.pauseForDisconnect(gameId, playerId)) {
                log.info("현재 턴 플레이어 접속 끊김으로 턴 일시정지: gameId={}, playerId={}", gameId, playerId);
            }
        } catch (CommonException e) {
            // 게임이 삭제되었거나 이미 다른 요청이 상태를 바꾼 경우
            log.warn("접속 끊김 처리 중 턴 일시정지 실패: gameId={}, playerId={}, code={}", gameId, playerId,
                    e.getErrorCode().getCode());
        }
    }

    private void resumeIfPausedByDisconnect(String gameId, String playerId) {
        try {
            if (gameFlowFacade.resumeForReconnect(gameId, playerId)) {
                log.info("현재 턴 플레이어 재접속으로 턴 재개: gameId={}, playerId={}", gameId, playerId);
            }
        } catch (CommonException e) {
            log.warn("재접속 처리 중 턴 재개 실패: gameId={}, playerId={}, code={}", gameId, playerId,
                    e.getErrorCode().getCode());
        }
    }
}
