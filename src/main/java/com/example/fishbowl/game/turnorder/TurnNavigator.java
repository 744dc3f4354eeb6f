package com.example.fishbowl.game.turnorder;

import java.util.List;
import java.util.Optional;
import java.util.Random;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.fishbowl.game.domain.entity.Game;
import com.example.fishbowl.game.domain.entity.Player;
import com.example.fishbowl.game.domain.entity.TurnOrderNode;
import com.example.fishbowl.game.repository.GameRepository;
import com.example.fishbowl.game.repository.PlayerRepository;
import com.example.fishbowl.game.repository.TurnOrderNodeRepository;
import com.example.fishbowl.game.repository.TurnRepository;
import com.example.fishbowl.global.error.ErrorCode;
import com.example.fishbowl.global.error.TurnOrderIntegrityException;

/**
 * 턴 순서 링 탐색 (읽기 전용)
 * - 접속이 끊긴 플레이어는 건너뛴다
 * - 링 크기만큼만 이동하므로 링이 깨져 있어도 무한 루프에 빠지지 않는다
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TurnNavigator {

    private final TurnOrderNodeRepository turnOrderNodeRepository;
    private final PlayerRepository playerRepository;
    private final GameRepository gameRepository;
    private final TurnRepository turnRepository;
    private final Random gameRandom;

    /**
     * 현재 플레이어 다음으로 접속 중인 플레이어.
     * 한 바퀴를 돌아 자기 자신에게 돌아오면, 자신이 접속 중일 때만 자신을 반환한다.
     *
     * @return 비어 있으면 턴을 넘길 수 있는 플레이어가 없음
     */
    public Optional<String> nextPlayer(String gameId, String currentPlayerId) {
        TurnOrderNode current = findNode(gameId, currentPlayerId);
        long ringSize = turnOrderNodeRepository.countByGameId(gameId);

        String candidateId = current.getNextPlayerId();
        for (long hop = 1; hop <= ringSize; hop++) {
            if (isConnected(gameId, candidateId)) {
                return Optional.of(candidateId);
            }
            if (candidateId.equals(currentPlayerId)) {
                break;
            }
            candidateId = findNode(gameId, candidateId).getNextPlayerId();
        }

        log.warn("다음 턴을 받을 접속자가 없음: gameId={}, from={}", gameId, currentPlayerId);
        return Optional.empty();
    }

    /**
     * 현재 턴을 진행 중인 플레이어 (현재 턴이 없으면 empty)
     */
    public Optional<String> currentPlayer(String gameId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(ErrorCode.GAME_NOT_FOUND::commonException);
        if (game.getCurrentTurnId() == null) {
            return Optional.empty();
        }
        return turnRepository.findById(game.getCurrentTurnId())
                .map(turn -> turn.getPlayerId());
    }

    /**
     * 링에 있는 접속자 중 무작위 한 명 (링이 비었거나 모두 끊겼으면 empty)
     */
    public Optional<String> randomStartPlayer(String gameId) {
        List<String> connected = turnOrderNodeRepository.findConnectedPlayerIds(gameId);
        if (connected.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(connected.get(gameRandom.nextInt(connected.size())));
    }

    /**
     * 접속 중인 플레이어를 드래프트 순서대로
     */
    public List<String> activePlayersInTurnOrder(String gameId) {
        return turnOrderNodeRepository.findConnectedPlayerIds(gameId);
    }

    private TurnOrderNode findNode(String gameId, String playerId) {
        return turnOrderNodeRepository.findByGameIdAndPlayerId(gameId, playerId)
                .orElseThrow(() -> {
                    log.error("턴 순서 노드 없음: gameId={}, playerId={}", gameId, playerId);
                    return new TurnOrderIntegrityException(gameId, "missing turn order node for player " + playerId);
                });
    }

    private boolean isConnected(String gameId, String playerId) {
        Player player = playerRepository.findByIdAndGameId(playerId, gameId)
                .orElseThrow(() -> {
                    log.error("링에 있는 플레이어가 존재하지 않음: gameId={}, playerId={}", gameId, playerId);
                    return new TurnOrderIntegrityException(gameId, "turn order references unknown player " + playerId);
                });
        return player.isConnected();
    }
}
