package com.example.fishbowl.game.service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.fishbowl.game.domain.entity.Game;
import com.example.fishbowl.game.domain.entity.Player;
import com.example.fishbowl.game.domain.entity.Turn;
import com.example.fishbowl.game.dto.response.GameSnapshot;
import com.example.fishbowl.game.dto.response.PlayerSummary;
import com.example.fishbowl.game.dto.response.TurnOrderResponse;
import com.example.fishbowl.game.dto.response.TurnSummary;
import com.example.fishbowl.game.repository.GameRepository;
import com.example.fishbowl.game.repository.PlayerRepository;
import com.example.fishbowl.game.repository.TeamRepository;
import com.example.fishbowl.game.repository.TurnOrderNodeRepository;
import com.example.fishbowl.game.repository.TurnRepository;
import com.example.fishbowl.game.turnorder.RingIntegrityChecker;
import com.example.fishbowl.game.turnorder.TurnNavigator;
import com.example.fishbowl.global.error.ErrorCode;

/**
 * 게임 조회 전용 서비스
 * - 게임 스냅샷 (팀 점수, 현재 턴 포함)
 * - 플레이어 목록, 턴 기록
 * - 턴 순서 링과 무결성 진단
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class GameQueryService {

    private final GameRepository gameRepository;
    private final TeamRepository teamRepository;
    private final PlayerRepository playerRepository;
    private final TurnRepository turnRepository;
    private final TurnOrderNodeRepository turnOrderNodeRepository;
    private final TurnNavigator turnNavigator;
    private final RingIntegrityChecker ringIntegrityChecker;

    // ================= 게임 조회 =================

    public Game getGame(String gameId) {
        return gameRepository.findById(gameId)
                .orElseThrow(() -> ErrorCode.GAME_NOT_FOUND.commonException(Map.of("gameId", gameId)));
    }

    public GameSnapshot getSnapshot(String gameId) {
        return snapshot(getGame(gameId));
    }

    /**
     * 이미 조회한 게임 엔티티로 스냅샷 생성 (호출자 트랜잭션에 참여)
     */
    public GameSnapshot snapshot(Game game) {
        Turn currentTurn = game.getCurrentTurnId() == null ? null
                : turnRepository.findById(game.getCurrentTurnId()).orElse(null);
        return GameSnapshot.of(game, teamRepository.findAllByGameIdOrderBySlotAsc(game.getId()), currentTurn);
    }

    // ================= 플레이어 / 턴 =================

    public List<PlayerSummary> getPlayers(String gameId) {
        getGame(gameId);
        return playerRepository.findAllByGameIdOrderByCreatedAtAsc(gameId).stream()
                .map(PlayerSummary::from)
                .toList();
    }

    public Player getPlayer(String gameId, String playerId) {
        return playerRepository.findByIdAndGameId(playerId, gameId)
                .orElseThrow(() -> ErrorCode.PLAYER_NOT_FOUND.commonException(Map.of("playerId", playerId)));
    }

    public List<TurnSummary> getTurns(String gameId) {
        getGame(gameId);
        return turnRepository.findAllByGameIdOrderByCreatedAtAsc(gameId).stream()
                .map(TurnSummary::from)
                .toList();
    }

    // ================= 턴 순서 =================

    public TurnOrderResponse getTurnOrder(String gameId) {
        getGame(gameId);
        Map<String, Player> players = playerRepository.findAllByGameIdOrderByCreatedAtAsc(gameId).stream()
                .collect(Collectors.toMap(Player::getId, Function.identity()));

        List<TurnOrderResponse.Entry> ring = turnOrderNodeRepository.findAllByGameIdOrderByPositionAsc(gameId).stream()
                .map(node -> {
                    Player player = players.get(node.getPlayerId());
                    return new TurnOrderResponse.Entry(
                            node.getPosition(),
                            node.getPlayerId(),
                            player != null ? player.getName() : null,
                            node.getTeamId(),
                            node.getNextPlayerId(),
                            node.getPrevPlayerId(),
                            player != null && player.isConnected());
                })
                .toList();

        return new TurnOrderResponse(gameId, ring,
                turnNavigator.activePlayersInTurnOrder(gameId),
                ringIntegrityChecker.check(gameId));
    }
}
