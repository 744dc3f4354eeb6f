package com.example.fishbowl.game.service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import com.example.fishbowl.game.domain.entity.Game;
import com.example.fishbowl.game.domain.entity.Player;
import com.example.fishbowl.game.domain.entity.Team;
import com.example.fishbowl.game.domain.entity.Turn;
import com.example.fishbowl.game.domain.state.PhraseStatus;
import com.example.fishbowl.game.repository.PhraseRepository;
import com.example.fishbowl.game.repository.PlayerRepository;
import com.example.fishbowl.game.repository.TeamRepository;
import com.example.fishbowl.game.repository.TurnRepository;
import com.example.fishbowl.global.error.ErrorCode;
import com.example.fishbowl.global.error.TurnOrderIntegrityException;

/**
 * 턴 생성/종료와 점수 반영.
 * 트랜잭션을 직접 열지 않고 GameFlowService 의 트랜잭션 안에서만 호출된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnLifecycleService {

    private final TurnRepository turnRepository;
    private final PlayerRepository playerRepository;
    private final TeamRepository teamRepository;
    private final PhraseRepository phraseRepository;

    /**
     * 현재 라운드에 플레이어의 새 턴을 만들고 게임의 현재 턴으로 지정
     */
    public Turn openTurn(Game game, String playerId) {
        Player player = playerRepository.findByIdAndGameId(playerId, game.getId())
                .orElseThrow(() -> new TurnOrderIntegrityException(game.getId(),
                        "turn order points to unknown player " + playerId));

        Turn turn = Turn.create(game.getId(), game.getCurrentRound(), player.getTeamId(), playerId);
        turnRepository.save(turn);
        game.setCurrentTurnId(turn.getId());

        log.info("턴 생성: gameId={}, round={}, turnId={}, playerId={}", game.getId(), turn.getRound(),
                turn.getId(), playerId);
        return turn;
    }

    public Turn requireCurrentTurn(Game game) {
        if (game.getCurrentTurnId() == null) {
            throw ErrorCode.NO_CURRENT_TURN.commonException(Map.of("gameId", game.getId()));
        }
        return turnRepository.findById(game.getCurrentTurnId())
                .orElseThrow(() -> ErrorCode.TURN_NOT_FOUND.commonException(
                        Map.of("turnId", game.getCurrentTurnId())));
    }

    public void requireActingPlayer(Turn turn, String playerId) {
        if (!turn.getPlayerId().equals(playerId)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("currentPlayerId", turn.getPlayerId());
            details.put("requestedBy", playerId);
            throw ErrorCode.NOT_YOUR_TURN.commonException(details);
        }
    }

    /**
     * 턴 종료 + 팀 점수 반영. 턴 하나당 한 번만 호출된다.
     */
    public void completeAndScore(Turn turn, LocalDateTime now) {
        if (turn.isComplete()) {
            log.warn("이미 종료된 턴 종료 시도 무시: turnId={}", turn.getId());
            return;
        }
        turn.complete(now);

        Team team = teamRepository.findById(turn.getTeamId())
                .orElseThrow(() -> ErrorCode.TEAM_NOT_FOUND.commonException(Map.of("teamId", turn.getTeamId())));
        team.addScore(turn.getRound(), turn.getPointsScored());

        log.info("턴 종료: turnId={}, playerId={}, guessed={}, skipped={}, points={}, duration={}s",
                turn.getId(), turn.getPlayerId(), turn.getPhrasesGuessed(), turn.getPhrasesSkipped(),
                turn.getPointsScored(), turn.getDuration());
    }

    /**
     * 넘긴 문구를 다시 통에 넣는다 (맞춘 문구는 유지)
     */
    public int resetSkippedPhrases(String gameId) {
        int reset = phraseRepository.updateStatusInBulk(gameId, PhraseStatus.SKIPPED, PhraseStatus.ACTIVE);
        log.info("넘긴 문구 복귀: gameId={}, count={}", gameId, reset);
        return reset;
    }

    public long remainingPhrases(String gameId) {
        return phraseRepository.countByGameIdAndStatus(gameId, PhraseStatus.ACTIVE);
    }
}
