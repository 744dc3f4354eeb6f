package com.example.fishbowl.game.dto.response;

import java.time.LocalDateTime;
import java.util.List;

import com.example.fishbowl.game.domain.entity.Game;
import com.example.fishbowl.game.domain.entity.Team;
import com.example.fishbowl.game.domain.entity.Turn;

/**
 * 클라이언트에 내려주는 게임 전체 상태 (상태값은 소문자 이름 그대로)
 */
public record GameSnapshot(
        String id,
        String name,
        String hostPlayerId,
        String status,
        String subStatus,
        int teamCount,
        int phrasesPerPlayer,
        int timerDuration,
        int currentRound,
        String roundName,
        String currentTurnId,
        TurnSummary currentTurn,
        List<TeamSummary> teams,
        LocalDateTime createdAt,
        LocalDateTime startedAt,
        LocalDateTime finishedAt) {

    public static GameSnapshot of(Game game, List<Team> teams, Turn currentTurn) {
        return new GameSnapshot(
                game.getId(),
                game.getName(),
                game.getHostPlayerId(),
                game.getStatus().getValue(),
                game.getSubStatus().getValue(),
                game.getTeamCount(),
                game.getPhrasesPerPlayer(),
                game.getTimerDuration(),
                game.getCurrentRound(),
                game.getRoundType().getDisplayName(),
                game.getCurrentTurnId(),
                TurnSummary.from(currentTurn),
                teams.stream().map(TeamSummary::from).toList(),
                game.getCreatedAt(),
                game.getStartedAt(),
                game.getFinishedAt());
    }
}
