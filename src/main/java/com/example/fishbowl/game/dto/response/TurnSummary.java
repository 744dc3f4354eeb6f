package com.example.fishbowl.game.dto.response;

import java.time.LocalDateTime;

import com.example.fishbowl.game.domain.entity.Turn;
import com.example.fishbowl.game.domain.state.PausedReason;

public record TurnSummary(
        String id,
        int round,
        String teamId,
        String playerId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        LocalDateTime pausedAt,
        PausedReason pausedReason,
        int duration,
        int phrasesGuessed,
        int phrasesSkipped,
        int pointsScored,
        boolean complete) {

    public static TurnSummary from(Turn turn) {
        if (turn == null) {
            return null;
        }
        return new TurnSummary(turn.getId(), turn.getRound(), turn.getTeamId(), turn.getPlayerId(),
                turn.getStartTime(), turn.getEndTime(), turn.getPausedAt(), turn.getPausedReason(),
                turn.getDuration(), turn.getPhrasesGuessed(), turn.getPhrasesSkipped(), turn.getPointsScored(),
                turn.isComplete());
    }
}
