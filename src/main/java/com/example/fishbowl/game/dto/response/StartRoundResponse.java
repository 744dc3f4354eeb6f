package com.example.fishbowl.game.dto.response;

import java.time.LocalDateTime;

public record StartRoundResponse(
        GameSnapshot game,
        int round,
        String roundName,
        String currentTurnId,
        PlayerSummary currentPlayer,
        TeamSummary currentTeam,
        LocalDateTime startedAt) {
}
