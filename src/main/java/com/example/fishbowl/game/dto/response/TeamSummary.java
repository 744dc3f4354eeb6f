package com.example.fishbowl.game.dto.response;

import com.example.fishbowl.game.domain.entity.Team;

public record TeamSummary(
        String id,
        String name,
        String color,
        int scoreRound1,
        int scoreRound2,
        int scoreRound3,
        int totalScore) {

    public static TeamSummary from(Team team) {
        return new TeamSummary(team.getId(), team.getName(), team.getColor(),
                team.getScoreRound1(), team.getScoreRound2(), team.getScoreRound3(), team.getTotalScore());
    }
}
