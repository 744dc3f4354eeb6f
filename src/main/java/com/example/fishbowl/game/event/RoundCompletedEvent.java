package com.example.fishbowl.game.event;

import java.util.Map;

/**
 * @param nextRound 마지막 라운드였으면 null
 * @param roundScores 팀 ID -> 이번 라운드 점수
 */
public record RoundCompletedEvent(String gameId, int round, Integer nextRound,
                                  Map<String, Integer> roundScores) implements GameEvent {

    @Override
    public String type() {
        return "ROUND_COMPLETED";
    }
}
