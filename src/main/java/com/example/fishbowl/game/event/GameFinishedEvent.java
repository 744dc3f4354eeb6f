package com.example.fishbowl.game.event;

import java.util.Map;

public record GameFinishedEvent(String gameId, Map<String, Integer> totalScores) implements GameEvent {

    @Override
    public String type() {
        return "GAME_FINISHED";
    }
}
