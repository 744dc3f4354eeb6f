package com.example.fishbowl.game.event;

import java.util.List;

public record GameStartedEvent(String gameId, String firstPlayerId, List<String> turnOrder) implements GameEvent {

    @Override
    public String type() {
        return "GAME_STARTED";
    }
}
