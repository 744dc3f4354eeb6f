package com.example.fishbowl.game.event;

public record TurnResumedEvent(String gameId, String turnId, String playerId) implements GameEvent {

    @Override
    public String type() {
        return "TURN_RESUMED";
    }
}
