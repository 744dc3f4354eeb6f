package com.example.fishbowl.game.event;

public record RoundStartedEvent(String gameId, int round, String roundName, String actingPlayerId) implements GameEvent {

    @Override
    public String type() {
        return "ROUND_STARTED";
    }
}
