package com.example.fishbowl.game.event;

public record PlayerPresenceEvent(String gameId, String playerId, boolean connected) implements GameEvent {

    @Override
    public String type() {
        return "PLAYER_PRESENCE";
    }
}
