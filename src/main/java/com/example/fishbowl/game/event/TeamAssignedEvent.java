package com.example.fishbowl.game.event;

public record TeamAssignedEvent(String gameId, String playerId, String playerName, String teamId)
        implements GameEvent {

    @Override
    public String type() {
        return "TEAM_ASSIGNED";
    }
}
