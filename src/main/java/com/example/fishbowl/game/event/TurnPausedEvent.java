package com.example.fishbowl.game.event;

import com.example.fishbowl.game.domain.state.PausedReason;

public record TurnPausedEvent(String gameId, String turnId, String playerId, PausedReason reason) implements GameEvent {

    @Override
    public String type() {
        return "TURN_PAUSED";
    }
}
