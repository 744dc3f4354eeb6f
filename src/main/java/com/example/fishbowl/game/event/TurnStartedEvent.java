package com.example.fishbowl.game.event;

/**
 * 새 턴이 준비되었거나(turn_starting) 실제로 시작됨(turn_active)
 */
public record TurnStartedEvent(String gameId, String turnId, int round, String playerId, String teamId,
                               boolean active) implements GameEvent {

    @Override
    public String type() {
        return "TURN_STARTED";
    }
}
