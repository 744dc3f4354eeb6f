package com.example.fishbowl.game.event;

public record TurnEndedEvent(
        String gameId,
        String turnId,
        String playerId,
        String teamId,
        int phrasesGuessed,
        int phrasesSkipped,
        int pointsScored,
        String nextPlayerId // 다음 플레이어가 없으면 null
) implements GameEvent {

    @Override
    public String type() {
        return "TURN_ENDED";
    }
}
