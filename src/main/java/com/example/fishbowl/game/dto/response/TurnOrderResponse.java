package com.example.fishbowl.game.dto.response;

import java.util.List;

import com.example.fishbowl.game.turnorder.RingIntegrityReport;

public record TurnOrderResponse(
        String gameId,
        List<Entry> ring,
        List<String> activePlayers,
        RingIntegrityReport integrity) {

    public record Entry(int position, String playerId, String playerName, String teamId,
                        String nextPlayerId, String prevPlayerId, boolean connected) {
    }
}
