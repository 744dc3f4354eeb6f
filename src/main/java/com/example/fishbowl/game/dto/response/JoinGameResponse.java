package com.example.fishbowl.game.dto.response;

public record JoinGameResponse(
        GameSnapshot game,
        PlayerSummary player) {
}
