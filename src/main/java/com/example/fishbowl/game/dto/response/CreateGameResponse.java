package com.example.fishbowl.game.dto.response;

public record CreateGameResponse(
        GameSnapshot game,
        PlayerSummary host) {
}
