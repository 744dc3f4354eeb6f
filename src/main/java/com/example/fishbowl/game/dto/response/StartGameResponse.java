package com.example.fishbowl.game.dto.response;

import java.util.List;

public record StartGameResponse(
        GameSnapshot game,
        boolean turnOrderEstablished,
        List<String> turnOrder,
        PlayerSummary firstPlayer) {
}
