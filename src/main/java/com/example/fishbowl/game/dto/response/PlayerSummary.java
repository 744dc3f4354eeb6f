package com.example.fishbowl.game.dto.response;

import com.example.fishbowl.game.domain.entity.Player;

public record PlayerSummary(
        String id,
        String name,
        String teamId,
        boolean connected) {

    public static PlayerSummary from(Player player) {
        return new PlayerSummary(player.getId(), player.getName(), player.getTeamId(), player.isConnected());
    }
}
