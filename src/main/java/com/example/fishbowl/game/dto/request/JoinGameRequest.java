package com.example.fishbowl.game.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record JoinGameRequest(
        @NotBlank(message = "플레이어 이름은 필수입니다.") @Size(max = 20, message = "플레이어 이름은 최대 20글자입니다.") String playerName) {
}
