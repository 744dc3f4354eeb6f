package com.example.fishbowl.game.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * null인 항목은 변경하지 않는다
 */
public record UpdateGameConfigRequest(
        @NotBlank(message = "요청한 플레이어 ID는 필수입니다.") String playerId,
        Integer teamCount,
        Integer phrasesPerPlayer,
        Integer timerDuration) {
}
