package com.example.fishbowl.game.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 설정값(teamCount 등)은 생략하면 기본값을 사용한다
 */
public record CreateGameRequest(
        @NotBlank(message = "게임 이름은 필수입니다.") @Size(max = 50, message = "게임 이름은 최대 50글자입니다.") String name,

        @NotBlank(message = "호스트 이름은 필수입니다.") @Size(max = 20, message = "플레이어 이름은 최대 20글자입니다.") String hostPlayerName,

        Integer teamCount,
        Integer phrasesPerPlayer,
        Integer timerDuration) {
}
