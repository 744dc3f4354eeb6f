package com.example.fishbowl.game.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UpdatePhraseRequest(
        @NotBlank(message = "플레이어 ID는 필수입니다.") String playerId,

        @NotBlank(message = "빈 문구는 제출할 수 없습니다.")
        @Size(max = 100, message = "문구는 최대 100글자입니다.") String text) {
}
