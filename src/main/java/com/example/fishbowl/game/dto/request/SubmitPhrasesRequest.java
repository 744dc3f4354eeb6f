package com.example.fishbowl.game.dto.request;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record SubmitPhrasesRequest(
        @NotBlank(message = "플레이어 ID는 필수입니다.") String playerId,

        @NotEmpty(message = "문구를 하나 이상 입력해야 합니다.")
        List<@NotBlank(message = "빈 문구는 제출할 수 없습니다.") @Size(max = 100, message = "문구는 최대 100글자입니다.") String> phrases) {
}
