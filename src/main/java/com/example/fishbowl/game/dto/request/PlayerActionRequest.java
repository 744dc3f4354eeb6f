package com.example.fishbowl.game.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * 턴 시작/종료, 문구 처리 등 "누가" 요청했는지만 필요한 요청
 */
public record PlayerActionRequest(
        @NotBlank(message = "플레이어 ID는 필수입니다.") String playerId) {
}
