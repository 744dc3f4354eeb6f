package com.example.fishbowl.game.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * 팀 변경 요청. 본인 또는 호스트만 요청할 수 있다.
 */
public record AssignTeamRequest(
        @NotBlank(message = "요청한 플레이어 ID는 필수입니다.") String requesterId,
        @NotBlank(message = "팀 ID는 필수입니다.") String teamId) {
}
