package com.example.fishbowl.game.dto.response;

/**
 * 턴 시작 / 일시정지 / 재개 결과
 */
public record TurnActionResponse(
        GameSnapshot game,
        TurnSummary turn) {
}
