package com.example.fishbowl.game.dto.response;

public record EndTurnResponse(
        Outcome outcome,
        GameSnapshot game,
        TurnSummary previousTurn,
        TurnSummary nextTurn,
        PlayerSummary nextPlayer) {

    public enum Outcome {
        NEXT_TURN,          // 같은 라운드의 다음 턴 준비됨
        ROUND_COMPLETE,     // 문구가 모두 맞춰져 다음 라운드 대기
        GAME_COMPLETE,      // 마지막 라운드 종료
        NO_ELIGIBLE_PLAYER  // 접속자가 없어 현재 턴이 일시정지됨
    }

    public boolean advanced() {
        return outcome != Outcome.NO_ELIGIBLE_PLAYER;
    }
}
