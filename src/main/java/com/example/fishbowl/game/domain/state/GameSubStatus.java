package com.example.fishbowl.game.domain.state;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 게임 상태(status) 안의 세부 단계.
 * 각 값은 자신이 허용되는 상위 상태를 하나만 가진다.
 */
@Getter
@RequiredArgsConstructor
public enum GameSubStatus {
    WAITING_FOR_PLAYERS("waiting_for_players", GameStatus.SETUP),
    READY_TO_START("ready_to_start", GameStatus.SETUP),

    ROUND_INTRO("round_intro", GameStatus.PLAYING),
    TURN_STARTING("turn_starting", GameStatus.PLAYING),
    TURN_ACTIVE("turn_active", GameStatus.PLAYING),
    TURN_PAUSED("turn_paused", GameStatus.PLAYING),
    ROUND_COMPLETE("round_complete", GameStatus.PLAYING),

    GAME_COMPLETE("game_complete", GameStatus.FINISHED);

    private final String value;
    private final GameStatus status;

    public boolean isLegalFor(GameStatus gameStatus) {
        return this.status == gameStatus;
    }

    public boolean isTurnInProgress() {
        return this == TURN_STARTING || this == TURN_ACTIVE || this == TURN_PAUSED;
    }

    public static GameSubStatus fromValue(String value) {
        for (GameSubStatus subStatus : values()) {
            if (subStatus.value.equals(value)) {
                return subStatus;
            }
        }
        throw new IllegalArgumentException("알 수 없는 세부 상태: " + value);
    }
}
