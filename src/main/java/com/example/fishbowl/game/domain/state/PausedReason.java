package com.example.fishbowl.game.domain.state;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PausedReason {
    PLAYER_DISCONNECTED("player_disconnected"),
    HOST_PAUSED("host_paused"),
    NO_ELIGIBLE_PLAYER("no_eligible_player");

    private final String value;

    public static PausedReason fromValue(String value) {
        for (PausedReason reason : values()) {
            if (reason.value.equals(value)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("알 수 없는 일시정지 사유: " + value);
    }
}
