package com.example.fishbowl.game.domain.state;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum GameStatus {
    SETUP("setup"), // 참가 및 문구 제출 단계
    PLAYING("playing"), // 라운드 진행 중
    FINISHED("finished"); // 3라운드 종료

    private final String value;

    public static GameStatus fromValue(String value) {
        for (GameStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("알 수 없는 게임 상태: " + value);
    }
}
