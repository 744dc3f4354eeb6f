package com.example.fishbowl.game.domain.state;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 라운드 규칙. 라운드 수와 이름은 고정이다.
 */
@Getter
@RequiredArgsConstructor
public enum RoundType {
    TABOO(1, "Taboo"), // 설명하기 (문구에 있는 단어 사용 금지)
    CHARADES(2, "Charades"), // 몸으로 말해요
    ONE_WORD(3, "One Word"); // 한 단어로만 힌트

    public static final int ROUND_COUNT = 3;

    private final int round;
    private final String displayName;

    public static RoundType ofRound(int round) {
        for (RoundType type : values()) {
            if (type.round == round) {
                return type;
            }
        }
        throw new IllegalArgumentException("라운드는 1~" + ROUND_COUNT + " 사이여야 합니다: " + round);
    }

    public boolean isLast() {
        return round == ROUND_COUNT;
    }
}
