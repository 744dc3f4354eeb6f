package com.example.fishbowl.game.domain.state;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PhraseStatus {
    ACTIVE("active"), // 아직 통 안에 있음
    GUESSED("guessed"), // 맞춤
    SKIPPED("skipped"); // 이번 라운드에서 넘김, 다음 라운드 시작 시 ACTIVE로 복귀

    private final String value;

    public static PhraseStatus fromValue(String value) {
        for (PhraseStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("알 수 없는 문구 상태: " + value);
    }
}
