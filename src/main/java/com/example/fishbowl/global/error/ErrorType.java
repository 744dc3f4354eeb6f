package com.example.fishbowl.global.error;

public enum ErrorType {
    VALIDATION, // 입력값/전제조건 오류
    STATE_CONFLICT, // 현재 게임 상태에서 허용되지 않는 요청
    NOT_FOUND, // 게임/플레이어/턴 없음
    INTEGRITY // 턴 순서 링 손상 등 내부 정합성 오류
}
