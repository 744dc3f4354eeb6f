package com.example.fishbowl.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fishbowl")
public record FishbowlProperties(
        // 게임 코드
        int gameCodeLength,      // 참가 코드 길이 (6자)

        // 게임 설정 기본값
        int defaultTeamCount,
        int defaultPhrasesPerPlayer,
        int defaultTimerDuration, // 초 단위

        // 게임 설정 허용 범위
        int minTeamCount,
        int maxTeamCount,
        int minPhrasesPerPlayer,
        int maxPhrasesPerPlayer,
        int minTimerDuration,
        int maxTimerDuration,

        // 접속 상태 관리
        long presenceTtlSeconds,       // 하트비트가 없으면 세션 만료
        long presenceSweepIntervalMs,  // 만료 세션 정리 주기

        // 테스트에서 셔플 결과를 고정하고 싶을 때 사용 (null이면 무작위)
        Long randomSeed
) {}
