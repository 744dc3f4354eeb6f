package com.example.fishbowl.global.config;

import java.util.Random;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 스네이크 드래프트 셔플과 시작 플레이어 선택에 쓰이는 난수 생성기.
 * 시드를 설정하면 같은 순서가 재현된다.
 */
@Slf4j
@Configuration
public class RandomConfig {

    @Bean
    public Random gameRandom(FishbowlProperties properties) {
        if (properties.randomSeed() != null) {
            log.info("고정 시드 난수 생성기 사용: seed={}", properties.randomSeed());
            return new Random(properties.randomSeed());
        }
        return new Random();
    }
}
