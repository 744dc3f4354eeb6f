package com.example.fishbowl.global.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Spring Retry 활성화 설정
 *
 * Game 엔티티의 @Version 충돌 재시도를 위해 필요:
 * - 동시에 두 요청이 같은 게임의 턴을 넘기면 한쪽은 커밋 시점에 ObjectOptimisticLockingFailureException 발생
 * - GameFlowFacade의 @Retryable이 최신 상태로 다시 시도하고, 이미 넘어간 턴이면 검증 단계에서 거절된다
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
