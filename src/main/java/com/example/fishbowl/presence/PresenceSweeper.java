package com.example.fishbowl.presence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 하트비트가 끊겨 TTL이 만료된 플레이어를 주기적으로 끊김 처리
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PresenceSweeper {

    private final PresenceService presenceService;

    @Scheduled(fixedDelayString = "${fishbowl.presence-sweep-interval-ms}",
            initialDelayString = "${fishbowl.presence-sweep-interval-ms}")
    public void sweep() {
        try {
            presenceService.expireStaleSessions();
        } catch (DataAccessException e) {
            log.error("접속 정리 작업 실패", e);
        }
    }
}
