package com.example.fishbowl.presence;

import java.time.Duration;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import com.example.fishbowl.global.config.FishbowlProperties;

/**
 * 접속 세션 저장소 (Redis)
 * - presence:session:{sessionId} -> PlayerSession
 * - presence:player:{playerId}   -> 최근 sessionId
 * 두 키 모두 같은 TTL을 가지며 하트비트마다 연장된다.
 */
@Repository
@Slf4j
public class PlayerSessionRepository {

    private static final String SESSION_KEY_PREFIX = "presence:session:";
    private static final String PLAYER_KEY_PREFIX = "presence:player:";

    private final RedisTemplate<String, PlayerSession> sessionTemplate;
    private final RedisTemplate<String, String> indexTemplate;
    private final Duration ttl;

    public PlayerSessionRepository(
            @Qualifier("playerSessionRedisTemplate") RedisTemplate<String, PlayerSession> sessionTemplate,
            @Qualifier("presenceIndexRedisTemplate") RedisTemplate<String, String> indexTemplate,
            FishbowlProperties properties) {
        this.sessionTemplate = sessionTemplate;
        this.indexTemplate = indexTemplate;
        this.ttl = Duration.ofSeconds(properties.presenceTtlSeconds());
    }

    public void save(PlayerSession session) {
        sessionTemplate.opsForValue().set(SESSION_KEY_PREFIX + session.getSessionId(), session, ttl);
        indexTemplate.opsForValue().set(PLAYER_KEY_PREFIX + session.getPlayerId(), session.getSessionId(), ttl);
    }

    public Optional<PlayerSession> findBySessionId(String sessionId) {
        return Optional.ofNullable(sessionTemplate.opsForValue().get(SESSION_KEY_PREFIX + sessionId));
    }

    public Optional<String> findSessionIdByPlayerId(String playerId) {
        return Optional.ofNullable(indexTemplate.opsForValue().get(PLAYER_KEY_PREFIX + playerId));
    }

    public boolean existsByPlayerId(String playerId) {
        return Boolean.TRUE.equals(indexTemplate.hasKey(PLAYER_KEY_PREFIX + playerId));
    }

    /**
     * 하트비트: 세션과 플레이어 키의 TTL 연장
     *
     * @return 세션이 이미 만료되었으면 false
     */
    public boolean touch(PlayerSession session) {
        Boolean extended = sessionTemplate.expire(SESSION_KEY_PREFIX + session.getSessionId(), ttl);
        if (!Boolean.TRUE.equals(extended)) {
            return false;
        }
        indexTemplate.opsForValue().set(PLAYER_KEY_PREFIX + session.getPlayerId(), session.getSessionId(), ttl);
        return true;
    }

    public void deleteSession(String sessionId) {
        sessionTemplate.delete(SESSION_KEY_PREFIX + sessionId);
    }

    public void deletePlayerIndex(String playerId) {
        indexTemplate.delete(PLAYER_KEY_PREFIX + playerId);
    }
}
