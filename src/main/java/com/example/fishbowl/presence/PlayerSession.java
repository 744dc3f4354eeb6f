package com.example.fishbowl.presence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * WebSocket 세션 하나 = 플레이어의 기기 하나.
 * Redis에 JSON으로 저장되며 TTL 안에 하트비트가 없으면 만료된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerSession {

    private String sessionId;
    private String gameId;
    private String playerId;
    private long connectedAt; // epoch millis
}
