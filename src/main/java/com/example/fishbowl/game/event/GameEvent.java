package com.example.fishbowl.game.event;

/**
 * 커밋 후 클라이언트로 전달되는 게임 이벤트
 */
public interface GameEvent {

    String gameId();

    /**
     * 브로드캐스트 메시지의 type 값 (예: TURN_ENDED)
     */
    String type();
}
