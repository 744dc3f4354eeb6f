package com.example.fishbowl.global.error;

import java.util.Map;

/**
 * 턴 순서 링이 손상되었을 때 발생하는 예외.
 * 사용자 실수가 아니라 이전 트랜잭션의 버그나 데이터 손상을 의미하므로 500으로 처리된다.
 */
public class TurnOrderIntegrityException extends CommonException {

    public TurnOrderIntegrityException(String gameId, String reason) {
        super(ErrorCode.TURN_ORDER_CORRUPTED, Map.of("gameId", gameId, "reason", reason));
    }
}
