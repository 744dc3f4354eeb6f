package com.example.fishbowl.global.util;

import java.security.SecureRandom;
import java.util.UUID;

public class GameCodeGenerator {

    private static final SecureRandom random = new SecureRandom();
    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private GameCodeGenerator() {
    }

    /**
     * 대문자+숫자 코드 생성 (게임 참가 코드용)
     */
    public static String generateGameCode(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
        }
        return sb.toString();
    }

    public static boolean isValidGameCode(String code, int length) {
        if (code == null || code.length() != length) {
            return false;
        }
        for (char c : code.toCharArray()) {
            if (ALPHANUMERIC.indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * 엔티티 식별자용 UUID
     */
    public static String generateId() {
        return UUID.randomUUID().toString();
    }
}
