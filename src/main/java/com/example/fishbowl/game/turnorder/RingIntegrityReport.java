package com.example.fishbowl.game.turnorder;

import java.util.List;

public record RingIntegrityReport(
        boolean valid,
        int ringSize,
        List<String> violations) {

    public static RingIntegrityReport ok(int ringSize) {
        return new RingIntegrityReport(true, ringSize, List.of());
    }

    public static RingIntegrityReport broken(int ringSize, List<String> violations) {
        return new RingIntegrityReport(false, ringSize, List.copyOf(violations));
    }
}
