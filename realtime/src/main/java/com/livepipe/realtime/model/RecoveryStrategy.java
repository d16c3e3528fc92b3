package com.livepipe.realtime.model;

import java.util.Locale;
import java.util.Optional;

public enum RecoveryStrategy {
    RETRY,
    SKIP,
    RESTART;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RecoveryStrategy> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (RecoveryStrategy strategy : values()) {
            if (strategy.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
