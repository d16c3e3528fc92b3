package com.livepipe.realtime.model;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
