package com.livepipe.realtime.model;

import java.util.Locale;

public enum DatasetFormat {
    JSON,
    CSV,
    XML,
    TEXT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
