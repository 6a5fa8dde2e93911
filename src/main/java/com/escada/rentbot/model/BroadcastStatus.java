package com.escada.rentbot.model;

import java.util.Locale;

public enum BroadcastStatus {
    DRAFT,
    RUNNING,
    COMPLETED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
