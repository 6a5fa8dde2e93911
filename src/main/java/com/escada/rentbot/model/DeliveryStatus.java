package com.escada.rentbot.model;

import java.util.Locale;

public enum DeliveryStatus {
    QUEUED,
    SENT,
    BLOCKED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DeliveryStatus fromDb(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
