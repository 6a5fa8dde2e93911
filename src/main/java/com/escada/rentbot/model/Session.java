package com.escada.rentbot.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Session {
    public static final String SELECTED_CITY = "selected_city";
    public static final String CITY_NAME = "city_name";

    private static final Session IDLE = new Session(SessionState.IDLE, Map.of());

    public final SessionState state;
    public final Map<String, String> payload;

    public Session(SessionState state, Map<String, String> payload) {
        this.state = state;
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Session idle() {
        return IDLE;
    }

    public boolean isIdle() {
        return state == SessionState.IDLE;
    }

    public String get(String key) {
        return payload.get(key);
    }
}
