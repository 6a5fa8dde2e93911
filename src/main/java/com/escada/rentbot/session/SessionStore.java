package com.escada.rentbot.session;

import com.escada.rentbot.model.Session;
import com.escada.rentbot.model.SessionState;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory FSM state per user. IDLE is never stored: a missing entry is IDLE.
 */
public final class SessionStore {
    private final Map<Long, Session> sessions = new HashMap<>();

    public synchronized Session get(long userId) {
        return sessions.getOrDefault(userId, Session.idle());
    }

    public synchronized void enter(long userId, SessionState state, Map<String, String> payload) {
        if (state == SessionState.IDLE) {
            sessions.remove(userId);
            return;
        }
        sessions.put(userId, new Session(state, payload));
    }

    public void enter(long userId, SessionState state) {
        enter(userId, state, Map.of());
    }

    /**
     * Merges {@code values} into the payload, state stays as is. No-op for an idle user.
     */
    public synchronized void updatePayload(long userId, Map<String, String> values) {
        Session current = sessions.get(userId);
        if (current == null) return;
        Map<String, String> merged = new LinkedHashMap<>(current.payload);
        merged.putAll(values);
        sessions.put(userId, new Session(current.state, merged));
    }

    /** @return state before clearing */
    public synchronized SessionState clear(long userId) {
        Session previous = sessions.remove(userId);
        return previous == null ? SessionState.IDLE : previous.state;
    }

    public synchronized int size() {
        return sessions.size();
    }
}
