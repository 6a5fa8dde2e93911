package com.escada.rentbot.transport;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remembers the last text written into each edited message so identical edits are skipped, and
 * the last time help was shown to each user.
 */
public final class MessageCache {
    static final int DEFAULT_MAX_EDITED = 10_000;

    private final Map<String, String> editedTexts;
    private final Map<Long, Long> helpShownAt = new HashMap<>();
    private long lastHelpSweepAt;

    public MessageCache() {
        this(DEFAULT_MAX_EDITED);
    }

    /** Keeps the last texts of at most {@code maxEdited} messages, least recently edited go first. */
    MessageCache(int maxEdited) {
        this.editedTexts = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > maxEdited;
            }
        };
    }

    public synchronized boolean isSameAsLastEdit(long chatId, int messageId, String text) {
        return text.equals(editedTexts.get(key(chatId, messageId)));
    }

    public synchronized void rememberEdit(long chatId, int messageId, String text) {
        editedTexts.put(key(chatId, messageId), text);
    }

    /**
     * @return true and records {@code nowMillis} when help was not shown within {@code cooldownMillis}
     */
    public synchronized boolean tryShowHelp(long userId, long nowMillis, long cooldownMillis) {
        if (nowMillis - lastHelpSweepAt >= cooldownMillis) {
            helpShownAt.values().removeIf(t -> nowMillis - t >= cooldownMillis);
            lastHelpSweepAt = nowMillis;
        }
        Long last = helpShownAt.get(userId);
        if (last != null && nowMillis - last < cooldownMillis) return false;
        helpShownAt.put(userId, nowMillis);
        return true;
    }

    public synchronized int size() {
        return editedTexts.size() + helpShownAt.size();
    }

    public synchronized void clear() {
        editedTexts.clear();
        helpShownAt.clear();
    }

    private static String key(long chatId, int messageId) {
        return chatId + "_" + messageId;
    }
}
