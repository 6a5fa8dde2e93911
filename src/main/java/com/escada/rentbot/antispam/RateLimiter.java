package com.escada.rentbot.antispam;

import com.escada.rentbot.config.BotConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-user sliding-window spam gate.
 * <p>
 * An attempt inside the cooldown after the last admitted event is dropped and not counted. A user
 * whose window already holds {@code threshold} events is put on a sticky block list that only
 * {@link #reset()} clears.
 * <p>
 * All state sits behind the instance monitor.
 */
public final class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final int threshold;
    private final long windowMillis;
    private final long cooldownMillis;

    private final Map<Long, Deque<Long>> events = new HashMap<>();
    private final Map<Long, Long> lastEventAt = new HashMap<>();
    private final Set<Long> blocked = new HashSet<>();
    private long lastSweepAt;

    public RateLimiter(int threshold, Duration window, Duration cooldown) {
        if (threshold <= 0) throw new IllegalArgumentException("threshold must be positive");
        this.threshold = threshold;
        this.windowMillis = window.toMillis();
        this.cooldownMillis = cooldown.toMillis();
    }

    public static RateLimiter fromConfig(BotConfig config) {
        return new RateLimiter(
                config.rateLimitThreshold,
                Duration.ofSeconds(config.rateLimitWindowSeconds),
                Duration.ofSeconds(config.messageCooldownSeconds));
    }

    public synchronized boolean admit(long userId, long nowMillis) {
        if (nowMillis - lastSweepAt >= windowMillis) {
            sweep(nowMillis);
        }
        if (blocked.contains(userId)) return false;

        Deque<Long> window = events.computeIfAbsent(userId, k -> new ArrayDeque<>());
        // keep [now - window, now]
        while (!window.isEmpty() && nowMillis - window.peekFirst() > windowMillis) {
            window.pollFirst();
        }

        Long last = lastEventAt.get(userId);
        if (last != null && nowMillis - last < cooldownMillis) {
            return false;
        }

        if (window.size() >= threshold) {
            blocked.add(userId);
            log.warn("User {} blocked for spam ({} events in {} ms)", userId, window.size(), windowMillis);
            return false;
        }

        window.addLast(nowMillis);
        lastEventAt.put(userId, nowMillis);
        return true;
    }

    /** Drops users whose window is empty and whose cooldown has passed. Blocks are kept. */
    private void sweep(long nowMillis) {
        long idleAfter = Math.max(windowMillis, cooldownMillis);
        lastEventAt.entrySet().removeIf(e -> {
            if (nowMillis - e.getValue() <= idleAfter) return false;
            events.remove(e.getKey());
            return true;
        });
        lastSweepAt = nowMillis;
    }

    synchronized int trackedUsers() {
        return lastEventAt.size();
    }

    public synchronized boolean isBlocked(long userId) {
        return blocked.contains(userId);
    }

    public synchronized int blockedCount() {
        return blocked.size();
    }

    /** Forgets all windows, cooldowns and the block list. */
    public synchronized void reset() {
        events.clear();
        lastEventAt.clear();
        blocked.clear();
        log.info("Rate limiter state cleared");
    }
}
