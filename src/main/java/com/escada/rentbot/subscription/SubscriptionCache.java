package com.escada.rentbot.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Time-boxed memo of the main-channel membership check.
 * <p>
 * Fails closed: a failing check answers "not subscribed" and is not cached, so the next call asks
 * again instead of pinning a false negative for the whole TTL.
 */
public final class SubscriptionCache {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionCache.class);

    private static final class Entry {
        final boolean subscribed;
        final long checkedAt;

        Entry(boolean subscribed, long checkedAt) {
            this.subscribed = subscribed;
            this.checkedAt = checkedAt;
        }
    }

    private final long ttlMillis;
    private final Map<Long, Entry> entries = new HashMap<>();
    private long lastSweepAt;

    public SubscriptionCache(Duration ttl) {
        this.ttlMillis = ttl.toMillis();
    }

    public boolean isSubscribed(long userId, long nowMillis, MembershipCheck check) {
        synchronized (this) {
            Entry e = entries.get(userId);
            if (e != null && nowMillis - e.checkedAt < ttlMillis) {
                return e.subscribed;
            }
        }

        // the external call runs outside the lock
        boolean subscribed;
        try {
            subscribed = check.isMember(userId);
        } catch (Exception e) {
            log.warn("Subscription check failed for {}: {}", userId, e.getMessage());
            return false;
        }

        synchronized (this) {
            if (nowMillis - lastSweepAt >= ttlMillis) {
                // stale entries would be re-checked anyway
                entries.values().removeIf(entry -> nowMillis - entry.checkedAt >= ttlMillis);
                lastSweepAt = nowMillis;
            }
            entries.put(userId, new Entry(subscribed, nowMillis));
        }
        return subscribed;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
