package com.escada.rentbot.handler;

import com.escada.rentbot.antispam.RateLimiter;
import com.escada.rentbot.broadcast.BroadcastService;
import com.escada.rentbot.config.BotConfig;
import com.escada.rentbot.db.Json;
import com.escada.rentbot.db.Repository;
import com.escada.rentbot.dispatch.InboundEvent;
import com.escada.rentbot.model.AdminStats;
import com.escada.rentbot.model.BroadcastPayload;
import com.escada.rentbot.model.Session;
import com.escada.rentbot.model.SessionState;
import com.escada.rentbot.session.SessionStore;
import com.escada.rentbot.subscription.SubscriptionCache;
import com.escada.rentbot.transport.MessageCache;
import com.escada.rentbot.transport.TransportException;
import com.escada.rentbot.ui.Keyboards;
import com.escada.rentbot.ui.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Admin panel, statistics, cache reset and broadcast composition. Everything here is a no-op for
 * anyone but the configured admin.
 */
public final class AdminHandlers {
    private static final Logger log = LoggerFactory.getLogger(AdminHandlers.class);

    private final BotConfig config;
    private final Repository repository;
    private final SessionStore sessions;
    private final SubscriptionCache subscriptions;
    private final MessageCache messageCache;
    private final RateLimiter rateLimiter;
    private final BroadcastService broadcasts;
    private final Replier replier;
    private final Clock clock;

    public AdminHandlers(BotConfig config,
                         Repository repository,
                         SessionStore sessions,
                         SubscriptionCache subscriptions,
                         MessageCache messageCache,
                         RateLimiter rateLimiter,
                         BroadcastService broadcasts,
                         Replier replier,
                         Clock clock) {
        this.config = config;
        this.repository = repository;
        this.sessions = sessions;
        this.subscriptions = subscriptions;
        this.messageCache = messageCache;
        this.rateLimiter = rateLimiter;
        this.broadcasts = broadcasts;
        this.replier = replier;
        this.clock = clock;
    }

    public void panel(InboundEvent e, Session s) throws TransportException {
        if (!config.isAdmin(e.userId)) {
            replier.reply(e, Texts.UNKNOWN_COMMAND);
            return;
        }
        replier.reply(e, Texts.adminPanel(repository.countUsers(true), repository.listAvailableCities().size(),
                LocalDateTime.now(clock)), Keyboards.admin());
        sessions.enter(e.userId, SessionState.ADMIN_MENU);
    }

    public void stats(InboundEvent e, Session s) throws TransportException {
        if (!config.isAdmin(e.userId)) {
            replier.reply(e, Texts.UNKNOWN_COMMAND);
            return;
        }
        replier.reply(e, Texts.stats(
                repository.countUsers(false),
                repository.listAvailableCities().size(),
                rateLimiter.blockedCount(),
                subscriptions.size(),
                messageCache.size()));
    }

    public void statsCallback(InboundEvent e, Session s) throws TransportException {
        if (denied(e)) return;
        audit(e.userId, "view_stats", null);

        AdminStats stats = repository.getAdminStats();
        replier.safeEdit(e, Texts.extendedStats(stats, repository.listAvailableCities().size(),
                subscriptions.size(), LocalDateTime.now(clock)), Keyboards.admin());
        replier.answer(e);
    }

    public void usersCallback(InboundEvent e, Session s) throws TransportException {
        if (denied(e)) return;
        replier.safeEdit(e, Texts.users(repository.getAdminStats()), Keyboards.admin());
        replier.answer(e);
    }

    public void broadcastCallback(InboundEvent e, Session s) throws TransportException {
        if (denied(e)) return;
        replier.safeEdit(e, Texts.broadcastPrompt(repository.countUsers(true)), null);
        // only once the prompt is on screen
        sessions.enter(e.userId, SessionState.AWAITING_BROADCAST_BODY);
        replier.answer(e);
    }

    public void clearCacheCallback(InboundEvent e, Session s) {
        if (denied(e)) return;
        int subs = subscriptions.size();
        int messages = messageCache.size();
        int spam = rateLimiter.blockedCount();

        subscriptions.clear();
        messageCache.clear();
        rateLimiter.reset();

        Map<String, Object> cleared = new LinkedHashMap<>();
        cleared.put("subscriptions", subs);
        cleared.put("messages", messages);
        cleared.put("spam_blocked", spam);
        audit(e.userId, "clear_cache", Json.write(cleared));
        log.info("Caches cleared by admin {}", e.userId);

        replier.answer(e, Texts.ALERT_CACHES_CLEARED, true);
    }

    /** Message received while in AWAITING_BROADCAST_BODY. */
    public void broadcastBody(InboundEvent e, Session s) throws TransportException {
        if (!config.isAdmin(e.userId)) {
            return;
        }

        int recipients = repository.countUsers(true);
        if (recipients == 0) {
            replier.reply(e, Texts.NO_USERS_FOR_BROADCAST);
            sessions.clear(e.userId);
            return;
        }

        Optional<BroadcastPayload> payload = BroadcastPayload.from(e.text, e.photoFileId);
        if (payload.isEmpty()) {
            // stay in AWAITING_BROADCAST_BODY
            replier.reply(e, Texts.EMPTY_BROADCAST);
            return;
        }

        BroadcastPayload p = payload.get();
        int statusMessageId = replier.reply(e, Texts.broadcastStarting(recipients, p.isPhoto()));
        long broadcastId = broadcasts.launch(e.userId, e.chatId, statusMessageId, p);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("broadcast_id", broadcastId);
        details.put("photo", p.isPhoto());
        details.put("title", p.title());
        audit(e.userId, "broadcast", Json.write(details));

        sessions.clear(e.userId);
    }

    private boolean denied(InboundEvent e) {
        if (config.isAdmin(e.userId)) return false;
        replier.answer(e, Texts.ALERT_NO_ACCESS, true);
        return true;
    }

    private void audit(long adminTgId, String action, String payloadJson) {
        try {
            repository.logAdminAction(adminTgId, action, payloadJson);
        } catch (RuntimeException ex) {
            log.warn("Admin action {} not logged: {}", action, ex.getMessage());
        }
    }
}
