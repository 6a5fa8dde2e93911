package com.escada.rentbot.dispatch;

import com.escada.rentbot.antispam.RateLimiter;
import com.escada.rentbot.db.Repository;
import com.escada.rentbot.handler.AdminHandlers;
import com.escada.rentbot.handler.CityHandlers;
import com.escada.rentbot.handler.MenuHandlers;
import com.escada.rentbot.model.Session;
import com.escada.rentbot.model.SessionState;
import com.escada.rentbot.session.SessionStore;
import com.escada.rentbot.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Routing table from classified events to handlers.
 * <p>
 * Commands, menu buttons and callbacks route by event type. Plain content (text, photo, other)
 * routes by the sender's session state and falls back to the greeting. Each route says whether it
 * goes through the rate limiter and whether it ends an active flow before running.
 */
public final class UpdateRouter {
    private static final Logger log = LoggerFactory.getLogger(UpdateRouter.class);

    static final class Route {
        final String name;
        final EventHandler handler;
        final boolean rateLimited;
        final boolean interrupts;

        Route(String name, EventHandler handler, boolean rateLimited, boolean interrupts) {
            this.name = name;
            this.handler = handler;
            this.rateLimited = rateLimited;
            this.interrupts = interrupts;
        }
    }

    private final Map<EventType, Route> commandRoutes = new EnumMap<>(EventType.class);
    private final Map<SessionState, Map<EventType, Route>> stateRoutes = new EnumMap<>(SessionState.class);
    private final Route fallback;

    private final RateLimiter rateLimiter;
    private final SessionStore sessions;
    private final Repository repository;
    private final Clock clock;

    public UpdateRouter(MenuHandlers menu,
                        CityHandlers city,
                        AdminHandlers admin,
                        RateLimiter rateLimiter,
                        SessionStore sessions,
                        Repository repository,
                        Clock clock) {
        this.rateLimiter = rateLimiter;
        this.sessions = sessions;
        this.repository = repository;
        this.clock = clock;

        command(EventType.START, "start", menu::start, true, true);
        command(EventType.CANCEL, "cancel", menu::cancel, false, false);
        command(EventType.ADMIN, "admin", admin::panel, false, false);
        command(EventType.STATS, "stats", admin::stats, false, false);
        command(EventType.UNKNOWN_COMMAND, "unknown_command", menu::unknownCommand, false, true);

        command(EventType.MENU_SELECT_CITY, "select_city", menu::selectCity, true, true);
        command(EventType.MENU_RENT, "rent", menu::rent, true, true);
        command(EventType.MENU_SUBSCRIBE, "subscribe", menu::subscribe, true, true);
        command(EventType.MENU_CHECK_SUBSCRIPTION, "check_subscription", menu::checkSubscription, true, true);
        command(EventType.MENU_HELP, "help", menu::help, true, true);

        command(EventType.CALLBACK_CITY, "city_callback", city::cityCallback, false, false);
        command(EventType.CALLBACK_CHECK_SUBSCRIPTION, "check_subscription_callback", city::checkSubscriptionCallback, false, false);
        command(EventType.CALLBACK_BACK_TO_MENU, "back_to_menu", menu::backToMenu, false, false);
        command(EventType.CALLBACK_ADMIN_STATS, "admin_stats", admin::statsCallback, false, false);
        command(EventType.CALLBACK_ADMIN_BROADCAST, "admin_broadcast", admin::broadcastCallback, false, false);
        command(EventType.CALLBACK_ADMIN_USERS, "admin_users", admin::usersCallback, false, false);
        command(EventType.CALLBACK_ADMIN_CLEAR_CACHE, "admin_clear_cache", admin::clearCacheCallback, false, false);
        command(EventType.CALLBACK_UNKNOWN, "unknown_callback", menu::unknownCallback, false, false);

        state(SessionState.AWAITING_CITY, EventType.TEXT, "city_text", city::cityText, true);
        for (EventType t : new EventType[]{EventType.TEXT, EventType.PHOTO, EventType.OTHER}) {
            state(SessionState.AWAITING_BROADCAST_BODY, t, "broadcast_body", admin::broadcastBody, false);
        }

        this.fallback = new Route("fallback", menu::fallback, true, false);
    }

    private void command(EventType type, String name, EventHandler handler, boolean rateLimited, boolean interrupts) {
        commandRoutes.put(type, new Route(name, handler, rateLimited, interrupts));
    }

    private void state(SessionState state, EventType type, String name, EventHandler handler, boolean rateLimited) {
        stateRoutes.computeIfAbsent(state, k -> new EnumMap<>(EventType.class))
                .put(type, new Route(name, handler, rateLimited, false));
    }

    Route routeFor(EventType type, SessionState state) {
        Route r = commandRoutes.get(type);
        if (r != null) return r;
        Map<EventType, Route> byType = stateRoutes.get(state);
        if (byType != null && byType.containsKey(type)) return byType.get(type);
        return fallback;
    }

    /**
     * Gate, upsert the sender, then run the handler. Events refused by the rate limiter are dropped
     * without a reply.
     */
    public void route(InboundEvent event) throws TransportException {
        Session session = sessions.get(event.userId);
        Route route = routeFor(event.type, session.state);

        if (route.rateLimited && !rateLimiter.admit(event.userId, clock.millis())) {
            log.debug("Dropped {} from {}: rate limited", event.type, event.userId);
            return;
        }

        String utm = event.type == EventType.START ? event.argument : null;
        repository.saveUser(event.userId, event.username, event.firstName, event.languageCode, utm);

        if (route.interrupts && !session.isIdle()) {
            SessionState previous = sessions.clear(event.userId);
            log.debug("{} interrupted {} for {}", event.type, previous, event.userId);
            session = Session.idle();
        }

        log.debug("Route {} -> {} (user {})", event.type, route.name, event.userId);
        route.handler.handle(event, session);
    }
}
