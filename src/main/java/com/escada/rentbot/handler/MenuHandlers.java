package com.escada.rentbot.handler;

import com.escada.rentbot.config.BotConfig;
import com.escada.rentbot.db.Repository;
import com.escada.rentbot.dispatch.InboundEvent;
import com.escada.rentbot.model.Session;
import com.escada.rentbot.model.SessionState;
import com.escada.rentbot.session.SessionStore;
import com.escada.rentbot.subscription.MembershipCheck;
import com.escada.rentbot.subscription.SubscriptionCache;
import com.escada.rentbot.transport.MessageCache;
import com.escada.rentbot.transport.TransportException;
import com.escada.rentbot.ui.Keyboards;
import com.escada.rentbot.ui.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Main menu, help, cancel and the catch-all replies.
 */
public final class MenuHandlers {
    private static final Logger log = LoggerFactory.getLogger(MenuHandlers.class);

    static final long HELP_COOLDOWN_MILLIS = 5_000;

    private final BotConfig config;
    private final Repository repository;
    private final SessionStore sessions;
    private final SubscriptionCache subscriptions;
    private final MembershipCheck membership;
    private final MessageCache messageCache;
    private final Replier replier;
    private final Clock clock;

    public MenuHandlers(BotConfig config,
                        Repository repository,
                        SessionStore sessions,
                        SubscriptionCache subscriptions,
                        MembershipCheck membership,
                        MessageCache messageCache,
                        Replier replier,
                        Clock clock) {
        this.config = config;
        this.repository = repository;
        this.sessions = sessions;
        this.subscriptions = subscriptions;
        this.membership = membership;
        this.messageCache = messageCache;
        this.replier = replier;
        this.clock = clock;
    }

    public void start(InboundEvent e, Session s) throws TransportException {
        if (e.argument != null) {
            log.info("User {} started with tag {}", e.userId, e.argument);
        }
        replier.reply(e, Texts.welcome(e.firstName), Keyboards.mainMenu());
    }

    public void selectCity(InboundEvent e, Session s) throws TransportException {
        replier.reply(e, Texts.CITY_PROMPT, Keyboards.cities(repository.listAvailableCities()));
        sessions.enter(e.userId, SessionState.AWAITING_CITY);
    }

    public void rent(InboundEvent e, Session s) throws TransportException {
        replier.reply(e, Texts.rent(config.adminContact), Keyboards.contactAdmin(config.adminContact));
    }

    public void subscribe(InboundEvent e, Session s) throws TransportException {
        replier.reply(e, Texts.subscribe(config.mainChannel), Keyboards.subscribeOnly(config.mainChannelLink));
    }

    public void checkSubscription(InboundEvent e, Session s) throws TransportException {
        if (subscriptions.isSubscribed(e.userId, clock.millis(), membership)) {
            replier.reply(e, Texts.subscribed(config.mainChannel));
        } else {
            replier.reply(e, Texts.notSubscribed(config.mainChannel), Keyboards.subscribeOnly(config.mainChannelLink));
        }
    }

    public void help(InboundEvent e, Session s) throws TransportException {
        if (!messageCache.tryShowHelp(e.userId, clock.millis(), HELP_COOLDOWN_MILLIS)) {
            log.debug("Help suppressed for {}", e.userId);
            return;
        }
        replier.reply(e, Texts.help(config.mainChannel, config.adminContact));
    }

    public void cancel(InboundEvent e, Session s) throws TransportException {
        SessionState previous = sessions.clear(e.userId);
        if (previous != SessionState.IDLE) {
            replier.reply(e, Texts.CANCELLED, Keyboards.mainMenu());
        } else {
            replier.reply(e, Texts.NOTHING_TO_CANCEL);
        }
    }

    public void unknownCommand(InboundEvent e, Session s) throws TransportException {
        replier.reply(e, Texts.UNKNOWN_COMMAND);
    }

    public void fallback(InboundEvent e, Session s) throws TransportException {
        replier.reply(e, Texts.greeting(e.firstName), Keyboards.mainMenu());
    }

    public void backToMenu(InboundEvent e, Session s) throws TransportException {
        sessions.clear(e.userId);
        replier.safeEdit(e, Texts.MAIN_MENU, null);
        replier.answer(e);
    }

    public void unknownCallback(InboundEvent e, Session s) {
        log.debug("Unknown callback '{}' from {}", e.text, e.userId);
        replier.answer(e);
    }
}
