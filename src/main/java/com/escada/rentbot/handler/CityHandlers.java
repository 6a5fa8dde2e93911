package com.escada.rentbot.handler;

import com.escada.rentbot.city.CityResolver;
import com.escada.rentbot.config.BotConfig;
import com.escada.rentbot.db.Repository;
import com.escada.rentbot.dispatch.InboundEvent;
import com.escada.rentbot.model.City;
import com.escada.rentbot.model.Session;
import com.escada.rentbot.model.SessionState;
import com.escada.rentbot.session.SessionStore;
import com.escada.rentbot.subscription.MembershipCheck;
import com.escada.rentbot.subscription.SubscriptionCache;
import com.escada.rentbot.transport.TransportException;
import com.escada.rentbot.ui.Keyboards;
import com.escada.rentbot.ui.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * City selection: typed name, inline button, and the subscription check that unlocks the city
 * channel link.
 */
public final class CityHandlers {
    private static final Logger log = LoggerFactory.getLogger(CityHandlers.class);

    private final BotConfig config;
    private final Repository repository;
    private final CityResolver resolver;
    private final SessionStore sessions;
    private final SubscriptionCache subscriptions;
    private final MembershipCheck membership;
    private final Replier replier;
    private final Clock clock;

    public CityHandlers(BotConfig config,
                        Repository repository,
                        CityResolver resolver,
                        SessionStore sessions,
                        SubscriptionCache subscriptions,
                        MembershipCheck membership,
                        Replier replier,
                        Clock clock) {
        this.config = config;
        this.repository = repository;
        this.resolver = resolver;
        this.sessions = sessions;
        this.subscriptions = subscriptions;
        this.membership = membership;
        this.replier = replier;
        this.clock = clock;
    }

    /** Text typed while in AWAITING_CITY. */
    public void cityText(InboundEvent e, Session s) throws TransportException {
        Optional<City> found = resolver.resolve(e.text);
        if (found.isEmpty()) {
            replier.reply(e, Texts.cityNotFound(e.text), Keyboards.cities(repository.listAvailableCities()));
            return;
        }

        City city = found.get();
        if (!city.hasChannel()) {
            replier.reply(e, Texts.cityWithoutChannel(city.nameUk), Keyboards.cities(repository.listAvailableCities()));
            return;
        }

        if (isSubscribed(e.userId)) {
            repository.updateUserCity(e.userId, city);
            replier.reply(e, Texts.cityFound(city.nameUk), Keyboards.cityChannelShort(city));
            sessions.clear(e.userId);
            log.info("User {} got channel of {}", e.userId, city.code);
        } else {
            sessions.updatePayload(e.userId, payloadOf(city));
            replier.reply(e, Texts.cityFoundSubscribeFirst(city.nameUk, config.mainChannel),
                    Keyboards.subscription(config.mainChannelLink));
        }
    }

    /** {@code city_<code>} button. */
    public void cityCallback(InboundEvent e, Session s) throws TransportException {
        Optional<City> found = repository.findCityByCode(e.argument).filter(c -> c.active && c.hasChannel());
        if (found.isEmpty()) {
            replier.safeEdit(e, Texts.CITY_UNAVAILABLE, Keyboards.cities(repository.listAvailableCities()));
            replier.answer(e);
            return;
        }

        City city = found.get();
        // the button may be pressed from an old message with no flow in progress
        sessions.enter(e.userId, SessionState.AWAITING_CITY, payloadOf(city));

        if (isSubscribed(e.userId)) {
            sendCityChannel(e, city);
            sessions.clear(e.userId);
        } else {
            replier.safeEdit(e, Texts.cityChosenSubscribeFirst(city.nameUk, config.mainChannel),
                    Keyboards.subscription(config.mainChannelLink));
        }
        replier.answer(e);
    }

    public void checkSubscriptionCallback(InboundEvent e, Session s) throws TransportException {
        String cityCode = s.get(Session.SELECTED_CITY);
        if (cityCode == null) {
            replier.answer(e, Texts.ALERT_CITY_NOT_SELECTED, true);
            return;
        }

        if (!isSubscribed(e.userId)) {
            replier.answer(e, Texts.ALERT_NOT_SUBSCRIBED, true);
            return;
        }

        Optional<City> city = repository.findCityByCode(cityCode).filter(City::hasChannel);
        if (city.isEmpty()) {
            replier.answer(e, Texts.ALERT_CITY_NOT_FOUND, true);
            return;
        }
        sendCityChannel(e, city.get());
        sessions.clear(e.userId);
        replier.answer(e, Texts.TOAST_SUBSCRIPTION_CONFIRMED, false);
    }

    private void sendCityChannel(InboundEvent e, City city) throws TransportException {
        repository.updateUserCity(e.userId, city);
        replier.safeEdit(e, Texts.cityChannel(city.nameUk), Keyboards.cityChannel(city, config.adminContact));
        log.info("User {} got channel of {}", e.userId, city.code);
    }

    private boolean isSubscribed(long userId) {
        return subscriptions.isSubscribed(userId, clock.millis(), membership);
    }

    private static Map<String, String> payloadOf(City city) {
        return Map.of(Session.SELECTED_CITY, city.code, Session.CITY_NAME, city.nameUk);
    }
}
