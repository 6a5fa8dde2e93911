package com.escada.rentbot.handler;

import com.escada.rentbot.city.CityResolver;
import com.escada.rentbot.config.BotConfig;
import com.escada.rentbot.db.Repository;
import com.escada.rentbot.dispatch.EventType;
import com.escada.rentbot.dispatch.InboundEvent;
import com.escada.rentbot.model.City;
import com.escada.rentbot.model.Session;
import com.escada.rentbot.model.SessionState;
import com.escada.rentbot.session.SessionStore;
import com.escada.rentbot.subscription.SubscriptionCache;
import com.escada.rentbot.transport.ChatTransport;
import com.escada.rentbot.transport.MessageCache;
import com.escada.rentbot.ui.Texts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CityHandlersTest {

    private static final long USER = 321L;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-20T10:15:30Z"), ZoneOffset.UTC);
    private static final City LVIV = new City("lviv", "Львів", "https://t.me/Escada_Lviv", true);
    private static final City POLTAVA = new City("poltava", "Полтава", null, true);

    private Repository repository;
    private ChatTransport transport;
    private SessionStore sessions;
    private AtomicBoolean member;
    private CityHandlers handlers;

    @BeforeEach
    void setUp() {
        BotConfig config = BotConfig.from(Map.of("BOT_TOKEN", "123456789:ABCdefGHIjklMNOpqrSTUvwxYZ0123456789"));
        repository = mock(Repository.class);
        transport = mock(ChatTransport.class);
        sessions = new SessionStore();
        member = new AtomicBoolean(false);
        MessageCache messageCache = new MessageCache();
        handlers = new CityHandlers(config, repository, new CityResolver(repository), sessions,
                new SubscriptionCache(Duration.ZERO), userId -> member.get(),
                new Replier(transport, messageCache), CLOCK);

        when(repository.findCityByAlias(anyString())).thenReturn(Optional.empty());
        when(repository.findCitiesByPrefix(anyString(), anyInt())).thenReturn(List.of());
        when(repository.findCityByAlias("Львів")).thenReturn(Optional.of(LVIV));
        when(repository.findCityByAlias("Полтава")).thenReturn(Optional.of(POLTAVA));
        when(repository.findCityByCode("lviv")).thenReturn(Optional.of(LVIV));
        when(repository.findCityByCode("poltava")).thenReturn(Optional.of(POLTAVA));
        when(repository.listAvailableCities()).thenReturn(List.of(LVIV));
    }

    private static InboundEvent text(String text) {
        return InboundEvent.builder(EventType.TEXT, USER, USER).messageId(5).text(text).build();
    }

    private static InboundEvent callback(EventType type, String argument) {
        return InboundEvent.builder(type, USER, USER).messageId(9).callbackId("cb").argument(argument).build();
    }

    @Test
    void shouldGuideWhenCityIsUnknown() throws Exception {
        sessions.enter(USER, SessionState.AWAITING_CITY);

        handlers.cityText(text("Атлантида"), sessions.get(USER));

        verify(transport).sendMessage(eq(USER), contains("Атлантида"), any());
        assertThat(sessions.get(USER).state).isEqualTo(SessionState.AWAITING_CITY);
    }

    @Test
    void shouldEscapeUserInputInReply() throws Exception {
        handlers.cityText(text("<b>Київ</b>"), Session.idle());

        verify(transport).sendMessage(eq(USER), contains("&lt;b&gt;Київ&lt;/b&gt;"), any());
    }

    @Test
    void shouldReportCityWithoutChannel() throws Exception {
        sessions.enter(USER, SessionState.AWAITING_CITY);

        handlers.cityText(text("Полтава"), sessions.get(USER));

        verify(transport).sendMessage(eq(USER), contains("поки недоступний"), any());
        verify(repository, never()).updateUserCity(anyLong(), any());
    }

    @Test
    void shouldSendChannelToSubscribedUser() throws Exception {
        member.set(true);
        sessions.enter(USER, SessionState.AWAITING_CITY);

        handlers.cityText(text("Львів"), sessions.get(USER));

        verify(repository).updateUserCity(USER, LVIV);
        verify(transport).sendMessage(eq(USER), eq(Texts.cityFound("Львів")), any());
        assertThat(sessions.get(USER).isIdle()).isTrue();
    }

    @Test
    void shouldRememberCityAndAskToSubscribe() throws Exception {
        sessions.enter(USER, SessionState.AWAITING_CITY);

        handlers.cityText(text("Львів"), sessions.get(USER));

        Session s = sessions.get(USER);
        assertThat(s.state).isEqualTo(SessionState.AWAITING_CITY);
        assertThat(s.get(Session.SELECTED_CITY)).isEqualTo("lviv");
        assertThat(s.get(Session.CITY_NAME)).isEqualTo("Львів");
        verify(repository, never()).updateUserCity(anyLong(), any());
    }

    @Test
    void shouldOfferOtherCitiesWhenButtonCityHasNoChannel() throws Exception {
        handlers.cityCallback(callback(EventType.CALLBACK_CITY, "poltava"), Session.idle());

        verify(transport).editMessage(eq(USER), eq(9), eq(Texts.CITY_UNAVAILABLE), any());
        verify(transport).answerCallback("cb", null, false);
    }

    @Test
    void shouldStartFlowFromCityButtonWhenNotSubscribed() throws Exception {
        handlers.cityCallback(callback(EventType.CALLBACK_CITY, "lviv"), Session.idle());

        assertThat(sessions.get(USER).get(Session.SELECTED_CITY)).isEqualTo("lviv");
        verify(transport).editMessage(eq(USER), eq(9), contains("Ви обрали: Львів"), any());
    }

    @Test
    void shouldAlertWhenCheckingWithoutSelectedCity() throws Exception {
        handlers.checkSubscriptionCallback(callback(EventType.CALLBACK_CHECK_SUBSCRIPTION, null), Session.idle());

        verify(transport).answerCallback("cb", Texts.ALERT_CITY_NOT_SELECTED, true);
    }

    @Test
    void shouldAlertWhileStillNotSubscribed() throws Exception {
        sessions.enter(USER, SessionState.AWAITING_CITY, Map.of(Session.SELECTED_CITY, "lviv"));

        handlers.checkSubscriptionCallback(callback(EventType.CALLBACK_CHECK_SUBSCRIPTION, null), sessions.get(USER));

        verify(transport).answerCallback("cb", Texts.ALERT_NOT_SUBSCRIBED, true);
        assertThat(sessions.get(USER).get(Session.SELECTED_CITY)).isEqualTo("lviv");
    }

    @Test
    void shouldUnlockChannelOnceSubscribed() throws Exception {
        sessions.enter(USER, SessionState.AWAITING_CITY, Map.of(Session.SELECTED_CITY, "lviv"));
        member.set(true);

        handlers.checkSubscriptionCallback(callback(EventType.CALLBACK_CHECK_SUBSCRIPTION, null), sessions.get(USER));

        verify(repository).updateUserCity(USER, LVIV);
        verify(transport).editMessage(eq(USER), eq(9), eq(Texts.cityChannel("Львів")), any());
        verify(transport).answerCallback("cb", Texts.TOAST_SUBSCRIPTION_CONFIRMED, false);
        assertThat(sessions.get(USER).isIdle()).isTrue();
    }
}
