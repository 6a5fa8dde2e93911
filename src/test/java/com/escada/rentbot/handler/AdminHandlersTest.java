package com.escada.rentbot.handler;

import com.escada.rentbot.antispam.RateLimiter;
import com.escada.rentbot.broadcast.BroadcastService;
import com.escada.rentbot.config.BotConfig;
import com.escada.rentbot.db.Repository;
import com.escada.rentbot.dispatch.EventType;
import com.escada.rentbot.dispatch.InboundEvent;
import com.escada.rentbot.model.AdminStats;
import com.escada.rentbot.model.BroadcastPayload;
import com.escada.rentbot.model.SessionState;
import com.escada.rentbot.session.SessionStore;
import com.escada.rentbot.subscription.SubscriptionCache;
import com.escada.rentbot.transport.ChatTransport;
import com.escada.rentbot.transport.MessageCache;
import com.escada.rentbot.transport.TransportException;
import com.escada.rentbot.ui.Texts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AdminHandlersTest {

    private static final long ADMIN = 999L;
    private static final long STRANGER = 123L;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-20T10:15:30Z"), ZoneOffset.UTC);

    private Repository repository;
    private ChatTransport transport;
    private BroadcastService broadcasts;
    private SessionStore sessions;
    private SubscriptionCache subscriptions;
    private MessageCache messageCache;
    private RateLimiter rateLimiter;
    private AdminHandlers handlers;

    @BeforeEach
    void setUp() throws Exception {
        BotConfig config = BotConfig.from(Map.of(
                "BOT_TOKEN", "123456789:ABCdefGHIjklMNOpqrSTUvwxYZ0123456789",
                "ADMIN_ID", String.valueOf(ADMIN)));
        repository = mock(Repository.class);
        transport = mock(ChatTransport.class);
        broadcasts = mock(BroadcastService.class);
        sessions = new SessionStore();
        subscriptions = new SubscriptionCache(Duration.ofMinutes(5));
        messageCache = new MessageCache();
        rateLimiter = new RateLimiter(1, Duration.ofSeconds(10), Duration.ZERO);
        handlers = new AdminHandlers(config, repository, sessions, subscriptions, messageCache, rateLimiter,
                broadcasts, new Replier(transport, messageCache), CLOCK);

        when(transport.sendMessage(anyLong(), anyString(), any())).thenReturn(55);
        when(repository.listAvailableCities()).thenReturn(List.of());
        when(repository.getAdminStats()).thenReturn(new AdminStats(10, 8, 2, 2, 3, 1, List.of()));
    }

    private static InboundEvent message(long userId, EventType type, String text) {
        return InboundEvent.builder(type, userId, userId).messageId(1).text(text).build();
    }

    private static InboundEvent callback(long userId, EventType type) {
        return InboundEvent.builder(type, userId, userId).messageId(40).callbackId("cb").build();
    }

    @Test
    void shouldHideAdminPanelFromOthers() throws Exception {
        sessions.enter(STRANGER, SessionState.AWAITING_CITY);

        handlers.panel(message(STRANGER, EventType.ADMIN, "/admin"), sessions.get(STRANGER));

        verify(transport).sendMessage(STRANGER, Texts.UNKNOWN_COMMAND, null);
        verify(repository, never()).countUsers(anyBoolean());
        assertThat(sessions.get(STRANGER).state).isEqualTo(SessionState.AWAITING_CITY);
    }

    @Test
    void shouldOpenPanelForAdmin() throws Exception {
        when(repository.countUsers(true)).thenReturn(8);

        handlers.panel(message(ADMIN, EventType.ADMIN, "/admin"), sessions.get(ADMIN));

        verify(transport).sendMessage(eq(ADMIN), contains("Адмін панель"), any());
        assertThat(sessions.get(ADMIN).state).isEqualTo(SessionState.ADMIN_MENU);
    }

    @Test
    void shouldRefuseClearCacheForOthersWithoutTouchingState() throws Exception {
        rateLimiter.admit(7L, 0);
        rateLimiter.admit(7L, 1);
        assertThat(rateLimiter.blockedCount()).isEqualTo(1);

        handlers.clearCacheCallback(callback(STRANGER, EventType.CALLBACK_ADMIN_CLEAR_CACHE), sessions.get(STRANGER));

        verify(transport).answerCallback("cb", Texts.ALERT_NO_ACCESS, true);
        assertThat(rateLimiter.blockedCount()).isEqualTo(1);
        verify(repository, never()).logAdminAction(anyLong(), anyString(), any());
    }

    @Test
    void shouldClearAllCachesForAdmin() throws Exception {
        rateLimiter.admit(7L, 0);
        rateLimiter.admit(7L, 1);
        subscriptions.isSubscribed(7L, 0, userId -> true);
        messageCache.rememberEdit(7L, 1, "x");

        handlers.clearCacheCallback(callback(ADMIN, EventType.CALLBACK_ADMIN_CLEAR_CACHE), sessions.get(ADMIN));

        assertThat(rateLimiter.blockedCount()).isZero();
        assertThat(subscriptions.size()).isZero();
        assertThat(messageCache.size()).isZero();
        verify(repository).logAdminAction(eq(ADMIN), eq("clear_cache"), contains("\"spam_blocked\":1"));
        verify(transport).answerCallback("cb", Texts.ALERT_CACHES_CLEARED, true);
    }

    @Test
    void shouldLogStatsView() throws Exception {
        handlers.statsCallback(callback(ADMIN, EventType.CALLBACK_ADMIN_STATS), sessions.get(ADMIN));

        verify(repository).logAdminAction(ADMIN, "view_stats", null);
        verify(transport).editMessage(eq(ADMIN), eq(40), contains("Розширена статистика"), any());
    }

    @Test
    void shouldEnterBroadcastCompositionFromPanel() throws Exception {
        handlers.broadcastCallback(callback(ADMIN, EventType.CALLBACK_ADMIN_BROADCAST), sessions.get(ADMIN));

        assertThat(sessions.get(ADMIN).state).isEqualTo(SessionState.AWAITING_BROADCAST_BODY);
    }

    @Test
    void shouldStayOutOfCompositionWhenPromptCannotBeShown() throws Exception {
        when(transport.sendMessage(anyLong(), anyString(), any()))
                .thenThrow(new TransportException("500", "Internal Server Error"));
        doThrow(new TransportException("400", "message to edit not found"))
                .when(transport).editMessage(anyLong(), anyInt(), anyString(), any());

        assertThatThrownBy(() -> handlers.broadcastCallback(
                callback(ADMIN, EventType.CALLBACK_ADMIN_BROADCAST), sessions.get(ADMIN)))
                .isInstanceOf(TransportException.class);

        assertThat(sessions.get(ADMIN).isIdle()).isTrue();
    }

    @Test
    void shouldIgnoreBroadcastBodyFromOthers() throws Exception {
        sessions.enter(STRANGER, SessionState.AWAITING_BROADCAST_BODY);

        handlers.broadcastBody(message(STRANGER, EventType.TEXT, "spam"), sessions.get(STRANGER));

        verifyNoInteractions(transport, broadcasts);
        assertThat(sessions.get(STRANGER).state).isEqualTo(SessionState.AWAITING_BROADCAST_BODY);
    }

    @Test
    void shouldKeepWaitingWhenBodyIsEmpty() throws Exception {
        sessions.enter(ADMIN, SessionState.AWAITING_BROADCAST_BODY);
        when(repository.countUsers(true)).thenReturn(3);

        handlers.broadcastBody(message(ADMIN, EventType.OTHER, null), sessions.get(ADMIN));

        verify(transport).sendMessage(ADMIN, Texts.EMPTY_BROADCAST, null);
        verifyNoInteractions(broadcasts);
        assertThat(sessions.get(ADMIN).state).isEqualTo(SessionState.AWAITING_BROADCAST_BODY);
    }

    @Test
    void shouldStopWhenNobodyToBroadcastTo() throws Exception {
        sessions.enter(ADMIN, SessionState.AWAITING_BROADCAST_BODY);
        when(repository.countUsers(true)).thenReturn(0);

        handlers.broadcastBody(message(ADMIN, EventType.TEXT, "Привіт"), sessions.get(ADMIN));

        verify(transport).sendMessage(ADMIN, Texts.NO_USERS_FOR_BROADCAST, null);
        verifyNoInteractions(broadcasts);
        assertThat(sessions.get(ADMIN).isIdle()).isTrue();
    }

    @Test
    void shouldLaunchBroadcastAndClearSession() throws Exception {
        sessions.enter(ADMIN, SessionState.AWAITING_BROADCAST_BODY);
        when(repository.countUsers(true)).thenReturn(3);
        when(broadcasts.launch(eq(ADMIN), eq(ADMIN), eq(55), any())).thenReturn(12L);

        handlers.broadcastBody(message(ADMIN, EventType.TEXT, "<b>Нові квартири</b>"), sessions.get(ADMIN));

        ArgumentCaptor<BroadcastPayload> payload = ArgumentCaptor.forClass(BroadcastPayload.class);
        verify(broadcasts).launch(eq(ADMIN), eq(ADMIN), eq(55), payload.capture());
        assertThat(payload.getValue().text).isEqualTo("<b>Нові квартири</b>");
        assertThat(payload.getValue().isPhoto()).isFalse();
        verify(transport).sendMessage(eq(ADMIN), contains("Розпочинаю розсилку"), isNull());
        verify(repository).logAdminAction(eq(ADMIN), eq("broadcast"), contains("\"broadcast_id\":12"));
        assertThat(sessions.get(ADMIN).isIdle()).isTrue();
    }

    @Test
    void shouldBroadcastPhotoWithCaption() throws Exception {
        sessions.enter(ADMIN, SessionState.AWAITING_BROADCAST_BODY);
        when(repository.countUsers(true)).thenReturn(3);
        InboundEvent photo = InboundEvent.builder(EventType.PHOTO, ADMIN, ADMIN)
                .photoFileId("AgACfile")
                .text("Підпис")
                .build();

        handlers.broadcastBody(photo, sessions.get(ADMIN));

        ArgumentCaptor<BroadcastPayload> payload = ArgumentCaptor.forClass(BroadcastPayload.class);
        verify(broadcasts).launch(eq(ADMIN), eq(ADMIN), anyInt(), payload.capture());
        assertThat(payload.getValue().isPhoto()).isTrue();
        assertThat(payload.getValue().photoFileId).isEqualTo("AgACfile");
    }
}
