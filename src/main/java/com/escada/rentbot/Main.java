package com.escada.rentbot;

import com.escada.rentbot.antispam.RateLimiter;
import com.escada.rentbot.broadcast.BroadcastEngine;
import com.escada.rentbot.broadcast.BroadcastService;
import com.escada.rentbot.city.CityResolver;
import com.escada.rentbot.config.BotConfig;
import com.escada.rentbot.db.CitySeed;
import com.escada.rentbot.db.Database;
import com.escada.rentbot.db.Repository;
import com.escada.rentbot.dispatch.UpdateRouter;
import com.escada.rentbot.handler.AdminHandlers;
import com.escada.rentbot.handler.CityHandlers;
import com.escada.rentbot.handler.MenuHandlers;
import com.escada.rentbot.handler.Replier;
import com.escada.rentbot.session.SessionStore;
import com.escada.rentbot.subscription.ChannelMembership;
import com.escada.rentbot.subscription.SubscriptionCache;
import com.escada.rentbot.transport.MessageCache;
import com.escada.rentbot.transport.TelegramTransport;
import com.escada.rentbot.transport.TransportException;
import com.escada.rentbot.ui.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.methods.updates.DeleteWebhook;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        BotConfig config = BotConfig.fromEnv();

        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", config.logLevel.toLowerCase(Locale.ROOT));

        Database db = Database.fromConfig(config);
        Repository repository = db.createRepository();
        repository.initSchema();
        repository.seedCities(CitySeed.load());
        log.info("Database ready ({})", db.engine());

        Clock clock = Clock.systemDefaultZone();
        EscadaBot bot = new EscadaBot(config);

        User me;
        try {
            me = bot.execute(new GetMe());
        } catch (TelegramApiException e) {
            throw new IllegalStateException("Telegram API unreachable or BOT_TOKEN rejected", e);
        }
        log.info("Connected as @{}", me.getUserName());

        DeleteWebhook deleteWebhook = new DeleteWebhook();
        deleteWebhook.setDropPendingUpdates(true);
        bot.execute(deleteWebhook);

        SetMyCommands commands = new SetMyCommands();
        commands.setCommands(List.of(
                new BotCommand("start", "🚀 Почати роботу"),
                new BotCommand("help", "ℹ️ Довідка"),
                new BotCommand("cancel", "❌ Скасувати дію")));
        bot.execute(commands);

        TelegramTransport transport = new TelegramTransport(bot);
        MessageCache messageCache = new MessageCache();
        SessionStore sessions = new SessionStore();
        RateLimiter rateLimiter = RateLimiter.fromConfig(config);
        SubscriptionCache subscriptions = new SubscriptionCache(Duration.ofSeconds(config.subscriptionCacheTtlSeconds));
        ChannelMembership membership = new ChannelMembership(transport, config.mainChannel);
        Replier replier = new Replier(transport, messageCache);

        BroadcastEngine engine = new BroadcastEngine(transport, repository,
                config.broadcastDelayMs, config.broadcastProgressEvery);
        BroadcastService broadcasts = new BroadcastService(repository, engine, transport, clock);
        broadcasts.start();

        MenuHandlers menu = new MenuHandlers(config, repository, sessions, subscriptions, membership,
                messageCache, replier, clock);
        CityHandlers city = new CityHandlers(config, repository, new CityResolver(repository), sessions,
                subscriptions, membership, replier, clock);
        AdminHandlers admin = new AdminHandlers(config, repository, sessions, subscriptions, messageCache,
                rateLimiter, broadcasts, replier, clock);
        bot.bind(new UpdateRouter(menu, city, admin, rateLimiter, sessions, repository, clock));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown...");
            broadcasts.stop();
            bot.shutdown();
        }));

        TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
        botsApi.registerBot(bot);

        if (config.hasAdmin()) {
            try {
                transport.sendMessage(config.adminId,
                        Texts.startupNotice(me.getUserName(), config.adminContact, LocalDateTime.now(clock)), null);
            } catch (TransportException e) {
                log.warn("Admin not notified about startup: {}", e.getMessage());
            }
        }

        log.info("Bot started as @{}", me.getUserName());
    }
}
