package com.escada.rentbot;

import com.escada.rentbot.config.BotConfig;
import com.escada.rentbot.dispatch.EventClassifier;
import com.escada.rentbot.dispatch.InboundEvent;
import com.escada.rentbot.dispatch.UpdateRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Long-polling entry point. Updates are handed to a pool of single-thread lanes picked by user id,
 * so one user's events stay in order while different users are served in parallel.
 */
public final class EscadaBot extends TelegramLongPollingBot {
    private static final Logger log = LoggerFactory.getLogger(EscadaBot.class);

    private final BotConfig config;
    private final ExecutorService[] lanes;
    private volatile UpdateRouter router;

    public EscadaBot(BotConfig config) {
        super(config.botToken);
        this.config = config;
        this.lanes = new ExecutorService[config.updateWorkers];
        for (int i = 0; i < lanes.length; i++) {
            String name = "update-worker-" + i;
            lanes[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            });
        }
    }

    /** The router needs a transport built on this bot, so it is attached after construction. */
    public void bind(UpdateRouter router) {
        this.router = router;
    }

    @Override
    public String getBotUsername() {
        return config.botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        InboundEvent event;
        try {
            event = EventClassifier.classify(update);
        } catch (Exception e) {
            log.error("Update {} not classified: {}", update.getUpdateId(), e.getMessage(), e);
            return;
        }
        if (event == null) return;

        lanes[Math.floorMod(Long.hashCode(event.userId), lanes.length)].execute(() -> handle(event));
    }

    void handle(InboundEvent event) {
        UpdateRouter r = router;
        if (r == null) {
            log.warn("Router not bound yet, dropping {}", event);
            return;
        }
        try {
            r.route(event);
        } catch (Exception e) {
            log.error("onUpdateReceived error ({}): {}", event, e.getMessage(), e);
        }
    }

    public void shutdown() {
        for (ExecutorService lane : lanes) {
            lane.shutdown();
        }
        for (ExecutorService lane : lanes) {
            try {
                if (!lane.awaitTermination(5, TimeUnit.SECONDS)) {
                    lane.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lane.shutdownNow();
            }
        }
    }
}
