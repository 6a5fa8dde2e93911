package com.escada.rentbot.config;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class BotConfig {
    public final String botToken;
    public final String botUsername;

    /** 0 means no administrator configured: every admin-only operation is rejected. */
    public final long adminId;

    /** Non-null selects the PostgreSQL repository, otherwise SQLite at {@link #dbPath}. */
    public final String databaseUrl;
    public final String dbPath;

    public final String mainChannel;
    public final String mainChannelLink;
    public final String adminContact;

    // antispam
    public final int rateLimitThreshold;
    public final int rateLimitWindowSeconds;
    public final int messageCooldownSeconds;

    public final int subscriptionCacheTtlSeconds;

    // broadcast throttle
    public final long broadcastDelayMs;
    public final int broadcastProgressEvery;

    public final int updateWorkers;

    public final String logLevel;

    private BotConfig(
            String botToken,
            String botUsername,
            long adminId,
            String databaseUrl,
            String dbPath,
            String mainChannel,
            String mainChannelLink,
            String adminContact,
            int rateLimitThreshold,
            int rateLimitWindowSeconds,
            int messageCooldownSeconds,
            int subscriptionCacheTtlSeconds,
            long broadcastDelayMs,
            int broadcastProgressEvery,
            int updateWorkers,
            String logLevel
    ) {
        this.botToken = botToken;
        this.botUsername = botUsername;
        this.adminId = adminId;
        this.databaseUrl = databaseUrl;
        this.dbPath = dbPath;
        this.mainChannel = mainChannel;
        this.mainChannelLink = mainChannelLink;
        this.adminContact = adminContact;
        this.rateLimitThreshold = rateLimitThreshold;
        this.rateLimitWindowSeconds = rateLimitWindowSeconds;
        this.messageCooldownSeconds = messageCooldownSeconds;
        this.subscriptionCacheTtlSeconds = subscriptionCacheTtlSeconds;
        this.broadcastDelayMs = broadcastDelayMs;
        this.broadcastProgressEvery = broadcastProgressEvery;
        this.updateWorkers = updateWorkers;
        this.logLevel = logLevel;
    }

    public static BotConfig fromEnv() {
        return from(System.getenv());
    }

    public static BotConfig from(Map<String, String> env) {
        String token = required(env, "BOT_TOKEN");
        if (!isValidToken(token)) {
            throw new IllegalStateException(
                    "BOT_TOKEN has invalid format, expected <digits>:<secret of 35+ chars>");
        }
        String username = value(env, "BOT_USERNAME").orElse("escada_rent_bot");

        long adminId = parseLong(value(env, "ADMIN_ID").orElse("0"));

        String databaseUrl = value(env, "DATABASE_URL").orElse(null);
        String dbPath = value(env, "DB_PATH").orElse("bot_database.db");

        String mainChannel = value(env, "MAIN_CHANNEL").orElse("@Escada_Ukraine");
        String mainChannelLink = value(env, "MAIN_CHANNEL_LINK")
                .orElse("https://t.me/" + mainChannel.replace("@", ""));
        String adminContact = value(env, "ADMIN_CONTACT").orElse("Escada_m").replace("@", "");

        int threshold = positive("RATE_LIMIT_THRESHOLD", parseInt(value(env, "RATE_LIMIT_THRESHOLD").orElse("5")));
        int window = positive("RATE_LIMIT_WINDOW_SECONDS", parseInt(value(env, "RATE_LIMIT_WINDOW_SECONDS").orElse("10")));
        int cooldown = parseInt(value(env, "MESSAGE_COOLDOWN_SECONDS").orElse("2"));
        int ttl = parseInt(value(env, "SUBSCRIPTION_CACHE_TTL_SECONDS").orElse("300"));

        long delayMs = parseLong(value(env, "BROADCAST_DELAY_MS").orElse("50"));
        int progressEvery = positive("BROADCAST_PROGRESS_EVERY", parseInt(value(env, "BROADCAST_PROGRESS_EVERY").orElse("10")));

        int workers = positive("UPDATE_WORKERS", parseInt(value(env, "UPDATE_WORKERS").orElse("8")));

        String logLevel = value(env, "LOG_LEVEL").orElse("INFO").toUpperCase(Locale.ROOT);

        return new BotConfig(
                token, username, adminId,
                databaseUrl, dbPath,
                mainChannel, mainChannelLink, adminContact,
                threshold, window, cooldown,
                ttl,
                delayMs, progressEvery,
                workers, logLevel
        );
    }

    public boolean usePostgres() {
        return databaseUrl != null;
    }

    public boolean hasAdmin() {
        return adminId != 0;
    }

    public boolean isAdmin(long userId) {
        return hasAdmin() && userId == adminId;
    }

    /**
     * Telegram tokens look like {@code 123456789:ABC-DEF1234ghIkl-zyx57W2v1u123ew11}.
     */
    static boolean isValidToken(String token) {
        if (token == null) return false;
        String[] parts = token.split(":");
        if (parts.length != 2) return false;
        try {
            Long.parseLong(parts[0]);
        } catch (NumberFormatException e) {
            return false;
        }
        return parts[1].length() >= 35;
    }

    private static Optional<String> value(Map<String, String> env, String name) {
        return Optional.ofNullable(env.get(name)).map(String::trim).filter(s -> !s.isEmpty());
    }

    private static String required(Map<String, String> env, String name) {
        return value(env, name).orElseThrow(() -> new IllegalStateException("Missing required ENV variable: " + name));
    }

    private static int positive(String name, int value) {
        if (value <= 0) {
            throw new IllegalStateException(name + " must be positive, got " + value);
        }
        return value;
    }

    private static long parseLong(String s) {
        try {
            return Long.parseLong(s.trim());
        } catch (Exception e) {
            throw new IllegalStateException("Invalid long ENV value: " + s, e);
        }
    }

    private static int parseInt(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (Exception e) {
            throw new IllegalStateException("Invalid int ENV value: " + s, e);
        }
    }
}
