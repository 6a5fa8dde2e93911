package com.escada.rentbot.db;

import com.escada.rentbot.model.AdminStats;
import com.escada.rentbot.model.BroadcastPayload;
import com.escada.rentbot.model.BroadcastStatus;
import com.escada.rentbot.model.City;
import com.escada.rentbot.model.Delivery;
import com.escada.rentbot.model.DeliveryStatus;
import com.escada.rentbot.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQL shared by both storage engines. Timestamps are epoch millis in BIGINT columns and booleans
 * are bound with {@link PreparedStatement#setBoolean}, so the only engine-specific parts are the
 * DDL and the way a generated id is read back.
 */
abstract class JdbcRepository implements Repository {
    private static final Logger log = LoggerFactory.getLogger(JdbcRepository.class);

    private static final String CITY_COLUMNS = "c.code, c.name_uk, c.channel_url, c.is_active";

    protected final Database db;
    protected final Clock clock;

    protected JdbcRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    protected abstract List<String> schemaStatements();

    /**
     * Executes an INSERT with already bound parameters and returns the generated {@code id}.
     */
    protected abstract long insertReturningId(Connection conn, String insertSql, Binder binder) throws SQLException;

    @FunctionalInterface
    protected interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private long now() {
        return clock.millis();
    }

    /* ---------------------------
       Schema
       --------------------------- */

    @Override
    public void initSchema() {
        try (Connection conn = db.openConnection(); Statement st = conn.createStatement()) {
            for (String ddl : schemaStatements()) {
                st.execute(ddl);
            }
            log.info("{} schema initialized.", db.engine());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to init " + db.engine() + " schema", e);
        }
    }

    @Override
    public void seedCities(List<CitySeed> seeds) {
        long now = now();
        try (Connection conn = db.openConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement city = conn.prepareStatement("""
                         INSERT INTO cities (code, name_uk, channel_url, is_active, created_at, updated_at)
                         VALUES (?, ?, ?, ?, ?, ?)
                         ON CONFLICT (code) DO NOTHING
                         """);
                 PreparedStatement alias = conn.prepareStatement("""
                         INSERT INTO city_aliases (city_code, alias, alias_norm)
                         VALUES (?, ?, ?)
                         ON CONFLICT (city_code, alias_norm) DO NOTHING
                         """)) {
                for (CitySeed seed : seeds) {
                    city.setString(1, seed.code);
                    city.setString(2, seed.nameUk);
                    city.setString(3, seed.channelUrl);
                    city.setBoolean(4, true);
                    city.setLong(5, now);
                    city.setLong(6, now);
                    city.addBatch();
                }
                city.executeBatch();

                for (CitySeed seed : seeds) {
                    for (String a : seed.aliases) {
                        alias.setString(1, seed.code);
                        alias.setString(2, a);
                        alias.setString(3, CitySeed.normalizeAlias(a));
                        alias.addBatch();
                    }
                }
                alias.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            log.info("City reference data seeded ({} cities).", seeds.size());
        } catch (SQLException e) {
            throw new RuntimeException("seedCities failed", e);
        }
    }

    /* ---------------------------
       Users
       --------------------------- */

    @Override
    public long saveUser(long tgId, String username, String firstName, String lang, String utmSource) {
        long now = now();
        try (Connection conn = db.openConnection()) {
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO users (tg_id, username, first_name, lang, utm_source, created_at, updated_at, last_seen_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    ON CONFLICT (tg_id) DO UPDATE SET
                        username = excluded.username,
                        first_name = excluded.first_name,
                        last_seen_at = excluded.last_seen_at,
                        updated_at = excluded.updated_at
                    """)) {
                ps.setLong(1, tgId);
                ps.setString(2, username);
                ps.setString(3, firstName);
                ps.setString(4, lang == null || lang.isBlank() ? "uk" : lang);
                ps.setString(5, utmSource);
                ps.setLong(6, now);
                ps.setLong(7, now);
                ps.setLong(8, now);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM users WHERE tg_id = ?")) {
                ps.setLong(1, tgId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) throw new SQLException("user " + tgId + " vanished after upsert");
                    return rs.getLong(1);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("saveUser failed", e);
        }
    }

    @Override
    public Optional<User> getUserByExternalId(long tgId) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT * FROM users WHERE tg_id = ?")) {
            ps.setLong(1, tgId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapUser(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("getUserByExternalId failed", e);
        }
    }

    @Override
    public void setUserBlocked(long tgId, boolean blocked, String reason) {
        long now = now();
        try (Connection conn = db.openConnection()) {
            conn.setAutoCommit(false);
            try {
                int changed;
                try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE users SET is_blocked = ?, is_active = ?, updated_at = ?
                        WHERE tg_id = ? AND is_blocked <> ?
                        """)) {
                    ps.setBoolean(1, blocked);
                    ps.setBoolean(2, !blocked);
                    ps.setLong(3, now);
                    ps.setLong(4, tgId);
                    ps.setBoolean(5, blocked);
                    changed = ps.executeUpdate();
                }
                if (blocked && changed > 0) {
                    try (PreparedStatement ps = conn.prepareStatement("""
                            INSERT INTO unsubscriptions (user_id, reason, created_at)
                            SELECT id, ?, ? FROM users WHERE tg_id = ?
                            """)) {
                        ps.setString(1, reason);
                        ps.setLong(2, now);
                        ps.setLong(3, tgId);
                        ps.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("setUserBlocked failed", e);
        }
    }

    @Override
    public int countUsers(boolean activeOnly) {
        String sql = activeOnly
                ? "SELECT COUNT(*) FROM users WHERE is_active = ? AND is_blocked = ?"
                : "SELECT COUNT(*) FROM users";
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            if (activeOnly) {
                ps.setBoolean(1, true);
                ps.setBoolean(2, false);
            }
            return count(ps);
        } catch (SQLException e) {
            throw new RuntimeException("countUsers failed", e);
        }
    }

    @Override
    public List<User> listActiveUsers() {
        List<User> users = new ArrayList<>();
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     SELECT * FROM users WHERE is_active = ? AND is_blocked = ? ORDER BY id
                     """)) {
            ps.setBoolean(1, true);
            ps.setBoolean(2, false);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) users.add(mapUser(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("listActiveUsers failed", e);
        }
        return users;
    }

    /* ---------------------------
       Cities
       --------------------------- */

    @Override
    public Optional<City> findCityByAlias(String input) {
        if (input == null || input.isBlank()) return Optional.empty();
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT " + CITY_COLUMNS + """
                      FROM city_aliases a
                     JOIN cities c ON c.code = a.city_code
                     WHERE a.alias_norm = ? AND c.is_active = ?
                     ORDER BY a.id
                     LIMIT 1
                     """)) {
            ps.setString(1, CitySeed.normalizeAlias(input));
            ps.setBoolean(2, true);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapCity(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("findCityByAlias failed", e);
        }
    }

    @Override
    public Optional<City> findCityByCode(String code) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT " + CITY_COLUMNS + " FROM cities c WHERE c.code = ? AND c.is_active = ?")) {
            ps.setString(1, code);
            ps.setBoolean(2, true);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapCity(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("findCityByCode failed", e);
        }
    }

    @Override
    public List<City> findCitiesByPrefix(String prefix, int limit) {
        if (prefix == null || prefix.isBlank()) return List.of();
        // several aliases of one city may match, keep the first (shortest) one
        Map<String, City> found = new LinkedHashMap<>();
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT " + CITY_COLUMNS + """
                      FROM city_aliases a
                     JOIN cities c ON c.code = a.city_code
                     WHERE a.alias_norm LIKE ? ESCAPE '\\' AND c.is_active = ?
                     ORDER BY LENGTH(a.alias_norm) ASC, a.id ASC
                     """)) {
            ps.setString(1, escapeLike(CitySeed.normalizeAlias(prefix)) + "%");
            ps.setBoolean(2, true);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next() && found.size() < limit) {
                    City c = mapCity(rs);
                    found.putIfAbsent(c.code, c);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("findCitiesByPrefix failed", e);
        }
        return new ArrayList<>(found.values());
    }

    @Override
    public List<City> listAvailableCities() {
        List<City> cities = new ArrayList<>();
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT " + CITY_COLUMNS + """
                      FROM cities c
                     WHERE c.is_active = ? AND c.channel_url IS NOT NULL AND c.channel_url <> ''
                     ORDER BY c.name_uk
                     """)) {
            ps.setBoolean(1, true);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) cities.add(mapCity(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("listAvailableCities failed", e);
        }
        return cities;
    }

    @Override
    public void updateUserCity(long tgId, City city) {
        long now = now();
        try (Connection conn = db.openConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE users SET last_city = ?, updated_at = ? WHERE tg_id = ?
                        """)) {
                    ps.setString(1, city.nameUk);
                    ps.setLong(2, now);
                    ps.setLong(3, tgId);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement("""
                        INSERT INTO user_city_history (user_id, city_code, city_name_uk, selected_at)
                        SELECT id, ?, ?, ? FROM users WHERE tg_id = ?
                        """)) {
                    ps.setString(1, city.code);
                    ps.setString(2, city.nameUk);
                    ps.setLong(3, now);
                    ps.setLong(4, tgId);
                    ps.executeUpdate();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("updateUserCity failed", e);
        }
    }

    /* ---------------------------
       Broadcasts
       --------------------------- */

    @Override
    public long createBroadcast(BroadcastPayload payload, long createdByTgId) {
        long now = now();
        try (Connection conn = db.openConnection()) {
            return insertReturningId(conn, """
                    INSERT INTO broadcasts (title, body_text, photo_file_id, segment_query, status, created_by_tg_id, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                    """, ps -> {
                ps.setString(1, payload.title());
                ps.setString(2, payload.text);
                ps.setString(3, payload.photoFileId);
                ps.setString(4, "{\"is_active\":true,\"is_blocked\":false}");
                ps.setString(5, BroadcastStatus.DRAFT.dbValue());
                ps.setLong(6, createdByTgId);
                ps.setLong(7, now);
            });
        } catch (SQLException e) {
            throw new RuntimeException("createBroadcast failed", e);
        }
    }

    @Override
    public void markBroadcastRunning(long broadcastId) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     UPDATE broadcasts SET status = ?, started_at = ? WHERE id = ? AND status = ?
                     """)) {
            ps.setString(1, BroadcastStatus.RUNNING.dbValue());
            ps.setLong(2, now());
            ps.setLong(3, broadcastId);
            ps.setString(4, BroadcastStatus.DRAFT.dbValue());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("markBroadcastRunning failed", e);
        }
    }

    @Override
    public void completeBroadcast(long broadcastId, String statsJson) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     UPDATE broadcasts SET status = ?, finished_at = ?, stats_json = ? WHERE id = ?
                     """)) {
            ps.setString(1, BroadcastStatus.COMPLETED.dbValue());
            ps.setLong(2, now());
            ps.setString(3, statsJson);
            ps.setLong(4, broadcastId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("completeBroadcast failed", e);
        }
    }

    @Override
    public int createDeliveriesForBroadcast(long broadcastId) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     INSERT INTO deliveries (broadcast_id, user_id, status, attempts)
                     SELECT ?, id, ?, 0 FROM users
                     WHERE is_active = ? AND is_blocked = ?
                     ON CONFLICT (broadcast_id, user_id) DO NOTHING
                     """)) {
            ps.setLong(1, broadcastId);
            ps.setString(2, DeliveryStatus.QUEUED.dbValue());
            ps.setBoolean(3, true);
            ps.setBoolean(4, false);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("createDeliveriesForBroadcast failed", e);
        }
    }

    @Override
    public List<Delivery> getQueuedDeliveries(long broadcastId, int limit) {
        List<Delivery> deliveries = new ArrayList<>();
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     SELECT d.id, d.broadcast_id, d.user_id, u.tg_id
                     FROM deliveries d
                     JOIN users u ON u.id = d.user_id
                     WHERE d.broadcast_id = ? AND d.status = ?
                     ORDER BY d.id
                     LIMIT ?
                     """)) {
            ps.setLong(1, broadcastId);
            ps.setString(2, DeliveryStatus.QUEUED.dbValue());
            ps.setInt(3, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    deliveries.add(new Delivery(
                            rs.getLong("id"),
                            rs.getLong("broadcast_id"),
                            rs.getLong("user_id"),
                            rs.getLong("tg_id")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("getQueuedDeliveries failed", e);
        }
        return deliveries;
    }

    @Override
    public void updateDeliveryStatus(long deliveryId, DeliveryStatus status, String errorCode) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     UPDATE deliveries
                     SET status = ?,
                         attempts = attempts + 1,
                         error_code = ?,
                         sent_at = COALESCE(?, sent_at)
                     WHERE id = ?
                     """)) {
            ps.setString(1, status.dbValue());
            ps.setString(2, errorCode);
            if (status == DeliveryStatus.SENT) {
                ps.setLong(3, now());
            } else {
                ps.setNull(3, Types.BIGINT);
            }
            ps.setLong(4, deliveryId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("updateDeliveryStatus failed", e);
        }
    }

    /* ---------------------------
       Admin
       --------------------------- */

    @Override
    public AdminStats getAdminStats() {
        long now = now();
        long weekAgo = now - Duration.ofDays(7).toMillis();
        long monthAgo = now - Duration.ofDays(30).toMillis();

        try (Connection conn = db.openConnection()) {
            int total = count(conn, "SELECT COUNT(*) FROM users", ps -> { });
            int active = count(conn, "SELECT COUNT(*) FROM users WHERE is_active = ? AND is_blocked = ?", ps -> {
                ps.setBoolean(1, true);
                ps.setBoolean(2, false);
            });
            int blocked = count(conn, "SELECT COUNT(*) FROM users WHERE is_blocked = ?", ps -> ps.setBoolean(1, true));
            int unsubs = count(conn, "SELECT COUNT(*) FROM unsubscriptions", ps -> { });
            int newUsers = count(conn, "SELECT COUNT(*) FROM users WHERE created_at >= ?", ps -> ps.setLong(1, weekAgo));
            int unsubs7d = count(conn, "SELECT COUNT(*) FROM unsubscriptions WHERE created_at >= ?", ps -> ps.setLong(1, weekAgo));

            List<AdminStats.CityCount> top = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement("""
                    SELECT city_name_uk, COUNT(*) AS cnt
                    FROM user_city_history
                    WHERE selected_at >= ?
                    GROUP BY city_name_uk
                    ORDER BY cnt DESC, city_name_uk ASC
                    LIMIT 5
                    """)) {
                ps.setLong(1, monthAgo);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        top.add(new AdminStats.CityCount(rs.getString("city_name_uk"), rs.getInt("cnt")));
                    }
                }
            }
            return new AdminStats(total, active, blocked, unsubs, newUsers, unsubs7d, top);
        } catch (SQLException e) {
            throw new RuntimeException("getAdminStats failed", e);
        }
    }

    @Override
    public void logAdminAction(long adminTgId, String action, String payloadJson) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     INSERT INTO admin_actions (admin_tg_id, action, payload_json, created_at)
                     VALUES (?, ?, ?, ?)
                     """)) {
            ps.setLong(1, adminTgId);
            ps.setString(2, action);
            ps.setString(3, payloadJson);
            ps.setLong(4, now());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("logAdminAction failed", e);
        }
    }

    @Override
    public void addDailyMetrics(LocalDate day, int sent, int errors, int blocked) {
        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("""
                     INSERT INTO metrics_daily (metric_date, sent_messages, errors_count, blocked_users, unsubs)
                     VALUES (?, ?, ?, ?, ?)
                     ON CONFLICT (metric_date) DO UPDATE SET
                         sent_messages = metrics_daily.sent_messages + excluded.sent_messages,
                         errors_count = metrics_daily.errors_count + excluded.errors_count,
                         blocked_users = metrics_daily.blocked_users + excluded.blocked_users,
                         unsubs = metrics_daily.unsubs + excluded.unsubs
                     """)) {
            ps.setString(1, day.toString());
            ps.setInt(2, sent);
            ps.setInt(3, errors);
            ps.setInt(4, blocked);
            ps.setInt(5, blocked);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("addDailyMetrics failed", e);
        }
    }

    /* ---------------------------
       Helpers
       --------------------------- */

    private static int count(Connection conn, String sql, Binder binder) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            return count(ps);
        }
    }

    private static int count(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    static String escapeLike(String s) {
        return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static User mapUser(ResultSet rs) throws SQLException {
        long lastSeen = rs.getLong("last_seen_at");
        Long lastSeenAt = rs.wasNull() ? null : lastSeen;
        return new User(
                rs.getLong("id"),
                rs.getLong("tg_id"),
                rs.getString("username"),
                rs.getString("first_name"),
                rs.getString("lang"),
                rs.getString("last_city"),
                rs.getBoolean("is_active"),
                rs.getBoolean("is_blocked"),
                rs.getLong("created_at"),
                rs.getLong("updated_at"),
                lastSeenAt,
                rs.getString("utm_source")
        );
    }

    private static City mapCity(ResultSet rs) throws SQLException {
        return new City(
                rs.getString("code"),
                rs.getString("name_uk"),
                rs.getString("channel_url"),
                rs.getBoolean("is_active")
        );
    }
}
