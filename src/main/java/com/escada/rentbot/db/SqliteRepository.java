package com.escada.rentbot.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.List;

public final class SqliteRepository extends JdbcRepository {

    public SqliteRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public SqliteRepository(Database db, Clock clock) {
        super(db, clock);
    }

    @Override
    protected long insertReturningId(Connection conn, String insertSql, Binder binder) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
            binder.bind(ps);
            ps.executeUpdate();
        }
        // same connection, so last_insert_rowid() is ours
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) throw new SQLException("last_insert_rowid() returned nothing");
            return rs.getLong(1);
        }
    }

    @Override
    protected List<String> schemaStatements() {
        return List.of(
                """
                CREATE TABLE IF NOT EXISTS users (
                    id               INTEGER PRIMARY KEY AUTOINCREMENT,
                    tg_id            INTEGER UNIQUE NOT NULL,
                    username         TEXT,
                    first_name       TEXT,
                    lang             TEXT NOT NULL DEFAULT 'uk',
                    last_city        TEXT,
                    is_active        BOOLEAN NOT NULL DEFAULT 1,
                    is_blocked       BOOLEAN NOT NULL DEFAULT 0,
                    created_at       INTEGER NOT NULL,
                    updated_at       INTEGER NOT NULL,
                    last_seen_at     INTEGER,
                    utm_source       TEXT
                );
                """,
                "CREATE INDEX IF NOT EXISTS idx_users_is_active ON users(is_active, is_blocked);",
                """
                CREATE TABLE IF NOT EXISTS cities (
                    code          TEXT PRIMARY KEY,
                    name_uk       TEXT NOT NULL,
                    channel_url   TEXT,
                    is_active     BOOLEAN NOT NULL DEFAULT 1,
                    created_at    INTEGER NOT NULL,
                    updated_at    INTEGER NOT NULL
                );
                """,
                """
                CREATE TABLE IF NOT EXISTS city_aliases (
                    id          INTEGER PRIMARY KEY AUTOINCREMENT,
                    city_code   TEXT NOT NULL REFERENCES cities(code) ON DELETE CASCADE,
                    alias       TEXT NOT NULL,
                    alias_norm  TEXT NOT NULL,
                    UNIQUE (city_code, alias_norm)
                );
                """,
                "CREATE INDEX IF NOT EXISTS idx_city_alias_norm ON city_aliases(alias_norm);",
                """
                CREATE TABLE IF NOT EXISTS user_city_history (
                    id             INTEGER PRIMARY KEY AUTOINCREMENT,
                    user_id        INTEGER REFERENCES users(id) ON DELETE CASCADE,
                    city_code      TEXT REFERENCES cities(code),
                    city_name_uk   TEXT NOT NULL,
                    selected_at    INTEGER NOT NULL
                );
                """,
                "CREATE INDEX IF NOT EXISTS idx_uch_user_id ON user_city_history(user_id, selected_at DESC);",
                """
                CREATE TABLE IF NOT EXISTS rental_requests (
                    id            INTEGER PRIMARY KEY AUTOINCREMENT,
                    user_id       INTEGER REFERENCES users(id) ON DELETE SET NULL,
                    city_code     TEXT REFERENCES cities(code),
                    contact       TEXT,
                    description   TEXT,
                    status        TEXT NOT NULL DEFAULT 'new',
                    created_at    INTEGER NOT NULL,
                    updated_at    INTEGER NOT NULL
                );
                """,
                """
                CREATE TABLE IF NOT EXISTS broadcasts (
                    id                INTEGER PRIMARY KEY AUTOINCREMENT,
                    title             TEXT,
                    body_text         TEXT,
                    photo_file_id     TEXT,
                    buttons_json      TEXT,
                    segment_query     TEXT,
                    status            TEXT NOT NULL DEFAULT 'draft',
                    created_by_tg_id  INTEGER,
                    created_at        INTEGER NOT NULL,
                    started_at        INTEGER,
                    finished_at       INTEGER,
                    stats_json        TEXT
                );
                """,
                """
                CREATE TABLE IF NOT EXISTS deliveries (
                    id              INTEGER PRIMARY KEY AUTOINCREMENT,
                    broadcast_id    INTEGER NOT NULL REFERENCES broadcasts(id) ON DELETE CASCADE,
                    user_id         INTEGER NOT NULL REFERENCES users(id) ON DELETE CASCADE,
                    status          TEXT NOT NULL DEFAULT 'queued',
                    attempts        INTEGER NOT NULL DEFAULT 0,
                    error_code      TEXT,
                    sent_at         INTEGER,
                    UNIQUE (broadcast_id, user_id)
                );
                """,
                "CREATE INDEX IF NOT EXISTS idx_deliv_bcast_status ON deliveries(broadcast_id, status);",
                """
                CREATE TABLE IF NOT EXISTS unsubscriptions (
                    id           INTEGER PRIMARY KEY AUTOINCREMENT,
                    user_id      INTEGER REFERENCES users(id) ON DELETE CASCADE,
                    reason       TEXT,
                    created_at   INTEGER NOT NULL
                );
                """,
                "CREATE INDEX IF NOT EXISTS idx_unsub_user ON unsubscriptions(user_id);",
                """
                CREATE TABLE IF NOT EXISTS admin_actions (
                    id            INTEGER PRIMARY KEY AUTOINCREMENT,
                    admin_tg_id   INTEGER NOT NULL,
                    action        TEXT NOT NULL,
                    payload_json  TEXT,
                    created_at    INTEGER NOT NULL
                );
                """,
                """
                CREATE TABLE IF NOT EXISTS metrics_daily (
                    metric_date       TEXT PRIMARY KEY,
                    new_users         INTEGER NOT NULL DEFAULT 0,
                    active_users      INTEGER NOT NULL DEFAULT 0,
                    blocked_users     INTEGER NOT NULL DEFAULT 0,
                    sent_messages     INTEGER NOT NULL DEFAULT 0,
                    errors_count      INTEGER NOT NULL DEFAULT 0,
                    unsubs            INTEGER NOT NULL DEFAULT 0
                );
                """
        );
    }
}
