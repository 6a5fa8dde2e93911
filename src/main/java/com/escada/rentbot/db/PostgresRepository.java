package com.escada.rentbot.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;

public final class PostgresRepository extends JdbcRepository {

    public PostgresRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public PostgresRepository(Database db, Clock clock) {
        super(db, clock);
    }

    @Override
    protected long insertReturningId(Connection conn, String insertSql, Binder binder) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(insertSql.strip() + " RETURNING id")) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) throw new SQLException("INSERT ... RETURNING id returned nothing");
                return rs.getLong(1);
            }
        }
    }

    @Override
    protected List<String> schemaStatements() {
        return List.of(
                """
                CREATE TABLE IF NOT EXISTS users (
                    id               BIGSERIAL PRIMARY KEY,
                    tg_id            BIGINT UNIQUE NOT NULL,
                    username         TEXT,
                    first_name       TEXT,
                    lang             TEXT NOT NULL DEFAULT 'uk',
                    last_city        TEXT,
                    is_active        BOOLEAN NOT NULL DEFAULT TRUE,
                    is_blocked       BOOLEAN NOT NULL DEFAULT FALSE,
                    created_at       BIGINT NOT NULL,
                    updated_at       BIGINT NOT NULL,
                    last_seen_at     BIGINT,
                    utm_source       TEXT
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_users_is_active ON users(is_active, is_blocked)",
                "CREATE INDEX IF NOT EXISTS idx_users_last_seen_at ON users(last_seen_at DESC)",
                """
                CREATE TABLE IF NOT EXISTS cities (
                    code          TEXT PRIMARY KEY,
                    name_uk       TEXT NOT NULL,
                    channel_url   TEXT,
                    is_active     BOOLEAN NOT NULL DEFAULT TRUE,
                    created_at    BIGINT NOT NULL,
                    updated_at    BIGINT NOT NULL
                )
                """,
                """
                CREATE TABLE IF NOT EXISTS city_aliases (
                    id          BIGSERIAL PRIMARY KEY,
                    city_code   TEXT NOT NULL REFERENCES cities(code) ON DELETE CASCADE,
                    alias       TEXT NOT NULL,
                    alias_norm  TEXT NOT NULL,
                    UNIQUE (city_code, alias_norm)
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_city_alias_norm ON city_aliases(alias_norm text_pattern_ops)",
                """
                CREATE TABLE IF NOT EXISTS user_city_history (
                    id             BIGSERIAL PRIMARY KEY,
                    user_id        BIGINT REFERENCES users(id) ON DELETE CASCADE,
                    city_code      TEXT REFERENCES cities(code),
                    city_name_uk   TEXT NOT NULL,
                    selected_at    BIGINT NOT NULL
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_uch_user_id ON user_city_history(user_id, selected_at DESC)",
                """
                CREATE TABLE IF NOT EXISTS rental_requests (
                    id            BIGSERIAL PRIMARY KEY,
                    user_id       BIGINT REFERENCES users(id) ON DELETE SET NULL,
                    city_code     TEXT REFERENCES cities(code),
                    contact       TEXT,
                    description   TEXT,
                    status        TEXT NOT NULL DEFAULT 'new',
                    created_at    BIGINT NOT NULL,
                    updated_at    BIGINT NOT NULL
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_rr_status ON rental_requests(status)",
                """
                CREATE TABLE IF NOT EXISTS broadcasts (
                    id                BIGSERIAL PRIMARY KEY,
                    title             TEXT,
                    body_text         TEXT,
                    photo_file_id     TEXT,
                    buttons_json      TEXT,
                    segment_query     TEXT,
                    status            TEXT NOT NULL DEFAULT 'draft',
                    created_by_tg_id  BIGINT,
                    created_at        BIGINT NOT NULL,
                    started_at        BIGINT,
                    finished_at       BIGINT,
                    stats_json        TEXT
                )
                """,
                """
                CREATE TABLE IF NOT EXISTS deliveries (
                    id              BIGSERIAL PRIMARY KEY,
                    broadcast_id    BIGINT NOT NULL REFERENCES broadcasts(id) ON DELETE CASCADE,
                    user_id         BIGINT NOT NULL REFERENCES users(id) ON DELETE CASCADE,
                    status          TEXT NOT NULL DEFAULT 'queued',
                    attempts        INTEGER NOT NULL DEFAULT 0,
                    error_code      TEXT,
                    sent_at         BIGINT,
                    UNIQUE (broadcast_id, user_id)
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_deliv_bcast_status ON deliveries(broadcast_id, status)",
                "CREATE INDEX IF NOT EXISTS idx_deliv_queued ON deliveries(broadcast_id) WHERE status = 'queued'",
                """
                CREATE TABLE IF NOT EXISTS unsubscriptions (
                    id           BIGSERIAL PRIMARY KEY,
                    user_id      BIGINT REFERENCES users(id) ON DELETE CASCADE,
                    reason       TEXT,
                    created_at   BIGINT NOT NULL
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_unsub_user ON unsubscriptions(user_id)",
                """
                CREATE TABLE IF NOT EXISTS admin_actions (
                    id            BIGSERIAL PRIMARY KEY,
                    admin_tg_id   BIGINT NOT NULL,
                    action        TEXT NOT NULL,
                    payload_json  TEXT,
                    created_at    BIGINT NOT NULL
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_admin_actions_time ON admin_actions(created_at DESC)",
                """
                CREATE TABLE IF NOT EXISTS metrics_daily (
                    metric_date       TEXT PRIMARY KEY,
                    new_users         INTEGER NOT NULL DEFAULT 0,
                    active_users      INTEGER NOT NULL DEFAULT 0,
                    blocked_users     INTEGER NOT NULL DEFAULT 0,
                    sent_messages     INTEGER NOT NULL DEFAULT 0,
                    errors_count      INTEGER NOT NULL DEFAULT 0,
                    unsubs            INTEGER NOT NULL DEFAULT 0
                )
                """
        );
    }
}
