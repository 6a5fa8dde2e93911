package com.escada.rentbot.db;

import com.escada.rentbot.city.CityResolver;
import com.escada.rentbot.model.AdminStats;
import com.escada.rentbot.model.BroadcastPayload;
import com.escada.rentbot.model.City;
import com.escada.rentbot.model.Delivery;
import com.escada.rentbot.model.DeliveryStatus;
import com.escada.rentbot.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteRepositoryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-20T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Database db;
    private Repository repository;

    @BeforeEach
    void setUp() {
        db = Database.sqlite(tempDir.resolve("bot.db").toString());
        repository = new SqliteRepository(db, CLOCK);
        repository.initSchema();
        repository.seedCities(CitySeed.load());
    }

    @Test
    void shouldBeSafeToInitAndSeedTwice() {
        repository.initSchema();
        repository.seedCities(CitySeed.load());

        assertThat(repository.listAvailableCities()).hasSize(8);
    }

    @Test
    void shouldListOnlyCitiesWithChannel() {
        List<City> cities = repository.listAvailableCities();

        assertThat(cities).allMatch(City::hasChannel);
        assertThat(cities).extracting(c -> c.code).contains("kyiv", "lviv", "uzhhorod").doesNotContain("poltava");
    }

    @Test
    void shouldCreateUserOnceAndKeepAcquisitionTag() {
        long id = repository.saveUser(1L, "olena", "Олена", "uk", "instagram");
        long again = repository.saveUser(1L, "olena_k", "Олена К", null, "facebook");

        assertThat(again).isEqualTo(id);
        User u = repository.getUserByExternalId(1L).orElseThrow();
        assertThat(u.username).isEqualTo("olena_k");
        assertThat(u.firstName).isEqualTo("Олена К");
        assertThat(u.utmSource).isEqualTo("instagram");
        assertThat(u.active).isTrue();
        assertThat(u.blocked).isFalse();
        assertThat(repository.countUsers(false)).isEqualTo(1);
    }

    @Test
    void shouldReturnEmptyForUnknownUser() {
        assertThat(repository.getUserByExternalId(404L)).isEmpty();
    }

    @Test
    void shouldMatchCyrillicAliasesIgnoringCase() {
        assertThat(repository.findCityByAlias("київ")).map(c -> c.code).contains("kyiv");
        assertThat(repository.findCityByAlias("КИЇВ")).map(c -> c.code).contains("kyiv");
        assertThat(repository.findCityByAlias("Kiev")).map(c -> c.code).contains("kyiv");
        assertThat(repository.findCityByAlias("Одесса")).map(c -> c.code).contains("odesa");
        assertThat(repository.findCityByAlias("Атлантида")).isEmpty();
    }

    @Test
    void shouldOrderPrefixMatchesByAliasLength() {
        List<City> found = repository.findCitiesByPrefix("чер", 5);

        assertThat(found).extracting(c -> c.code)
                .containsExactly("cherkasy", "chernivtsi", "chernihiv");
    }

    @Test
    void shouldTreatLikeWildcardsLiterally() {
        assertThat(repository.findCitiesByPrefix("%", 5)).isEmpty();
        assertThat(repository.findCitiesByPrefix("_", 5)).isEmpty();
    }

    @Test
    void shouldPreferExactAliasOverLongerPrefixMatches() {
        CityResolver resolver = new CityResolver(repository);

        assertThat(resolver.resolve("Чернігів")).map(c -> c.code).contains("chernihiv");
        assertThat(resolver.resolve("Черн")).map(c -> c.code).contains("chernivtsi");
        assertThat(resolver.resolve("  Франківськ ")).map(c -> c.code).contains("ivano_frankivsk");
    }

    @Test
    void shouldRecordUnsubscriptionOnlyWhenUserBecomesBlocked() {
        repository.saveUser(1L, null, "A", "uk", null);

        repository.setUserBlocked(1L, true, "blocked");
        repository.setUserBlocked(1L, true, "blocked");

        User u = repository.getUserByExternalId(1L).orElseThrow();
        assertThat(u.blocked).isTrue();
        assertThat(u.active).isFalse();
        assertThat(u.deliverable()).isFalse();
        assertThat(repository.getAdminStats().totalUnsubscriptions).isEqualTo(1);
        assertThat(repository.countUsers(true)).isZero();

        repository.setUserBlocked(1L, false, null);
        assertThat(repository.countUsers(true)).isEqualTo(1);
        assertThat(repository.getAdminStats().totalUnsubscriptions).isEqualTo(1);
    }

    @Test
    void shouldStoreCitySelectionWithHistory() {
        repository.saveUser(1L, null, "A", "uk", null);
        repository.saveUser(2L, null, "B", "uk", null);
        City kyiv = repository.findCityByCode("kyiv").orElseThrow();
        City lviv = repository.findCityByCode("lviv").orElseThrow();

        repository.updateUserCity(1L, kyiv);
        repository.updateUserCity(2L, kyiv);
        repository.updateUserCity(2L, lviv);

        assertThat(repository.getUserByExternalId(2L).orElseThrow().lastCity).isEqualTo("Львів");
        AdminStats stats = repository.getAdminStats();
        assertThat(stats.topCities).hasSize(2);
        assertThat(stats.topCities.get(0).cityName).isEqualTo("Київ");
        assertThat(stats.topCities.get(0).count).isEqualTo(2);
        assertThat(stats.newUsers7d).isEqualTo(2);
    }

    @Test
    void shouldSnapshotDeliverableUsersIntoQueuedDeliveries() {
        repository.saveUser(1L, null, "A", "uk", null);
        repository.saveUser(2L, null, "B", "uk", null);
        repository.saveUser(3L, null, "C", "uk", null);
        repository.setUserBlocked(2L, true, "blocked");
        assertThat(repository.listActiveUsers()).extracting(u -> u.tgId).containsExactly(1L, 3L);

        long broadcastId = repository.createBroadcast(BroadcastPayload.text("Новини"), 99L);
        assertThat(repository.createDeliveriesForBroadcast(broadcastId)).isEqualTo(2);
        assertThat(repository.createDeliveriesForBroadcast(broadcastId)).isZero();

        List<Delivery> queued = repository.getQueuedDeliveries(broadcastId, 100);
        assertThat(queued).extracting(d -> d.tgId).containsExactly(1L, 3L);

        repository.updateDeliveryStatus(queued.get(0).id, DeliveryStatus.SENT, null);
        repository.updateDeliveryStatus(queued.get(1).id, DeliveryStatus.FAILED, "400");

        assertThat(repository.getQueuedDeliveries(broadcastId, 100)).isEmpty();
    }

    @Test
    void shouldMoveBroadcastThroughItsStatuses() throws SQLException {
        long id = repository.createBroadcast(BroadcastPayload.photo("AgACfile", null), 99L);
        repository.markBroadcastRunning(id);
        repository.completeBroadcast(id, "{\"sent\":0}");

        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT status, title, photo_file_id, stats_json FROM broadcasts WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getString("status")).isEqualTo("completed");
                assertThat(rs.getString("title")).isEqualTo("photo");
                assertThat(rs.getString("photo_file_id")).isEqualTo("AgACfile");
                assertThat(rs.getString("stats_json")).isEqualTo("{\"sent\":0}");
            }
        }
    }

    @Test
    void shouldAccumulateDailyMetrics() throws SQLException {
        LocalDate day = LocalDate.of(2024, 5, 20);
        repository.addDailyMetrics(day, 3, 1, 1);
        repository.addDailyMetrics(day, 2, 0, 0);

        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT sent_messages, errors_count, blocked_users FROM metrics_daily WHERE metric_date = ?")) {
            ps.setString(1, "2024-05-20");
            try (ResultSet rs = ps.executeQuery()) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getInt("sent_messages")).isEqualTo(5);
                assertThat(rs.getInt("errors_count")).isEqualTo(1);
                assertThat(rs.getInt("blocked_users")).isEqualTo(1);
            }
        }
    }

    @Test
    void shouldAppendAdminActions() throws SQLException {
        repository.logAdminAction(99L, "view_stats", null);
        repository.logAdminAction(99L, "clear_cache", "{\"subscriptions\":3}");

        try (Connection conn = db.openConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM admin_actions WHERE admin_tg_id = ?")) {
            ps.setLong(1, 99L);
            try (ResultSet rs = ps.executeQuery()) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getInt(1)).isEqualTo(2);
            }
        }
    }
}
