package com.escada.rentbot.db;

import com.escada.rentbot.model.AdminStats;
import com.escada.rentbot.model.BroadcastPayload;
import com.escada.rentbot.model.City;
import com.escada.rentbot.model.Delivery;
import com.escada.rentbot.model.DeliveryStatus;
import com.escada.rentbot.model.User;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations used by the bot. Each method is one logical operation; the ones that
 * touch two tables run in a single transaction.
 * <p>
 * Implementations wrap {@link java.sql.SQLException} into {@link RuntimeException}.
 */
public interface Repository {

    void initSchema();

    /** Inserts missing cities and aliases, leaves existing rows untouched. */
    void seedCities(List<CitySeed> seeds);

    /**
     * Creates the user on first contact, refreshes profile fields and last-seen time afterwards.
     * {@code utmSource} is stored only when the row is created.
     *
     * @return internal user id
     */
    long saveUser(long tgId, String username, String firstName, String lang, String utmSource);

    Optional<User> getUserByExternalId(long tgId);

    /**
     * Flips the blocked flag and, when a user becomes blocked, records an unsubscription in the
     * same transaction.
     */
    void setUserBlocked(long tgId, boolean blocked, String reason);

    int countUsers(boolean activeOnly);

    List<User> listActiveUsers();

    Optional<City> findCityByAlias(String input);

    Optional<City> findCityByCode(String code);

    /** Active cities whose alias starts with {@code prefix}, shortest alias first. */
    List<City> findCitiesByPrefix(String prefix, int limit);

    /** Active cities that have a channel, ordered by name. */
    List<City> listAvailableCities();

    /** Updates {@code users.last_city} and appends a history row in the same transaction. */
    void updateUserCity(long tgId, City city);

    long createBroadcast(BroadcastPayload payload, long createdByTgId);

    void markBroadcastRunning(long broadcastId);

    void completeBroadcast(long broadcastId, String statsJson);

    /**
     * Snapshots every active, non-blocked user into queued deliveries of the broadcast.
     *
     * @return number of delivery rows created
     */
    int createDeliveriesForBroadcast(long broadcastId);

    List<Delivery> getQueuedDeliveries(long broadcastId, int limit);

    void updateDeliveryStatus(long deliveryId, DeliveryStatus status, String errorCode);

    AdminStats getAdminStats();

    void logAdminAction(long adminTgId, String action, String payloadJson);

    void addDailyMetrics(LocalDate day, int sent, int errors, int blocked);
}
