package com.escada.rentbot.model;

import java.util.List;

public final class AdminStats {
    public final int totalUsers;
    public final int activeUsers;
    public final int blockedUsers;
    public final int totalUnsubscriptions;
    public final int newUsers7d;
    public final int unsubscribed7d;
    public final List<CityCount> topCities;

    public AdminStats(int totalUsers,
                      int activeUsers,
                      int blockedUsers,
                      int totalUnsubscriptions,
                      int newUsers7d,
                      int unsubscribed7d,
                      List<CityCount> topCities) {
        this.totalUsers = totalUsers;
        this.activeUsers = activeUsers;
        this.blockedUsers = blockedUsers;
        this.totalUnsubscriptions = totalUnsubscriptions;
        this.newUsers7d = newUsers7d;
        this.unsubscribed7d = unsubscribed7d;
        this.topCities = List.copyOf(topCities);
    }

    public static final class CityCount {
        public final String cityName;
        public final int count;

        public CityCount(String cityName, int count) {
            this.cityName = cityName;
            this.count = count;
        }
    }
}
