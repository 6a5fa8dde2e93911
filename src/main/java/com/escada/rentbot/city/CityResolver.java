package com.escada.rentbot.city;

import com.escada.rentbot.db.Repository;
import com.escada.rentbot.model.City;

import java.util.List;
import java.util.Optional;

/**
 * Free-text city lookup: exact alias first, then the shortest alias starting with the input.
 */
public final class CityResolver {
    private static final int PREFIX_CANDIDATES = 5;

    private final Repository repository;

    public CityResolver(Repository repository) {
        this.repository = repository;
    }

    public Optional<City> resolve(String input) {
        if (input == null) return Optional.empty();
        String query = input.trim();
        if (query.isEmpty()) return Optional.empty();

        Optional<City> exact = repository.findCityByAlias(query).filter(c -> c.active);
        if (exact.isPresent()) return exact;

        List<City> candidates = repository.findCitiesByPrefix(query, PREFIX_CANDIDATES);
        return candidates.stream().filter(c -> c.active).findFirst();
    }
}
