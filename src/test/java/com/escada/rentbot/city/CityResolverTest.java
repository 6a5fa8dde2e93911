package com.escada.rentbot.city;

import com.escada.rentbot.db.Repository;
import com.escada.rentbot.model.City;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CityResolverTest {

    private static final City KYIV = new City("kyiv", "Київ", "https://t.me/Escada_Kyiv", true);
    private static final City KHARKIV = new City("kharkiv", "Харків", "https://t.me/Escada_Kharkiv", true);
    private static final City POLTAVA = new City("poltava", "Полтава", null, true);

    private Repository repository;
    private CityResolver resolver;

    @BeforeEach
    void setUp() {
        repository = mock(Repository.class);
        resolver = new CityResolver(repository);
        when(repository.findCityByAlias(anyString())).thenReturn(Optional.empty());
        when(repository.findCitiesByPrefix(anyString(), anyInt())).thenReturn(List.of());
    }

    @Test
    void shouldReturnEmptyForBlankInput() {
        assertThat(resolver.resolve("   ")).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();

        verifyNoInteractions(repository);
    }

    @Test
    void shouldPreferExactAliasOverPrefix() {
        when(repository.findCityByAlias("Київ")).thenReturn(Optional.of(KYIV));

        assertThat(resolver.resolve("  Київ ")).contains(KYIV);
        verify(repository, never()).findCitiesByPrefix(anyString(), anyInt());
    }

    @Test
    void shouldFallBackToFirstPrefixMatch() {
        when(repository.findCitiesByPrefix("Хар", 5)).thenReturn(List.of(KHARKIV, KYIV));

        assertThat(resolver.resolve("Хар")).contains(KHARKIV);
    }

    @Test
    void shouldSkipInactiveCities() {
        City inactive = new City("kyiv", "Київ", "https://t.me/Escada_Kyiv", false);
        when(repository.findCityByAlias("Київ")).thenReturn(Optional.of(inactive));
        when(repository.findCitiesByPrefix("Київ", 5)).thenReturn(List.of(inactive));

        assertThat(resolver.resolve("Київ")).isEmpty();
    }

    @Test
    void shouldResolveCityWithoutChannel() {
        when(repository.findCityByAlias("Полтава")).thenReturn(Optional.of(POLTAVA));

        Optional<City> city = resolver.resolve("Полтава");

        assertThat(city).contains(POLTAVA);
        assertThat(city.get().hasChannel()).isFalse();
    }

    @Test
    void shouldReturnEmptyWhenNothingMatches() {
        assertThat(resolver.resolve("Атлантида")).isEmpty();
    }
}
