package me.restaurantadvisor.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CityGazetteerTest {

    private final CityGazetteer gazetteer = new CityGazetteer();

    @Test
    void findFirst_followsListOrderNotTextOrder() {
        assertEquals(Optional.of("Mumbai"), gazetteer.findFirst("Chennai or mumbai?"));
    }

    @Test
    void findFirst_emptyWhenNoCityMentioned() {
        assertTrue(gazetteer.findFirst("best cuisine trends").isEmpty());
        assertTrue(gazetteer.findFirst(null).isEmpty());
    }

    @Test
    void findAll_returnsEveryMentionedCity() {
        assertEquals(List.of("Bangalore", "Pune"), gazetteer.findAll("PUNE vs Bangalore rents"));
    }

    @Test
    void knownCities_areTitleCased() {
        List<String> cities = gazetteer.knownCities();

        assertEquals(10, cities.size());
        assertTrue(cities.contains("Hyderabad"));
    }

    @Test
    void titleCase_capitalizesEachWord() {
        assertEquals("New Delhi", CityGazetteer.titleCase("new delhi"));
    }
}
