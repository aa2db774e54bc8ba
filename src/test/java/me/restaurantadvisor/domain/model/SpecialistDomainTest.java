package me.restaurantadvisor.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SpecialistDomainTest {

    @Test
    void select_followsPriorityOrder() {
        // "budget" (financial) and "design" both occur
        assertEquals(Optional.of(SpecialistDomain.FINANCIAL),
                SpecialistDomain.select("interior design on a tight budget", Map.of()));
    }

    @Test
    void select_cuisineParameterWins() {
        assertEquals(Optional.of(SpecialistDomain.CUISINE),
                SpecialistDomain.select("how much salary for staff", Map.of("cuisine", "Thai")));
    }

    @Test
    void select_emptyWhenNothingMatches() {
        assertTrue(SpecialistDomain.select("good morning", Map.of()).isEmpty());
    }

    @Test
    void matchedTerms_listsTermsInTableOrder() {
        assertEquals(List.of("software", "pos", "inventory"),
                SpecialistDomain.TECHNOLOGY.matchedTerms("Which POS software handles inventory?"));
    }
}
