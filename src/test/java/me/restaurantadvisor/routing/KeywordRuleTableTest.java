package me.restaurantadvisor.routing;

import me.restaurantadvisor.domain.model.Intent;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KeywordRuleTableTest {

    private final KeywordRuleTable table = new KeywordRuleTable();

    @Test
    void match_earlierRuleWinsWhenSeveralMatch() {
        // "where" (location) and "license" (regulatory) both occur
        assertEquals(Intent.LOCATION_RECOMMENDER, table.match("Where do I get a license?").orElseThrow().intent());
    }

    @Test
    void match_recognizesEachRule() {
        assertEquals(Intent.REGULATORY_ADVISOR, table.match("FSSAI permit process").orElseThrow().intent());
        assertEquals(Intent.MARKET_ANALYSIS, table.match("Is a cafe profitable?").orElseThrow().intent());
        assertEquals(Intent.CONSUMER_SURVEY, table.match("survey of diners").orElseThrow().intent());
        assertEquals(Intent.REAL_ESTATE, table.match("typical LEASE terms").orElseThrow().intent());
        assertEquals(Intent.DEMOGRAPHICS, table.match("gdp of the state").orElseThrow().intent());
    }

    @Test
    void match_demographicsWordIsClaimedByMarketRule() {
        assertEquals(Intent.MARKET_ANALYSIS, table.match("demographics of Pune").orElseThrow().intent());
    }

    @Test
    void match_emptyWhenNothingMatches() {
        assertTrue(table.match("hello").isEmpty());
        assertTrue(table.match("").isEmpty());
        assertTrue(table.match(null).isEmpty());
    }

    @Test
    void defaultsFor_returnsRuleDefaults() {
        assertEquals(Map.of("restaurant_type", "casual dining"), table.defaultsFor(Intent.REGULATORY_ADVISOR));
        assertEquals(Map.of("locality", "downtown"), table.defaultsFor(Intent.REAL_ESTATE));
        assertTrue(table.defaultsFor(Intent.BASIC_QUERY).isEmpty());
    }

    @Test
    void rules_keepPriorityOrder() {
        assertEquals(6, table.rules().size());
        assertEquals(Intent.LOCATION_RECOMMENDER, table.rules().get(0).intent());
        assertEquals(Intent.DEMOGRAPHICS, table.rules().get(5).intent());
    }
}
