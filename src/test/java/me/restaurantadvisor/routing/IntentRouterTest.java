package me.restaurantadvisor.routing;

import me.restaurantadvisor.domain.model.Intent;
import me.restaurantadvisor.domain.model.RoutingDecision;
import me.restaurantadvisor.domain.service.CityGazetteer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IntentRouterTest {

    private LlmIntentClassifier classifier;
    private IntentRouter router;

    @BeforeEach
    void setUp() {
        classifier = mock(LlmIntentClassifier.class);
        when(classifier.isAvailable()).thenReturn(false);
        router = new IntentRouter(classifier, new KeywordRuleTable(), new CityGazetteer());
    }

    @Test
    void route_keywordCascadeWithCityFromGazetteer() {
        RoutingDecision decision = router.route("Where should I open a cafe in Bangalore?");

        assertEquals(Intent.LOCATION_RECOMMENDER, decision.getIntent());
        assertEquals(Optional.of("Bangalore"), decision.parameter("city"));
        assertFalse(decision.isClassified());
        assertEquals("Query appears to be about location recommendations", decision.getRationale());
    }

    @Test
    void route_keywordDecisionGetsRuleDefaults() {
        RoutingDecision decision = router.route("What licenses do I need in Delhi?");

        assertEquals(Intent.REGULATORY_ADVISOR, decision.getIntent());
        assertEquals(Map.of("restaurant_type", "casual dining", "city", "Delhi"), decision.getParameters());
    }

    @Test
    void route_unmatchedQueryFallsBackToBasicQuery() {
        RoutingDecision decision = router.route("Tell me something nice");

        assertEquals(Intent.FALLBACK, decision.getIntent());
        assertEquals("General query about restaurants", decision.getRationale());
        assertTrue(decision.getParameters().isEmpty());
    }

    @Test
    void route_blankQueryIsFallback() {
        RoutingDecision decision = router.route("   ");

        assertEquals(Intent.FALLBACK, decision.getIntent());
        assertEquals("Empty query routed to general assistance", decision.getRationale());
        verify(classifier, never()).classify(any());
    }

    @Test
    void route_classifierResultTakesPrecedence() {
        when(classifier.isAvailable()).thenReturn(true);
        when(classifier.classify(anyString())).thenReturn(Optional.of(new LlmIntentClassifier.ClassificationResult(
                Intent.REAL_ESTATE, Map.of("city", "Pune"), "rent question")));

        RoutingDecision decision = router.route("Where is rent cheapest in Pune?");

        assertEquals(Intent.REAL_ESTATE, decision.getIntent());
        assertTrue(decision.isClassified());
        assertEquals(Map.of("city", "Pune", "locality", "downtown"), decision.getParameters());
        assertEquals("rent question", decision.getRationale());
    }

    @Test
    void route_emptyClassificationFallsThroughToRules() {
        when(classifier.isAvailable()).thenReturn(true);
        when(classifier.classify(anyString())).thenReturn(Optional.empty());

        RoutingDecision decision = router.route("population of Jaipur");

        assertEquals(Intent.DEMOGRAPHICS, decision.getIntent());
        assertFalse(decision.isClassified());
        assertEquals(Optional.of("Jaipur"), decision.parameter("city"));
    }

    @Test
    void route_knownPreferencesFillLocationParameters() {
        RoutingDecision decision = router.route("Where should I open my restaurant?",
                Map.of("city", "Hyderabad", "cuisine", "Mexican", "budget", "High"));

        assertEquals(Optional.of("Hyderabad"), decision.parameter("city"));
        assertEquals(Optional.of("Mexican"), decision.parameter("cuisine"));
        assertTrue(decision.parameter("budget").isEmpty());
    }

    @Test
    void route_extractedParametersWinOverPreferences() {
        RoutingDecision decision = router.route("Where should I open in Chennai?", Map.of("city", "Mumbai"));

        assertEquals(Optional.of("Chennai"), decision.parameter("city"));
    }

    @Test
    void route_preferencesIgnoredForOtherIntents() {
        RoutingDecision decision = router.route("typical lease terms", Map.of("city", "Mumbai"));

        assertEquals(Intent.REAL_ESTATE, decision.getIntent());
        assertTrue(decision.parameter("city").isEmpty());
    }

    @Test
    void route_domainSpecialistGetsMatchedKeywords() {
        when(classifier.isAvailable()).thenReturn(true);
        when(classifier.classify(anyString())).thenReturn(Optional.of(new LlmIntentClassifier.ClassificationResult(
                Intent.DOMAIN_SPECIALIST, Map.of(), "staffing")));

        RoutingDecision decision = router.route("How do I handle hiring and training of staff?");

        assertEquals(Optional.of("staff hiring training"), decision.parameter(IntentRouter.DOMAIN_KEYWORDS));
    }

    @Test
    void route_neverThrowsWhenClassifierBlowsUp() {
        when(classifier.isAvailable()).thenThrow(new IllegalStateException("broken"));

        RoutingDecision decision = router.route("Where to open?");

        assertEquals(Intent.FALLBACK, decision.getIntent());
        assertTrue(decision.getRationale().startsWith("Routing failed"));
    }

    @Test
    void matchRules_producesUnclassifiedDecision() {
        RoutingDecision decision = router.matchRules("survey on dining habits");

        assertEquals(Intent.CONSUMER_SURVEY, decision.getIntent());
        assertFalse(decision.isClassified());
    }
}
