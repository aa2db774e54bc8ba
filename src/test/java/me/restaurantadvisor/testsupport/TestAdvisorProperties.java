package me.restaurantadvisor.testsupport;

import me.restaurantadvisor.infrastructure.config.AdvisorProperties;

import java.util.List;

/**
 * Properties with the role table shipped in application.properties.
 */
public final class TestAdvisorProperties {

    public static final String ADMIN = "admin";
    public static final String ANALYST = "analyst";
    public static final String OWNER = "restaurant_owner";
    public static final String OPERATIONS = "operations";
    public static final String GUEST = "guest";

    private TestAdvisorProperties() {
    }

    public static AdvisorProperties withDefaultRoles() {
        AdvisorProperties properties = new AdvisorProperties();
        role(properties, ADMIN, List.of("all"), List.of("all"), List.of("read", "write", "delete"),
                List.of("read", "write", "delete"), List.of("read", "write", "delete"));
        role(properties, ANALYST,
                List.of("market_analysis", "location_recommender", "regulatory_advisor", "domain_specialist"),
                List.of("financial", "marketing", "cuisine"), List.of("read"), List.of("read"), List.of("read"));
        role(properties, OWNER, List.of("location_recommender", "regulatory_advisor", "domain_specialist"),
                List.of("cuisine", "design", "staffing"), List.of("read"), List.of("read"), List.of("read"));
        role(properties, OPERATIONS, List.of("domain_specialist"), List.of("staffing", "technology", "design"),
                List.of("read"), List.of("read"), List.of("read"));
        role(properties, GUEST, List.of("basic_query"), List.of(), List.of("read"), List.of("read"), List.of());
        return properties;
    }

    public static void role(AdvisorProperties properties, String name, List<String> intents, List<String> domains,
            List<String> knowledgeBase, List<String> knowledgeGraph, List<String> memory) {
        AdvisorProperties.RolePolicy policy = new AdvisorProperties.RolePolicy();
        policy.setIntents(intents);
        policy.setDomains(domains);
        policy.setKnowledgeBase(knowledgeBase);
        policy.setKnowledgeGraph(knowledgeGraph);
        policy.setMemory(memory);
        properties.getAccess().getRoles().put(name, policy);
    }
}
