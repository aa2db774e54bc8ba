package me.restaurantadvisor.adapter.outbound.graph;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import me.restaurantadvisor.port.outbound.GraphReaderPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Knowledge graph reads against Neo4j.
 *
 * <p>
 * Graph model: {@code (:City)-[:HAS_LOCATION]->(:Location)},
 * {@code (:City)-[:HAS_REGULATION]->(:Regulation)} and
 * {@code (:Location)-[:NEAR]->(:Location)}. Every lookup runs in a read
 * transaction and returns flat records keyed by column name.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Neo4jGraphReaderAdapter implements GraphReaderPort {

    static final String RECOMMEND_LOCATIONS = """
            MATCH (c:City {name: $city})-[:HAS_LOCATION]->(l:Location)
            WHERE l.commercial = true
              AND ($cuisine IS NULL OR l.popular_cuisines IS NULL OR $cuisine IN l.popular_cuisines)
            WITH l, (
                CASE WHEN l.foot_traffic IS NOT NULL THEN l.foot_traffic * 0.3 ELSE 0.0 END +
                CASE WHEN l.competition_score IS NOT NULL THEN (1.0 - l.competition_score) * 0.2 ELSE 0.0 END +
                CASE WHEN l.growth_potential IS NOT NULL THEN l.growth_potential * 0.2 ELSE 0.0 END +
                CASE WHEN l.rent_score IS NOT NULL THEN (1.0 - l.rent_score) * 0.3 ELSE 0.0 END
            ) AS score
            WHERE score >= $minScore
            RETURN l.id AS id, l.area AS area, l.type AS type, score,
                   l.foot_traffic AS foot_traffic, l.competition_score AS competition_score,
                   l.growth_potential AS growth_potential, l.rent_score AS rent_score,
                   l.popular_cuisines AS popular_cuisines, l.demographics AS demographics
            ORDER BY score DESC
            LIMIT $limit
            """;

    static final String REGULATIONS = """
            MATCH (c:City {name: $city})-[:HAS_REGULATION]->(r:Regulation)
            RETURN r.type AS type, r.description AS description, r.authority AS authority,
                   r.requirements AS requirements, r.timeline AS timeline, r.cost AS cost,
                   r.renewal AS renewal
            """;

    static final String CUISINE_LISTS = """
            MATCH (c:City {name: $city})-[:HAS_LOCATION]->(l:Location)
            WHERE l.popular_cuisines IS NOT NULL
            RETURN DISTINCT l.popular_cuisines AS cuisines
            LIMIT 10
            """;

    static final String LOCATION_DETAILS = """
            MATCH (c:City {name: $city})-[:HAS_LOCATION]->(l:Location)
            WHERE l.commercial = true AND ($area IS NULL OR l.area = $area)
            OPTIONAL MATCH (l)-[:NEAR]->(nearby:Location)
            WITH l, collect(nearby.area) AS nearby_areas
            RETURN l.id AS id, l.area AS area, l.type AS type, l.foot_traffic AS foot_traffic,
                   l.rent_range AS rent_range, l.popular_cuisines AS popular_cuisines,
                   l.demographics AS demographics, l.public_transport AS public_transport,
                   l.parking AS parking, size(nearby_areas) AS connectivity, nearby_areas
            ORDER BY l.foot_traffic DESC
            """;

    static final String CITY_DEMOGRAPHICS = """
            MATCH (c:City {name: $city})
            RETURN c.name AS name, c.state AS state, c.population AS population,
                   c.demographics AS demographics, c.key_markets AS key_markets
            """;

    private final Driver driver;
    private final AdvisorProperties properties;

    @Override
    public CompletableFuture<List<Map<String, Object>>> recommendLocations(String city, String cuisine) {
        AdvisorProperties.GraphProperties config = properties.getGraph();
        Map<String, Object> params = new HashMap<>();
        params.put("city", city);
        params.put("cuisine", blankToNull(cuisine));
        params.put("minScore", config.getMinLocationScore());
        params.put("limit", config.getLocationLimit());
        return read("recommendLocations", RECOMMEND_LOCATIONS, params);
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> regulations(String city) {
        return read("regulations", REGULATIONS, Map.of("city", city));
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> cuisinePreferences(String city) {
        return read("cuisinePreferences", CUISINE_LISTS, Map.of("city", city))
                .thenApply(Neo4jGraphReaderAdapter::countCuisines);
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> locationDetails(String city, String area) {
        Map<String, Object> params = new HashMap<>();
        params.put("city", city);
        params.put("area", blankToNull(area));
        return read("locationDetails", LOCATION_DETAILS, params);
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> cityDemographics(String city) {
        return read("cityDemographics", CITY_DEMOGRAPHICS, Map.of("city", city));
    }

    private CompletableFuture<List<Map<String, Object>>> read(String name, String cypher,
            Map<String, Object> params) {
        return CompletableFuture.supplyAsync(() -> {
            try (Session session = driver.session(sessionConfig())) {
                List<Map<String, Object>> records = session.executeRead(
                        tx -> tx.run(cypher, params).list(Record::asMap));
                log.debug("[Graph] {} returned {} record(s)", name, records.size());
                return records;
            }
        });
    }

    private SessionConfig sessionConfig() {
        String database = properties.getGraph().getDatabase();
        return database != null && !database.isBlank()
                ? SessionConfig.forDatabase(database)
                : SessionConfig.defaultConfig();
    }

    /**
     * Counts how many locations list each cuisine, most frequent first.
     */
    static List<Map<String, Object>> countCuisines(List<Map<String, Object>> rows) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            if (row.get("cuisines") instanceof Collection<?> cuisines) {
                for (Object cuisine : cuisines) {
                    if (cuisine != null) {
                        counts.merge(cuisine.toString(), 1, Integer::sum);
                    }
                }
            }
        }
        List<Map<String, Object>> result = new ArrayList<>(counts.size());
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(entry -> {
                    Map<String, Object> record = new LinkedHashMap<>();
                    record.put("cuisine_type", entry.getKey());
                    record.put("popularity", entry.getValue());
                    result.add(record);
                });
        return result;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
