package me.restaurantadvisor.port.outbound;

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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for typed lookups against the structured entity-relationship store.
 * Every record is a flat map of named fields.
 */
public interface GraphReaderPort {

    /**
     * Commercial locations in a city ranked by a composite suitability score.
     * Records carry {@code area}, {@code type}, {@code score},
     * {@code foot_traffic}, {@code competition_score}, {@code growth_potential},
     * {@code rent_score}, {@code popular_cuisines} and {@code demographics}.
     *
     * @param cuisine
     *            optional cuisine filter, may be null
     */
    CompletableFuture<List<Map<String, Object>>> recommendLocations(String city, String cuisine);

    /**
     * Regulations applying to restaurants in a city: {@code type},
     * {@code description}, {@code authority}, {@code requirements} and the
     * optional {@code timeline}, {@code cost}, {@code renewal}.
     */
    CompletableFuture<List<Map<String, Object>>> regulations(String city);

    /**
     * Cuisine popularity in a city: {@code cuisine_type}, {@code popularity}.
     */
    CompletableFuture<List<Map<String, Object>>> cuisinePreferences(String city);

    /**
     * Detailed commercial location data, optionally narrowed to one area.
     */
    CompletableFuture<List<Map<String, Object>>> locationDetails(String city, String area);

    /**
     * City level demographic record: {@code name}, {@code state},
     * {@code population}, {@code demographics}, {@code key_markets}. Empty when
     * the city is unknown.
     */
    CompletableFuture<List<Map<String, Object>>> cityDemographics(String city);
}
