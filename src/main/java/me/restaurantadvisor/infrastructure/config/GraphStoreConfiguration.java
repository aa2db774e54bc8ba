package me.restaurantadvisor.infrastructure.config;

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

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Neo4j driver for the knowledge graph. The driver connects lazily,
 * so an unreachable graph store does not prevent startup.
 */
@Configuration
@Slf4j
public class GraphStoreConfiguration {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(AdvisorProperties properties) {
        AdvisorProperties.GraphProperties graph = properties.getGraph();
        log.info("Neo4j driver targeting {}", graph.getUri());
        return GraphDatabase.driver(graph.getUri(), AuthTokens.basic(graph.getUsername(), graph.getPassword()));
    }
}
