package me.restaurantadvisor.domain.service;

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

import me.restaurantadvisor.domain.model.AccessAction;
import me.restaurantadvisor.domain.model.AccessDecision;
import me.restaurantadvisor.domain.model.DataStore;
import me.restaurantadvisor.domain.model.Intent;
import me.restaurantadvisor.infrastructure.config.AdvisorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Role based permission gate.
 *
 * <p>
 * The policy table is read from {@code advisor.access.roles.*} once, when the
 * service is created, and is immutable afterwards. Each role lists the intents
 * it may dispatch to, the specialist domains it may consult and the actions it
 * may perform on the knowledge base, the knowledge graph and user memory. The
 * literal {@value #WILDCARD} grants everything of its kind. Unknown roles have
 * no permissions.
 *
 * <p>
 * All checks are pure lookups without side effects.
 */
@Service
@Slf4j
public class AccessPolicyService {

    public static final String WILDCARD = "all";

    private final Map<String, RolePermissions> policy;

    public AccessPolicyService(AdvisorProperties properties) {
        Map<String, RolePermissions> table = new LinkedHashMap<>();
        properties.getAccess().getRoles().forEach((role, config) -> table.put(normalize(role),
                new RolePermissions(
                        toSet(config.getIntents()),
                        toSet(config.getDomains()),
                        toSet(config.getKnowledgeBase()),
                        toSet(config.getKnowledgeGraph()),
                        toSet(config.getMemory()))));
        this.policy = Map.copyOf(table);
        log.info("[Access] Loaded policy for roles: {}", table.keySet());
    }

    /**
     * Decides whether the role may dispatch to the intent. A denied request is
     * redirected to {@link Intent#FALLBACK}, which every role may reach.
     */
    public AccessDecision authorize(String role, Intent intent) {
        if (intent == null) {
            return AccessDecision.deny();
        }
        if (intent.isFallback() || permits(permissions(role).intents(), intent.getWireName())) {
            return AccessDecision.allow(intent);
        }
        return AccessDecision.deny();
    }

    public boolean canAccessStore(String role, DataStore store, AccessAction action) {
        RolePermissions permissions = permissions(role);
        Set<String> actions = switch (store) {
        case KNOWLEDGE_BASE -> permissions.knowledgeBase();
        case KNOWLEDGE_GRAPH -> permissions.knowledgeGraph();
        };
        return permits(actions, action.key());
    }

    public boolean canRead(String role, DataStore store) {
        return canAccessStore(role, store, AccessAction.READ);
    }

    public boolean canAccessDomain(String role, String domain) {
        return domain != null && permits(permissions(role).domains(), normalize(domain));
    }

    public boolean canAccessMemory(String role, AccessAction action) {
        return permits(permissions(role).memory(), action.key());
    }

    public boolean isKnownRole(String role) {
        return role != null && policy.containsKey(normalize(role));
    }

    public Set<String> roles() {
        return policy.keySet();
    }

    private RolePermissions permissions(String role) {
        if (role == null) {
            return RolePermissions.NONE;
        }
        return policy.getOrDefault(normalize(role), RolePermissions.NONE);
    }

    private static boolean permits(Set<String> granted, String value) {
        return granted.contains(WILDCARD) || granted.contains(value);
    }

    private static Set<String> toSet(Collection<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(AccessPolicyService::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private record RolePermissions(
            Set<String> intents,
            Set<String> domains,
            Set<String> knowledgeBase,
            Set<String> knowledgeGraph,
            Set<String> memory) {

        static final RolePermissions NONE = new RolePermissions(Set.of(), Set.of(), Set.of(), Set.of(), Set.of());
    }
}
