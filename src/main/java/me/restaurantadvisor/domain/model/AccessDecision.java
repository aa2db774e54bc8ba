package me.restaurantadvisor.domain.model;

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

/**
 * Result of the permission gate. When access is denied the effective intent is
 * the universal fallback.
 */
public record AccessDecision(boolean allowed, Intent effectiveIntent) {

    public static AccessDecision allow(Intent intent) {
        return new AccessDecision(true, intent);
    }

    public static AccessDecision deny() {
        return new AccessDecision(false, Intent.FALLBACK);
    }
}
