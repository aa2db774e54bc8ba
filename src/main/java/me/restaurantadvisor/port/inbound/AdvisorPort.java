package me.restaurantadvisor.port.inbound;

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

import me.restaurantadvisor.domain.model.AdvisorUser;

/**
 * Entry point for front ends (chat UI, CLI, HTTP) that submit user queries.
 */
public interface AdvisorPort {

    /**
     * Processes one query end to end and returns the text to show the user.
     * Never throws; every failure is reported as a returned message.
     */
    String ask(AdvisorUser user, String query);

    /**
     * Ends the user's session: clears session scratch data.
     */
    void logout(String userId);
}
