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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded FIFO window of the most recent messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShortTermMemory {

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private Instant timestamp;

    /**
     * Appends a message and drops the oldest entries beyond {@code capacity}.
     */
    public void add(Message message, int capacity, Instant now) {
        messages.add(message);
        trim(capacity);
        timestamp = now;
    }

    public void trim(int capacity) {
        int overflow = messages.size() - Math.max(capacity, 0);
        if (overflow > 0) {
            messages.subList(0, overflow).clear();
        }
    }
}
