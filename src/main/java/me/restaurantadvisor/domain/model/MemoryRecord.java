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

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All conversational state kept for one user. Instances are owned by the
 * memory store and must only be mutated while holding the record's monitor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryRecord {

    private String userId;

    @Builder.Default
    private ShortTermMemory shortTerm = new ShortTermMemory();

    @Builder.Default
    private LongTermMemory longTerm = new LongTermMemory();

    @Builder.Default
    private Map<String, Object> session = new LinkedHashMap<>();

    @JsonFormat(shape = JsonFormat.Shape.NUMBER)
    private Instant lastActivity;

    /**
     * Set once the record has been evicted; a stale reference must not be
     * written to after that.
     */
    @JsonIgnore
    private transient boolean evicted;
}
