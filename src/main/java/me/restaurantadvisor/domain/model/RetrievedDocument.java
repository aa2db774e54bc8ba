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

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Text chunk returned by the document store together with its metadata.
 */
@Value
@Builder
public class RetrievedDocument {

    private static final int KEY_PREFIX_LENGTH = 100;

    String text;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    public String getSource() {
        Object source = metadata.get("source");
        return source != null ? source.toString() : "";
    }

    /**
     * Identity used to deduplicate the same chunk across independently ranked
     * result lists: source identifier plus the first characters of the text.
     */
    public String fusionKey() {
        String content = text != null ? text : "";
        return getSource() + content.substring(0, Math.min(KEY_PREFIX_LENGTH, content.length()));
    }
}
