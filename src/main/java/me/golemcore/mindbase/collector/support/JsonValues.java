package me.golemcore.mindbase.collector.support;

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
import java.util.Optional;

/**
 * Lookups over loosely typed JSON trees ({@code Map}/{@code List} as produced
 * by Jackson).
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * First value under any of the keys that is non-null and, for strings,
     * non-blank.
     */
    public static Optional<Object> first(Map<String, Object> data, String... keys) {
        for (String key : keys) {
            Object value = data.get(key);
            if (isPresent(value)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static Optional<String> firstString(Map<String, Object> data, String... keys) {
        return first(data, keys).map(String::valueOf);
    }

    @SuppressWarnings("unchecked")
    public static Optional<Map<String, Object>> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return Optional.of((Map<String, Object>) map);
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public static Optional<List<Object>> asList(Object value) {
        if (value instanceof List<?> list) {
            return Optional.of((List<Object>) list);
        }
        return Optional.empty();
    }

    public static boolean containsAnyKey(Map<String, Object> data, String... keys) {
        for (String key : keys) {
            if (data.containsKey(key)) {
                return true;
            }
        }
        return false;
    }

    static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return true;
    }
}
