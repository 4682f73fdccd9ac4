package me.golemcore.mindbase.collector.parse;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one parse attempt: a value, or the reasons every attempted
 * strategy gave up. Failures of earlier strategies are kept on success too.
 *
 * @param <T>
 *            parsed value type
 */
public final class ParseResult<T> {

    private final T value;
    private final List<String> failures;

    private ParseResult(T value, List<String> failures) {
        this.value = value;
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(value, List.of());
    }

    public static <T> ParseResult<T> success(T value, List<String> priorFailures) {
        return new ParseResult<>(value, priorFailures);
    }

    public static <T> ParseResult<T> failure(String reason) {
        return new ParseResult<>(null, List.of(reason));
    }

    public static <T> ParseResult<T> failure(List<String> reasons) {
        return new ParseResult<>(null, reasons.isEmpty() ? List.of("no strategy applied") : reasons);
    }

    public boolean isSuccess() {
        return value != null;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public List<String> getFailures() {
        return failures;
    }

    /**
     * The failure reasons joined for logging.
     */
    public String getReason() {
        return String.join("; ", failures);
    }
}
