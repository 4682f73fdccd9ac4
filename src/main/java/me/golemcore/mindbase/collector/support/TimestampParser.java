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

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns the timestamp shapes found in tool storage into {@link Instant}s.
 *
 * <p>
 * Numbers are epoch seconds, or epoch milliseconds above 1e10. Strings are
 * tried against a fixed list of formats; values without a zone are read as
 * UTC.
 */
@Slf4j
public class TimestampParser {

    private static final double MILLIS_THRESHOLD = 1e10;

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<Function<String, Instant>> STRING_FORMATS = List.of(
            Instant::parse,
            value -> LocalDateTime.parse(value, SPACE_SEPARATED).toInstant(ZoneOffset.UTC),
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> ZonedDateTime.parse(value).toInstant(),
            value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC));

    private final Clock clock;

    public TimestampParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * Parses the value, or returns empty when no known shape matches.
     */
    public Optional<Instant> tryParse(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof TemporalAccessor temporal) {
            return fromTemporal(temporal);
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof Number number) {
            return fromEpoch(number.doubleValue());
        }
        if (value instanceof String text) {
            return fromString(text.trim());
        }
        return Optional.empty();
    }

    /**
     * Parses the value, falling back to the current time. A missing value falls
     * back silently; an unparseable one is logged and reported to
     * {@code onFallback}.
     *
     * @param onFallback
     *            invoked when an unparseable value is replaced, may be
     *            {@code null}
     */
    public Instant parseOrNow(Object value, Runnable onFallback) {
        Optional<Instant> parsed = tryParse(value);
        if (parsed.isPresent()) {
            return parsed.get();
        }
        if (value != null) {
            log.warn("[Collector] Could not parse timestamp: {}, using current time", value);
            if (onFallback != null) {
                onFallback.run();
            }
        }
        return clock.instant();
    }

    public Instant now() {
        return clock.instant();
    }

    private Optional<Instant> fromEpoch(double epoch) {
        if (Double.isNaN(epoch) || Double.isInfinite(epoch)) {
            return Optional.empty();
        }
        double seconds = epoch > MILLIS_THRESHOLD ? epoch / 1000.0 : epoch;
        long wholeSeconds = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - wholeSeconds) * 1_000_000_000L);
        try {
            return Optional.of(Instant.ofEpochSecond(wholeSeconds, nanos));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    private Optional<Instant> fromString(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (text.matches("-?\\d+(\\.\\d+)?")) {
            return fromEpoch(Double.parseDouble(text));
        }
        for (Function<String, Instant> format : STRING_FORMATS) {
            try {
                return Optional.of(format.apply(text));
            } catch (DateTimeParseException e) {
                log.trace("[Collector] Timestamp {} does not match format: {}", text, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private Optional<Instant> fromTemporal(TemporalAccessor temporal) {
        if (temporal instanceof OffsetDateTime offsetDateTime) {
            return Optional.of(offsetDateTime.toInstant());
        }
        if (temporal instanceof ZonedDateTime zonedDateTime) {
            return Optional.of(zonedDateTime.toInstant());
        }
        if (temporal instanceof LocalDateTime localDateTime) {
            return Optional.of(localDateTime.toInstant(ZoneOffset.UTC));
        }
        return Optional.empty();
    }
}
