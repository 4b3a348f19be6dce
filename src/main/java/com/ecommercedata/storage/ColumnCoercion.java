package com.ecommercedata.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Column-level type decisions for {@link TabularLoader}: which columns are date-like, how their
 * text is parsed, and which SQL type a column of values gets.
 */
final class ColumnCoercion {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final List<String> DATE_TOKENS = List.of("date", "time");

    private static final List<Function<String, LocalDateTime>> DATE_PARSERS = List.of(
        text -> LocalDateTime.ofInstant(Instant.parse(text), ZoneOffset.UTC),
        text -> OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime(),
        LocalDateTime::parse,
        text -> LocalDate.parse(text).atStartOfDay(),
        text -> LocalDateTime.parse(text, DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")),
        text -> LocalDate.parse(text, DateTimeFormatter.ofPattern("MM/dd/yyyy")).atStartOfDay(),
        text -> LocalDate.parse(text, DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH)).atStartOfDay()
    );

    enum SqlType {
        BIGINT("BIGINT"),
        DOUBLE("DOUBLE PRECISION"),
        BOOLEAN("BOOLEAN"),
        TIMESTAMP("TIMESTAMP"),
        TEXT("TEXT");

        final String ddl;

        SqlType(String ddl) {
            this.ddl = ddl;
        }
    }

    private ColumnCoercion() {}

    /**
     * True when a normalized column name contains {@code date} or {@code time}, or ends with {@code _at}.
     */
    static boolean isDateLike(String column) {
        if (column.endsWith("_at")) {
            return true;
        }
        for (String token : DATE_TOKENS) {
            if (column.contains(token)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses a date or date-time text, or returns null when no supported format matches.
     */
    static LocalDateTime parseDate(String text) {
        String trimmed = text.trim();
        for (Function<String, LocalDateTime> parser : DATE_PARSERS) {
            try {
                return parser.apply(trimmed);
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        return null;
    }

    /**
     * Parses every text value of a date-like column.
     *
     * @return the converted values, or null when any non-blank value is not a date
     */
    static List<Object> coerceDates(List<Object> values) {
        List<Object> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            if (isBlank(value)) {
                converted.add(null);
            } else if (value instanceof String) {
                LocalDateTime parsed = parseDate((String) value);
                if (parsed == null) {
                    return null;
                }
                converted.add(parsed);
            } else {
                converted.add(value);
            }
        }
        return converted;
    }

    static SqlType inferType(List<Object> values) {
        boolean seen = false;
        boolean integral = true;
        boolean numeric = true;
        boolean bool = true;
        boolean temporal = true;
        for (Object value : values) {
            if (isBlank(value)) {
                continue;
            }
            seen = true;
            integral &= value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
            numeric &= value instanceof Number;
            bool &= value instanceof Boolean;
            temporal &= value instanceof TemporalAccessor || value instanceof Date;
        }
        if (!seen) {
            return SqlType.TEXT;
        }
        if (integral) {
            return SqlType.BIGINT;
        }
        if (numeric) {
            return SqlType.DOUBLE;
        }
        if (bool) {
            return SqlType.BOOLEAN;
        }
        if (temporal) {
            return SqlType.TIMESTAMP;
        }
        return SqlType.TEXT;
    }

    static Timestamp toTimestamp(Object value) {
        if (value instanceof LocalDateTime) {
            return Timestamp.valueOf((LocalDateTime) value);
        }
        if (value instanceof Instant) {
            return Timestamp.valueOf(LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC));
        }
        if (value instanceof OffsetDateTime) {
            return Timestamp.valueOf(((OffsetDateTime) value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (value instanceof ZonedDateTime) {
            return Timestamp.valueOf(((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
        }
        if (value instanceof LocalDate) {
            return Timestamp.valueOf(((LocalDate) value).atStartOfDay());
        }
        if (value instanceof Date) {
            return new Timestamp(((Date) value).getTime());
        }
        throw new IllegalArgumentException("Not a temporal value: " + value);
    }

    /**
     * Text form of a value; maps and collections become JSON.
     */
    static String toText(Object value) throws JsonProcessingException {
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Collection) {
            return MAPPER.writeValueAsString(value);
        }
        return value.toString();
    }

    static boolean isBlank(Object value) {
        return value == null || (value instanceof String && ((String) value).isBlank());
    }
}
