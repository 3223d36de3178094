package com.frenchtoast.alert.r2dbc.store;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Columns are {@code TIMESTAMP WITH TIME ZONE}; both the H2 and PostgreSQL drivers bind and
 * read them as {@link OffsetDateTime}. The domain model uses {@link Instant}.
 */
final class Timestamps {

    private Timestamps() {}

    static OffsetDateTime toColumn(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant fromColumn(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
