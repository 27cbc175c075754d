package com.aerotravel.realtime.api;

import java.util.Objects;
import java.util.Optional;

/**
 * ChannelConfig
 * -----------------------------------------------------------------------------
 * The (schema, table, event, filter) predicate of one channel.
 *
 * <p>Immutable. Changing any component means a different subscription, which
 * must be requested under a new {@link ChannelName}.</p>
 *
 * <p>{@code filter} uses the PostgREST-style {@code column=op.value} syntax the
 * transport understands (e.g. {@code id=eq.B123}); {@code null} means every row
 * of the table.</p>
 */
public record ChannelConfig(String schema, String table, ChangeEvent event, String filter)
{
    public static final String DEFAULT_SCHEMA = "public";

    public ChannelConfig {
        schema = (schema == null) ? DEFAULT_SCHEMA : schema;
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(event, "event");
        if (table.isBlank()) {
            throw new IllegalArgumentException("table must not be blank");
        }
        if (filter != null && filter.isBlank()) {
            filter = null;
        }
    }

    public static ChannelConfig of(String table, ChangeEvent event, String filter)
    {
        return new ChannelConfig(DEFAULT_SCHEMA, table, event, filter);
    }

    public static ChannelConfig of(String table, ChangeEvent event)
    {
        return new ChannelConfig(DEFAULT_SCHEMA, table, event, null);
    }

    /**
     * Builds an equality filter, {@code <column>=eq.<value>}.
     */
    public static String eq(String column, String value)
    {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(value, "value");
        return column + "=eq." + value;
    }

    public Optional<String> filterExpression()
    {
        return Optional.ofNullable(filter);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private String schema = DEFAULT_SCHEMA;
        private String table;
        private ChangeEvent event = ChangeEvent.ALL;
        private String filter;

        public Builder withSchema(String schema)
        {
            this.schema = schema;
            return this;
        }

        public Builder withTable(String table)
        {
            this.table = table;
            return this;
        }

        public Builder withEvent(ChangeEvent event)
        {
            this.event = event;
            return this;
        }

        public Builder withFilter(String filter)
        {
            this.filter = filter;
            return this;
        }

        public ChannelConfig build()
        {
            return new ChannelConfig(schema, table, event, filter);
        }
    }
}
