package com.aerotravel.realtime.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * A typed row that keeps the JSON object it was decoded from.
 *
 * <p>The typed components cover the columns the portals read. Every other
 * column of the row is still reachable through {@link #row()} and
 * {@link #column(String)}.</p>
 *
 * @param <R> the implementing record
 */
public interface RowRecord<R extends RowRecord<R>>
{
    /**
     * The row exactly as the change stream delivered it, or {@code null} when
     * the value was not decoded by an adapter.
     */
    JsonNode row();

    /**
     * A copy of this value carrying {@code row}.
     */
    R withRow(JsonNode row);

    /**
     * One column of the delivered row; empty when absent or SQL {@code NULL}.
     */
    default Optional<JsonNode> column(String name)
    {
        JsonNode source = row();
        JsonNode value = source == null ? null : source.get(name);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value);
    }
}
