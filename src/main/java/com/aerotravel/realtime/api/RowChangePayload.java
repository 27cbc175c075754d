package com.aerotravel.realtime.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * RowChangePayload
 * -----------------------------------------------------------------------------
 * One row-change notification: the row image after the change ({@code newRow})
 * and before it ({@code oldRow}), tagged with the change type.
 *
 * <h2>Shape invariants</h2>
 * <ul>
 *   <li>{@link ChangeEvent#INSERT}: {@code newRow} only</li>
 *   <li>{@link ChangeEvent#UPDATE}: {@code newRow}, and {@code oldRow} when the
 *       table publishes old images</li>
 *   <li>{@link ChangeEvent#DELETE}: {@code oldRow} only</li>
 * </ul>
 * At least one image is always present.
 *
 * @param <T> row representation ({@code JsonNode} at the transport boundary)
 */
public record RowChangePayload<T>(
        ChangeEvent eventType,
        String schema,
        String table,
        T newRow,
        T oldRow,
        Instant commitTimestamp
) {
    public RowChangePayload {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(table, "table");
        schema = (schema == null) ? ChannelConfig.DEFAULT_SCHEMA : schema;

        if (eventType == ChangeEvent.ALL) {
            throw new IllegalArgumentException("a delivered payload must carry a concrete event type");
        }
        if (newRow == null && oldRow == null) {
            throw new IllegalArgumentException("payload must carry at least one row image");
        }
        if (eventType == ChangeEvent.INSERT && newRow == null) {
            throw new IllegalArgumentException("INSERT payload requires a new row");
        }
        if (eventType == ChangeEvent.UPDATE && newRow == null) {
            throw new IllegalArgumentException("UPDATE payload requires a new row");
        }
        if (eventType == ChangeEvent.DELETE && newRow != null) {
            throw new IllegalArgumentException("DELETE payload must not carry a new row");
        }
    }

    public static <T> RowChangePayload<T> insert(String table, T newRow)
    {
        return new RowChangePayload<>(ChangeEvent.INSERT, null, table, newRow, null, null);
    }

    public static <T> RowChangePayload<T> update(String table, T newRow, T oldRow)
    {
        return new RowChangePayload<>(ChangeEvent.UPDATE, null, table, newRow, oldRow, null);
    }

    public static <T> RowChangePayload<T> delete(String table, T oldRow)
    {
        return new RowChangePayload<>(ChangeEvent.DELETE, null, table, null, oldRow, null);
    }

    public Optional<T> newImage()
    {
        return Optional.ofNullable(newRow);
    }

    public Optional<T> oldImage()
    {
        return Optional.ofNullable(oldRow);
    }

    /**
     * {@code newRow} when present, otherwise {@code oldRow}. Never {@code null}.
     */
    public T latestImage()
    {
        return newRow != null ? newRow : oldRow;
    }
}
