package com.aerotravel.realtime.domain;

import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.ChannelWrapper;
import com.aerotravel.realtime.api.RowChangeListener;
import com.aerotravel.realtime.api.RowChangePayload;
import com.aerotravel.realtime.api.SubscriptionState;
import com.aerotravel.realtime.binding.SubscriptionBinding;
import com.aerotravel.realtime.binding.SubscriptionSpec;
import com.aerotravel.realtime.core.SubscriptionPool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * DomainAdapter
 * =============================================================================
 * A fixed channel (name and config) plus a transform from raw row changes to a
 * typed domain event.
 *
 * <p>Adapters add no subscription machinery of their own. They are consumed
 * through the pool ({@link #subscribe}), a {@link SubscriptionBinding}
 * ({@link #bind}) or a {@code MultiSubscriptionBinding} ({@link #spec}).</p>
 *
 * <p>{@link #transform} returns empty for payloads that carry nothing for the
 * consumer; the consumer is then not called.</p>
 *
 * @param <E> domain event type
 */
public abstract class DomainAdapter<E> {

    private final ObjectMapper mapper;

    protected DomainAdapter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public abstract ChannelName channelName();

    public abstract ChannelConfig config();

    public abstract Optional<E> transform(RowChangePayload<JsonNode> payload);

    /**
     * A channel listener that transforms each payload and hands the result to
     * {@code consumer}.
     */
    public RowChangeListener<JsonNode> listener(Consumer<? super E> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        return payload -> transform(payload).ifPresent(consumer);
    }

    public ChannelWrapper subscribe(SubscriptionPool pool, Consumer<? super E> consumer) {
        return pool.getOrCreate(channelName(), config(), listener(consumer));
    }

    public SubscriptionState bind(SubscriptionBinding binding, Consumer<? super E> consumer, boolean enabled) {
        return binding.bind(channelName(), config(), listener(consumer), enabled);
    }

    public SubscriptionSpec spec(Consumer<? super E> consumer) {
        return new SubscriptionSpec(channelName(), config(), listener(consumer));
    }

    protected <R> R readRow(JsonNode row, Class<R> type) {
        try {
            return mapper.treeToValue(row, type);
        } catch (JsonProcessingException e) {
            throw new RowMappingException(
                "Cannot decode " + config().table() + " row on " + channelName() + " as " + type.getSimpleName(), e);
        }
    }

    /**
     * {@link #readRow} for row types that keep the delivered row, so columns
     * without a typed component still reach the consumer.
     */
    protected <R extends RowRecord<R>> R readFullRow(JsonNode row, Class<R> type) {
        return readRow(row, type).withRow(row);
    }

    protected static String requireId(String id, String what) {
        Objects.requireNonNull(id, what);
        if (id.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        return id;
    }
}
