package com.aerotravel.realtime.config;

import com.aerotravel.realtime.core.ReconnectPolicy;
import com.aerotravel.realtime.observability.NullObservabilitySink;
import com.aerotravel.realtime.observability.RealtimeObservabilitySink;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * Aggregated configuration for a {@code RealtimeRuntime}.
 *
 * @param endpoint    the realtime WebSocket endpoint, e.g.
 *                    {@code wss://<project>.supabase.co/realtime/v1/websocket}
 * @param apiKey      project API key, sent as the {@code apikey} query parameter
 * @param accessToken user JWT sent with each join; {@code null} to use the API key
 */
public record RealtimeClientConfig(
    URI endpoint,
    String apiKey,
    String accessToken,
    RealtimeTimingPolicy timingPolicy,
    ReconnectPolicy reconnectPolicy,
    RealtimeObservabilitySink observabilitySink
) {
    public static final String PROTOCOL_VERSION = "1.0.0";

    public RealtimeClientConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        Objects.requireNonNull(observabilitySink, "observabilitySink");

        String scheme = endpoint.getScheme() == null ? "" : endpoint.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("endpoint must use ws or wss, got: " + endpoint);
        }
        if (apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
    }

    /**
     * The token sent in join payloads.
     */
    public String effectiveAccessToken() {
        return accessToken != null ? accessToken : apiKey;
    }

    /**
     * The endpoint with {@code apikey} and {@code vsn} query parameters appended.
     */
    public URI connectUri() {
        String base = endpoint.toString();
        String sep = endpoint.getRawQuery() == null ? "?" : "&";
        return URI.create(base + sep + "apikey=" + apiKey + "&vsn=" + PROTOCOL_VERSION);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI endpoint;
        private String apiKey;
        private String accessToken;
        private RealtimeTimingPolicy timingPolicy = RealtimeTimingPolicy.defaults();
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.none();
        private RealtimeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withEndpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withEndpoint(String endpoint) {
            this.endpoint = URI.create(endpoint);
            return this;
        }

        public Builder withApiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder withAccessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder withTimingPolicy(RealtimeTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public Builder withObservabilitySink(RealtimeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public RealtimeClientConfig build() {
            return new RealtimeClientConfig(endpoint, apiKey, accessToken, timingPolicy, reconnectPolicy, observabilitySink);
        }
    }
}
