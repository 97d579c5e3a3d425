package com.questrail.seabird.radio.config;

import com.questrail.seabird.radio.router.RouterPolicy;
import com.questrail.seabird.radio.supervisor.SupervisorTimingPolicy;
import com.questrail.seabird.radio.upstream.UpstreamPolicy;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * RadioRuntimeConfig
 * =============================================================================
 * Everything the runtime needs to start: where the core is, how to
 * authenticate, and the timing policies of each component.
 *
 * <h2>Environment</h2>
 * <ul>
 *   <li>{@code SEABIRD_URL}: core URL, default {@value #DEFAULT_CORE_URL};
 *       an {@code http://} URL selects plaintext</li>
 *   <li>{@code SEABIRD_TOKEN}: bearer token, required</li>
 *   <li>{@code SEABIRD_RADIO_MAX_IN_FLIGHT}: concurrent commands, default 16</li>
 *   <li>{@code SEABIRD_RADIO_COMMAND_TIMEOUT}: ISO-8601 duration, default PT10S</li>
 *   <li>{@code SEABIRD_RADIO_CACHE_TTL}: ISO-8601 duration, default PT60S</li>
 * </ul>
 * {@code SEABIRD_LOG_LEVEL} is read by the logging configuration, not here.
 */
public record RadioRuntimeConfig(
        URI coreUri,
        String token,
        String pluginName,
        SupervisorTimingPolicy supervisorTiming,
        RouterPolicy routerPolicy,
        UpstreamPolicy upstreamPolicy
) {
    public static final String DEFAULT_CORE_URL = "https://api.seabird.chat";
    public static final String DEFAULT_PLUGIN_NAME = "seabird-radio";

    static final String ENV_URL = "SEABIRD_URL";
    static final String ENV_TOKEN = "SEABIRD_TOKEN";
    static final String ENV_MAX_IN_FLIGHT = "SEABIRD_RADIO_MAX_IN_FLIGHT";
    static final String ENV_COMMAND_TIMEOUT = "SEABIRD_RADIO_COMMAND_TIMEOUT";
    static final String ENV_CACHE_TTL = "SEABIRD_RADIO_CACHE_TTL";

    static final String PLACEHOLDER_TOKEN = "fill_me_in";

    public RadioRuntimeConfig {
        Objects.requireNonNull(coreUri, "coreUri");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(pluginName, "pluginName");
        Objects.requireNonNull(supervisorTiming, "supervisorTiming");
        Objects.requireNonNull(routerPolicy, "routerPolicy");
        Objects.requireNonNull(upstreamPolicy, "upstreamPolicy");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read the configuration from environment variables.
     *
     * @throws ConfigException if the token is missing or a value is malformed
     */
    public static RadioRuntimeConfig fromEnvironment(Map<String, String> env) throws ConfigException {
        Objects.requireNonNull(env, "env");

        String token = env.get(ENV_TOKEN);
        if (token == null || token.isBlank()) {
            throw new ConfigException(ENV_TOKEN + " is not set");
        }
        token = token.strip();
        if (token.equals(PLACEHOLDER_TOKEN)) {
            throw new ConfigException(ENV_TOKEN + " still holds the placeholder value");
        }

        Builder builder = builder()
                .coreUri(parseUri(valueOr(env, ENV_URL, DEFAULT_CORE_URL)))
                .token(token);

        RouterPolicy router = RouterPolicy.defaults();
        int maxInFlight = router.maxInFlight();
        Duration commandTimeout = router.commandTimeout();
        if (env.containsKey(ENV_MAX_IN_FLIGHT)) {
            maxInFlight = parsePositiveInt(ENV_MAX_IN_FLIGHT, env.get(ENV_MAX_IN_FLIGHT));
        }
        if (env.containsKey(ENV_COMMAND_TIMEOUT)) {
            commandTimeout = parsePositiveDuration(ENV_COMMAND_TIMEOUT, env.get(ENV_COMMAND_TIMEOUT));
        }
        builder.routerPolicy(new RouterPolicy(maxInFlight, commandTimeout));

        if (env.containsKey(ENV_CACHE_TTL)) {
            builder.upstreamPolicy(UpstreamPolicy.defaults()
                    .withCacheTtl(parsePositiveDuration(ENV_CACHE_TTL, env.get(ENV_CACHE_TTL))));
        }

        return builder.build();
    }

    private static String valueOr(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.strip();
    }

    private static URI parseUri(String text) throws ConfigException {
        URI uri;
        try {
            uri = new URI(text);
        } catch (URISyntaxException e) {
            throw new ConfigException(ENV_URL + " is not a valid URL: " + text, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new ConfigException(ENV_URL + " must be an absolute URL with a host: " + text);
        }
        return uri;
    }

    private static int parsePositiveInt(String key, String text) throws ConfigException {
        try {
            int value = Integer.parseInt(text.strip());
            if (value <= 0) {
                throw new ConfigException(key + " must be > 0: " + text);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ConfigException(key + " is not an integer: " + text, e);
        }
    }

    private static Duration parsePositiveDuration(String key, String text) throws ConfigException {
        try {
            Duration value = Duration.parse(text.strip());
            if (value.isNegative() || value.isZero()) {
                throw new ConfigException(key + " must be positive: " + text);
            }
            return value;
        } catch (DateTimeParseException e) {
            throw new ConfigException(key + " is not an ISO-8601 duration: " + text, e);
        }
    }

    public static final class Builder {
        private URI coreUri = URI.create(DEFAULT_CORE_URL);
        private String token;
        private String pluginName = DEFAULT_PLUGIN_NAME;
        private SupervisorTimingPolicy supervisorTiming = SupervisorTimingPolicy.defaults();
        private RouterPolicy routerPolicy = RouterPolicy.defaults();
        private UpstreamPolicy upstreamPolicy = UpstreamPolicy.defaults();

        private Builder() {}

        public Builder coreUri(URI coreUri) {
            this.coreUri = coreUri;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder pluginName(String pluginName) {
            this.pluginName = pluginName;
            return this;
        }

        public Builder supervisorTiming(SupervisorTimingPolicy supervisorTiming) {
            this.supervisorTiming = supervisorTiming;
            return this;
        }

        public Builder routerPolicy(RouterPolicy routerPolicy) {
            this.routerPolicy = routerPolicy;
            return this;
        }

        public Builder upstreamPolicy(UpstreamPolicy upstreamPolicy) {
            this.upstreamPolicy = upstreamPolicy;
            return this;
        }

        public RadioRuntimeConfig build() {
            return new RadioRuntimeConfig(coreUri, token, pluginName, supervisorTiming, routerPolicy, upstreamPolicy);
        }
    }
}
