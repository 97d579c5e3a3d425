package com.questrail.seabird.radio.radio;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.seabird.radio.upstream.HttpUpstreamFetcher;
import com.questrail.seabird.radio.upstream.UpstreamFetchException;
import com.questrail.seabird.radio.upstream.UpstreamSource;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * PotaSpotSource
 * -----------------------------------------------------------------------------
 * Current Parks on the Air spots from {@code api.pota.app}.
 *
 * <p>The payload is a JSON array of spots. Frequencies arrive as kilohertz
 * text and spot times as UTC {@code yyyy-MM-dd'T'HH:mm:ss} without an offset.
 * Any spot that cannot be decoded rejects the whole payload.</p>
 */
public final class PotaSpotSource implements UpstreamSource<List<Activation>> {

    public static final URI DEFAULT_URI = URI.create("https://api.pota.app/v1/spots");

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<SpotJson>> SPOT_LIST = new TypeReference<>() {};
    private static final DateTimeFormatter SPOT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final HttpUpstreamFetcher fetcher;
    private final URI uri;

    public PotaSpotSource(HttpUpstreamFetcher fetcher, URI uri) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.uri = Objects.requireNonNull(uri, "uri");
    }

    @Override
    public CompletableFuture<List<Activation>> fetch(String key) {
        return fetcher.get(uri).thenApply(PotaSpotSource::decode);
    }

    /**
     * @throws UpstreamFetchException (not retryable) if the payload is malformed
     */
    public static List<Activation> decode(String json) {
        List<SpotJson> spots;
        try {
            spots = MAPPER.readValue(json, SPOT_LIST);
        } catch (JsonProcessingException e) {
            throw new UpstreamFetchException("malformed POTA spots: " + e.getOriginalMessage(), false, e);
        }
        if (spots == null) {
            throw new UpstreamFetchException("malformed POTA spots: null payload", false);
        }

        List<Activation> activations = new ArrayList<>(spots.size());
        for (SpotJson spot : spots) {
            activations.add(toActivation(spot));
        }
        return List.copyOf(activations);
    }

    private static Activation toActivation(SpotJson spot) {
        if (spot == null || spot.activator() == null || spot.frequency() == null || spot.spotTime() == null) {
            throw new UpstreamFetchException("POTA spot is missing required fields: " + spot, false);
        }
        try {
            return new Activation(
                    spot.activator(),
                    Objects.requireNonNullElse(spot.name(), ""),
                    Objects.requireNonNullElse(spot.locationDesc(), ""),
                    Mode.fromUpstream(spot.mode()),
                    Frequency.parseKilohertz(spot.frequency()),
                    LocalDateTime.parse(spot.spotTime(), SPOT_TIME).toInstant(ZoneOffset.UTC)
            );
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new UpstreamFetchException("POTA spot for " + spot.activator() + " is malformed: "
                    + e.getMessage(), false, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SpotJson(
            @JsonProperty("activator") String activator,
            @JsonProperty("name") String name,
            @JsonProperty("locationDesc") String locationDesc,
            @JsonProperty("mode") String mode,
            @JsonProperty("frequency") String frequency,
            @JsonProperty("spotTime") String spotTime
    ) {
    }
}
