package com.questrail.seabird.radio.radio;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import com.questrail.seabird.radio.upstream.HttpUpstreamFetcher;
import com.questrail.seabird.radio.upstream.UpstreamFetchException;
import com.questrail.seabird.radio.upstream.UpstreamSource;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * HamQslSolarSource
 * -----------------------------------------------------------------------------
 * Band propagation forecast from the HamQSL solar XML feed.
 *
 * <p>Only {@code solardata/updated} and the {@code band} entries under
 * {@code solardata/calculatedconditions} are read. Each band group must have
 * exactly one {@code day} and one {@code night} entry; anything else makes
 * the payload invalid.</p>
 */
public final class HamQslSolarSource implements UpstreamSource<SolarReport> {

    public static final URI DEFAULT_URI = URI.create("https://www.hamqsl.com/solarxml.php");

    private static final XmlMapper MAPPER = XmlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final HttpUpstreamFetcher fetcher;
    private final URI uri;

    public HamQslSolarSource(HttpUpstreamFetcher fetcher, URI uri) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.uri = Objects.requireNonNull(uri, "uri");
    }

    @Override
    public CompletableFuture<SolarReport> fetch(String key) {
        return fetcher.get(uri).thenApply(HamQslSolarSource::decode);
    }

    /**
     * @throws UpstreamFetchException (not retryable) if the XML is malformed
     *                                or the band list is inconsistent
     */
    public static SolarReport decode(String xml) {
        SolarXml solar;
        try {
            solar = MAPPER.readValue(xml, SolarXml.class);
        } catch (JsonProcessingException e) {
            throw new UpstreamFetchException("malformed solar XML: " + e.getOriginalMessage(), false, e);
        }
        if (solar == null || solar.solardata == null || solar.solardata.updated == null) {
            throw invalid("solar XML has no solardata/updated element");
        }

        List<BandXml> entries = solar.solardata.calculatedconditions != null
                && solar.solardata.calculatedconditions.band != null
                ? solar.solardata.calculatedconditions.band
                : List.of();

        Map<String, String[]> partial = new HashMap<>();
        for (BandXml entry : entries) {
            if (entry.name == null || entry.time == null) {
                throw invalid("band entry without name or time");
            }
            String[] dayNight = partial.computeIfAbsent(entry.name, name -> new String[2]);
            String condition = entry.condition == null ? "" : entry.condition.trim();
            switch (entry.time) {
                case "day" -> {
                    if (dayNight[0] != null) {
                        throw invalid("day conditions for band " + entry.name + " already set");
                    }
                    dayNight[0] = condition;
                }
                case "night" -> {
                    if (dayNight[1] != null) {
                        throw invalid("night conditions for band " + entry.name + " already set");
                    }
                    dayNight[1] = condition;
                }
                default -> throw invalid("unknown time " + entry.time + " for band " + entry.name);
            }
        }

        TreeMap<String, BandCondition> bands = new TreeMap<>();
        for (Map.Entry<String, String[]> e : partial.entrySet()) {
            String[] dayNight = e.getValue();
            if (dayNight[0] == null) {
                throw invalid("missing day value for band " + e.getKey());
            }
            if (dayNight[1] == null) {
                throw invalid("missing night value for band " + e.getKey());
            }
            bands.put(e.getKey(), new BandCondition(dayNight[0], dayNight[1]));
        }

        return new SolarReport(solar.solardata.updated.trim(), bands);
    }

    private static UpstreamFetchException invalid(String message) {
        return new UpstreamFetchException("invalid solar data: " + message, false);
    }

    // XML binding; field names follow the feed's element names.

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class SolarXml {
        public SolarDataXml solardata;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class SolarDataXml {
        public String updated;
        public CalculatedConditionsXml calculatedconditions;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class CalculatedConditionsXml {
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "band")
        public List<BandXml> band = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class BandXml {
        @JacksonXmlProperty(isAttribute = true)
        public String name;

        @JacksonXmlProperty(isAttribute = true)
        public String time;

        @JacksonXmlText
        public String condition;
    }
}
