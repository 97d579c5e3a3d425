package com.questrail.seabird.radio.radio;

import com.questrail.seabird.radio.api.CommandEnvelope;
import com.questrail.seabird.radio.api.CommandHandler;
import com.questrail.seabird.radio.api.CommandSpec;
import com.questrail.seabird.radio.upstream.UpstreamRadioClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * {@code bands}: current HF propagation conditions, one line per band group.
 */
public final class BandsCommandHandler implements CommandHandler {

    static final String SOLAR_KEY = "solar";

    private static final CommandSpec SPEC = new CommandSpec(
            "bands",
            0,
            0,
            "show HAM RF band conditions",
            "show HAM RF band conditions"
    );

    private final UpstreamRadioClient<SolarReport> solar;

    public BandsCommandHandler(UpstreamRadioClient<SolarReport> solar) {
        this.solar = Objects.requireNonNull(solar, "solar");
    }

    @Override
    public CommandSpec spec() {
        return SPEC;
    }

    @Override
    public CompletionStage<List<String>> handle(CommandEnvelope command) {
        return solar.query(SOLAR_KEY).thenApply(report -> format(command, report));
    }

    static List<String> format(CommandEnvelope command, SolarReport report) {
        List<String> lines = new ArrayList<>(report.bands().size() + 2);
        lines.add(Replies.addressedTo(command.source(), "current band conditions:"));
        lines.add("updated " + report.updated());
        for (Map.Entry<String, BandCondition> band : report.bands().entrySet()) {
            lines.add(band.getKey() + " - day: " + band.getValue().day()
                    + ", night: " + band.getValue().night());
        }
        return lines;
    }
}
