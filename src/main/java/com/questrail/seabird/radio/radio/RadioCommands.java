package com.questrail.seabird.radio.radio;

import com.questrail.seabird.radio.api.CommandHandler;
import com.questrail.seabird.radio.internal.time.MonotonicClock;
import com.questrail.seabird.radio.internal.time.MonotonicScheduler;
import com.questrail.seabird.radio.internal.time.WallClock;
import com.questrail.seabird.radio.upstream.HttpUpstreamFetcher;
import com.questrail.seabird.radio.upstream.UpstreamPolicy;
import com.questrail.seabird.radio.upstream.UpstreamRadioClient;

import java.util.List;

/**
 * Assembles the radio command handlers over the public HamQSL and POTA feeds.
 * Each feed gets its own cache and request budget.
 */
public final class RadioCommands {

    static final String USER_AGENT = "seabird-radio";

    private RadioCommands() {}

    public static List<CommandHandler> create(UpstreamPolicy policy,
                                              MonotonicClock clock,
                                              MonotonicScheduler scheduler,
                                              WallClock wallClock) {
        HttpUpstreamFetcher fetcher = HttpUpstreamFetcher.create(policy.requestTimeout(), USER_AGENT);

        UpstreamRadioClient<SolarReport> solar = UpstreamRadioClient.create(
                "hamqsl", new HamQslSolarSource(fetcher, HamQslSolarSource.DEFAULT_URI), policy, clock, scheduler);
        UpstreamRadioClient<List<Activation>> spots = UpstreamRadioClient.create(
                "pota", new PotaSpotSource(fetcher, PotaSpotSource.DEFAULT_URI), policy, clock, scheduler);

        return List.of(
                new BandsCommandHandler(solar),
                new PotaCommandHandler(spots, wallClock)
        );
    }
}
