package com.questrail.seabird.radio.radio;

import com.questrail.seabird.radio.api.CommandEnvelope;
import com.questrail.seabird.radio.api.CommandHandler;
import com.questrail.seabird.radio.api.CommandSpec;
import com.questrail.seabird.radio.api.CommandUsageException;
import com.questrail.seabird.radio.internal.time.WallClock;
import com.questrail.seabird.radio.upstream.UpstreamRadioClient;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@code pota <band> [mode]}: the most recent Parks on the Air spot on a band
 * in a mode (SSB unless given).
 */
public final class PotaCommandHandler implements CommandHandler {

    static final String SPOTS_KEY = "spots";

    private static final String USAGE = "Usage: pota <band> [mode]";

    private static final CommandSpec SPEC = new CommandSpec(
            "pota",
            1,
            2,
            "find most recent POTA activation",
            "find the most recent Parks on the Air activation. " + USAGE + ". Default mode is SSB."
    );

    private static final DateTimeFormatter SPOT_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final UpstreamRadioClient<List<Activation>> spots;
    private final WallClock wallClock;

    public PotaCommandHandler(UpstreamRadioClient<List<Activation>> spots, WallClock wallClock) {
        this.spots = Objects.requireNonNull(spots, "spots");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public CommandSpec spec() {
        return SPEC;
    }

    @Override
    public CompletionStage<List<String>> handle(CommandEnvelope command) {
        Band band;
        Mode mode;
        try {
            band = Band.parse(command.arg(0)).orElseThrow(() ->
                    new CommandUsageException("unknown band \"" + command.arg(0) + "\". " + USAGE));
            mode = command.argCount() > 1
                    ? Mode.parse(command.arg(1)).orElseThrow(() ->
                            new CommandUsageException("unknown mode \"" + command.arg(1) + "\". " + USAGE))
                    : Mode.SSB;
        } catch (CommandUsageException e) {
            return CompletableFuture.failedFuture(e);
        }

        return spots.query(SPOTS_KEY).thenApply(activations ->
                List.of(Replies.addressedTo(command.source(), reply(activations, band, mode))));
    }

    private String reply(List<Activation> activations, Band band, Mode mode) {
        Optional<Activation> latest = mostRecent(activations, band, mode);
        if (latest.isEmpty()) {
            return "no activations found on " + band + " over " + mode;
        }
        Activation a = latest.get();
        return "[time:" + formatSpotTime(a.spotTime())
                + ",age:" + formatAge(a.ageAt(wallClock.now())) + "] "
                + a.frequency() + "MHz " + a.mode() + ", "
                + a.locationDesc() + " - " + a.parkName() + " (" + a.activator() + ")";
    }

    static Optional<Activation> mostRecent(List<Activation> activations, Band band, Mode mode) {
        return activations.stream()
                .filter(a -> a.matches(band, mode))
                .max(Comparator.comparing(Activation::spotTime));
    }

    /**
     * {@code <m>m<s>s} above one minute, plain seconds otherwise.
     */
    static String formatAge(Duration age) {
        long seconds = Math.abs(age.getSeconds());
        if (seconds > 60) {
            return (seconds / 60) + "m" + (seconds % 60) + "s";
        }
        return Long.toString(seconds);
    }

    static String formatSpotTime(Instant spotTime) {
        return SPOT_TIME.format(spotTime);
    }
}
