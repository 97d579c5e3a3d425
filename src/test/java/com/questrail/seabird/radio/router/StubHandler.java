package com.questrail.seabird.radio.router;

import com.questrail.seabird.radio.api.CommandEnvelope;
import com.questrail.seabird.radio.api.CommandHandler;
import com.questrail.seabird.radio.api.CommandSpec;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Handler whose behaviour is supplied by the test. Counts invocations.
 */
final class StubHandler implements CommandHandler {

    private final CommandSpec spec;
    private final Function<CommandEnvelope, CompletionStage<List<String>>> behaviour;
    private final AtomicInteger invocations = new AtomicInteger();

    StubHandler(CommandSpec spec, Function<CommandEnvelope, CompletionStage<List<String>>> behaviour) {
        this.spec = spec;
        this.behaviour = behaviour;
    }

    @Override
    public CommandSpec spec() {
        return spec;
    }

    @Override
    public CompletionStage<List<String>> handle(CommandEnvelope command) {
        invocations.incrementAndGet();
        return behaviour.apply(command);
    }

    int invocations() {
        return invocations.get();
    }
}
