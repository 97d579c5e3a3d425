package com.questrail.seabird.radio.router;

import com.questrail.seabird.radio.api.CommandEnvelope;
import com.questrail.seabird.radio.api.CommandHandler;
import com.questrail.seabird.radio.api.CommandSpec;
import com.questrail.seabird.radio.api.CommandUsageException;
import com.questrail.seabird.radio.api.ErrorKind;
import com.questrail.seabird.radio.api.ResponseEnvelope;
import com.questrail.seabird.radio.api.ResponseSink;
import com.questrail.seabird.radio.internal.time.Cancellable;
import com.questrail.seabird.radio.internal.time.MonotonicClock;
import com.questrail.seabird.radio.internal.time.MonotonicScheduler;
import com.questrail.seabird.radio.internal.time.WallClock;
import com.questrail.seabird.radio.observability.CommandFailureEvent;
import com.questrail.seabird.radio.observability.NullObservabilitySink;
import com.questrail.seabird.radio.observability.RadioObservabilitySink;
import com.questrail.seabird.radio.upstream.RateLimitedException;
import com.questrail.seabird.radio.upstream.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CommandRouter
 * =============================================================================
 * Turns each inbound {@link CommandEnvelope} into exactly one
 * {@link ResponseEnvelope}.
 *
 * <h2>Dispatch rules</h2>
 * <ol>
 *   <li>no handler for the name: UNKNOWN_COMMAND, answered immediately</li>
 *   <li>argument count outside the handler's range: BAD_ARGUMENTS, answered
 *       immediately; the handler is never invoked</li>
 *   <li>otherwise an in-flight permit is taken and the handler runs on the
 *       handler executor; its outcome, a failure, or the per-command timeout
 *       settles the command, whichever comes first</li>
 * </ol>
 *
 * <h2>Backpressure</h2>
 * {@link #dispatch(CommandEnvelope)} blocks the calling pump while every
 * permit is taken. Reads from the core therefore slow down instead of
 * queueing without bound.
 *
 * <h2>Isolation</h2>
 * The router never touches the transport. Responses go to a
 * {@link ResponseSink}, which decides whether the originating session can
 * still carry them.
 */
public final class CommandRouter {

    private static final Logger log = LoggerFactory.getLogger(CommandRouter.class);

    static final String RATE_LIMITED_MESSAGE = "rate limited by upstream, try again later";
    static final String INTERNAL_MESSAGE = "internal error";

    private final CommandRegistry registry;
    private final ResponseSink responseSink;
    private final Executor handlerExecutor;
    private final RouterPolicy policy;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final RadioObservabilitySink observabilitySink;

    private final Semaphore permits;

    public CommandRouter(CommandRegistry registry,
                         ResponseSink responseSink,
                         Executor handlerExecutor,
                         RouterPolicy policy,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         WallClock wallClock,
                         RadioObservabilitySink observabilitySink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.responseSink = Objects.requireNonNull(responseSink, "responseSink");
        this.handlerExecutor = Objects.requireNonNull(handlerExecutor, "handlerExecutor");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.permits = new Semaphore(policy.maxInFlight());
    }

    /**
     * Route one command. Returns once the command is answered or its handler
     * has been started.
     *
     * @throws InterruptedException if interrupted while waiting for a permit;
     *                              the command is then left unanswered
     */
    public void dispatch(CommandEnvelope command) throws InterruptedException {
        Objects.requireNonNull(command, "command");
        log.debug("Dispatching {} ({}) with {} args",
                command.command(), command.correlationId(), command.argCount());

        Optional<CommandHandler> found = registry.lookup(command.command());
        if (found.isEmpty()) {
            reject(command, ErrorKind.UNKNOWN_COMMAND, "unknown command: " + command.command());
            return;
        }

        CommandHandler handler = found.get();
        CommandSpec spec = handler.spec();
        if (!spec.acceptsArgCount(command.argCount())) {
            reject(command, ErrorKind.BAD_ARGUMENTS, usage(spec, command.argCount()));
            return;
        }

        permits.acquire();
        Invocation invocation = new Invocation(command);
        try {
            invocation.armTimeout();
            handlerExecutor.execute(() -> invocation.run(handler));
        } catch (RejectedExecutionException e) {
            // Scheduler or handler pool already shut down.
            invocation.fail(e);
        }
    }

    /**
     * Commands currently holding a permit.
     */
    public int inFlightCount() {
        return policy.maxInFlight() - permits.availablePermits();
    }

    /**
     * Wait until no command is in flight.
     *
     * @return {@code true} if quiescent before the timeout
     */
    public boolean awaitQuiescence(Duration timeout) throws InterruptedException {
        int all = policy.maxInFlight();
        if (!permits.tryAcquire(all, timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            return false;
        }
        permits.release(all);
        return true;
    }

    private void reject(CommandEnvelope command, ErrorKind kind, String message) {
        observabilitySink.onCommandFailure(new CommandFailureEvent(
                wallClock.now(), command.correlationId(), command.command(), kind, null));
        responseSink.emit(ResponseEnvelope.failure(command, kind, message, wallClock.now()));
    }

    private static String usage(CommandSpec spec, int given) {
        String expected = spec.minArgs() == spec.maxArgs()
                ? String.valueOf(spec.minArgs())
                : spec.minArgs() + "-" + spec.maxArgs();
        return spec.name() + " takes " + expected + " argument(s), got " + given + ": " + spec.shortHelp();
    }

    /**
     * One admitted command. Settles at most once; the first of handler
     * result, handler failure or timeout wins and releases the permit.
     */
    private final class Invocation {
        private final CommandEnvelope command;
        private final AtomicBoolean settled = new AtomicBoolean();
        private volatile Cancellable timeout;

        private Invocation(CommandEnvelope command) {
            this.command = command;
        }

        void armTimeout() {
            timeout = scheduler.scheduleAfter(policy.commandTimeout(), clock, this::timedOut);
        }

        void run(CommandHandler handler) {
            CompletionStage<List<String>> stage;
            try {
                stage = Objects.requireNonNull(handler.handle(command), "handler returned null");
            } catch (RuntimeException e) {
                fail(e);
                return;
            }
            stage.whenComplete((lines, failure) -> {
                if (failure != null) {
                    fail(failure);
                } else if (lines == null) {
                    fail(new IllegalStateException("handler completed without reply lines"));
                } else {
                    succeed(lines);
                }
            });
        }

        private void succeed(List<String> lines) {
            if (settle()) {
                responseSink.emit(ResponseEnvelope.success(command, lines, wallClock.now()));
            }
        }

        void fail(Throwable failure) {
            Throwable cause = unwrap(failure);
            ErrorKind kind;
            String message;
            if (cause instanceof RateLimitedException) {
                kind = ErrorKind.RATE_LIMITED;
                message = RATE_LIMITED_MESSAGE;
            } else if (cause instanceof UpstreamUnavailableException) {
                kind = ErrorKind.UPSTREAM_UNAVAILABLE;
                message = Objects.requireNonNullElse(cause.getMessage(), "upstream unavailable");
            } else if (cause instanceof CommandUsageException) {
                kind = ErrorKind.BAD_ARGUMENTS;
                message = Objects.requireNonNullElse(cause.getMessage(), command.command() + ": bad arguments");
            } else {
                kind = ErrorKind.INTERNAL;
                message = INTERNAL_MESSAGE;
            }

            if (settle()) {
                observabilitySink.onCommandFailure(new CommandFailureEvent(
                        wallClock.now(), command.correlationId(), command.command(), kind, cause));
                responseSink.emit(ResponseEnvelope.failure(command, kind, message, wallClock.now()));
            }
        }

        // Runs on the scheduler thread, which must not block on a transport
        // write; the answer is emitted from the handler executor instead.
        private void timedOut() {
            if (!settle()) {
                return;
            }
            log.debug("Command {} ({}) timed out after {} ms",
                    command.command(), command.correlationId(), policy.commandTimeout().toMillis());
            observabilitySink.onCommandFailure(new CommandFailureEvent(
                    wallClock.now(), command.correlationId(), command.command(), ErrorKind.TIMEOUT, null));
            ResponseEnvelope response = ResponseEnvelope.failure(command, ErrorKind.TIMEOUT,
                    command.command() + " timed out", wallClock.now());
            try {
                handlerExecutor.execute(() -> responseSink.emit(response));
            } catch (RejectedExecutionException e) {
                responseSink.emit(response);
            }
        }

        private boolean settle() {
            if (!settled.compareAndSet(false, true)) {
                return false;
            }
            Cancellable t = timeout;
            if (t != null) {
                t.cancel();
            }
            permits.release();
            return true;
        }
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
