package com.questrail.seabird.radio.runtime;

import com.questrail.seabird.radio.api.CommandHandler;
import com.questrail.seabird.radio.config.RadioRuntimeConfig;
import com.questrail.seabird.radio.emit.ResponseEmitter;
import com.questrail.seabird.radio.internal.time.MonotonicClock;
import com.questrail.seabird.radio.internal.time.MonotonicScheduler;
import com.questrail.seabird.radio.internal.time.ScheduledExecutorScheduler;
import com.questrail.seabird.radio.internal.time.SystemMonotonicClock;
import com.questrail.seabird.radio.internal.time.SystemWallClock;
import com.questrail.seabird.radio.internal.time.WallClock;
import com.questrail.seabird.radio.observability.RadioObservabilitySink;
import com.questrail.seabird.radio.observability.Slf4jRadioObservabilitySink;
import com.questrail.seabird.radio.radio.RadioCommands;
import com.questrail.seabird.radio.router.CommandRegistry;
import com.questrail.seabird.radio.router.CommandRouter;
import com.questrail.seabird.radio.session.AuthException;
import com.questrail.seabird.radio.session.CoreSession;
import com.questrail.seabird.radio.session.CoreStreamConnector;
import com.questrail.seabird.radio.supervisor.ReconnectionSupervisor;
import com.questrail.seabird.radio.supervisor.SupervisorListener;
import com.questrail.seabird.radio.supervisor.SupervisorState;
import com.questrail.seabird.radio.transport.grpc.GrpcCoreStreamConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SeabirdRadioRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the plugin.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>one scheduler thread: backoff, liveness ticks, command timeouts,
 *       upstream rate-limit waits and retries</li>
 *   <li>one connect thread: blocking handshakes</li>
 *   <li>a handler pool sized to the in-flight limit</li>
 *   <li>one inbound pump thread per live session</li>
 * </ul>
 *
 * <h2>Termination</h2>
 * {@link #termination()} completes with {@link ExitStatus#INVALID_CREDENTIALS}
 * when the core rejects the token, or {@link ExitStatus#OK} after
 * {@link #stop()}.
 */
public final class SeabirdRadioRuntime {

    private static final Logger log = LoggerFactory.getLogger(SeabirdRadioRuntime.class);

    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final ReconnectionSupervisor supervisor;
    private final CommandRouter router;
    private final ResponseEmitter emitter;
    private final ScheduledExecutorService schedulerExecutor;
    private final ExecutorService connectExecutor;
    private final ExecutorService handlerExecutor;
    private final AutoCloseable connectorResource;

    private final CompletableFuture<ExitStatus> termination;
    private final AtomicBoolean stopped = new AtomicBoolean();

    private SeabirdRadioRuntime(ReconnectionSupervisor supervisor,
                                CommandRouter router,
                                ResponseEmitter emitter,
                                ScheduledExecutorService schedulerExecutor,
                                ExecutorService connectExecutor,
                                ExecutorService handlerExecutor,
                                AutoCloseable connectorResource,
                                CompletableFuture<ExitStatus> termination) {
        this.supervisor = supervisor;
        this.router = router;
        this.emitter = emitter;
        this.schedulerExecutor = schedulerExecutor;
        this.connectExecutor = connectExecutor;
        this.handlerExecutor = handlerExecutor;
        this.connectorResource = connectorResource;
        this.termination = termination;
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() {
        log.info("Starting seabird-radio");
        supervisor.start();
    }

    /**
     * Close the live session, give in-flight commands a short grace period
     * and release every thread. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping seabird-radio");

        supervisor.stop();
        try {
            if (!router.awaitQuiescence(SHUTDOWN_GRACE)) {
                log.warn("{} command(s) still running at shutdown", router.inFlightCount());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        shutdown(connectExecutor);
        shutdown(handlerExecutor);
        shutdown(schedulerExecutor);

        if (connectorResource != null) {
            try {
                connectorResource.close();
            } catch (Exception e) {
                log.warn("Failed to close core connector", e);
            }
        }

        termination.complete(ExitStatus.OK);
    }

    public CompletableFuture<ExitStatus> termination() {
        return termination;
    }

    public SupervisorState supervisorState() {
        return supervisor.state();
    }

    public long droppedResponses() {
        return emitter.droppedCount();
    }

    public long emittedResponses() {
        return emitter.emittedCount();
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {
        private RadioRuntimeConfig config;
        private CoreStreamConnector connector;
        private List<CommandHandler> handlers;
        private RadioObservabilitySink observabilitySink = new Slf4jRadioObservabilitySink();

        private Builder() {}

        public Builder withConfig(RadioRuntimeConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Use this connector instead of a gRPC channel to the configured URL.
         * The runtime does not close a supplied connector.
         */
        public Builder withConnector(CoreStreamConnector connector) {
            this.connector = connector;
            return this;
        }

        /**
         * Serve these handlers instead of the radio commands.
         */
        public Builder withHandlers(List<CommandHandler> handlers) {
            this.handlers = List.copyOf(handlers);
            return this;
        }

        public Builder withObservabilitySink(RadioObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public SeabirdRadioRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec =
                    Executors.newSingleThreadScheduledExecutor(named("seabird-radio-scheduler"));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Commands
            List<CommandHandler> effectiveHandlers = handlers != null
                    ? handlers
                    : RadioCommands.create(config.upstreamPolicy(), clock, scheduler, wallClock);
            CommandRegistry registry = CommandRegistry.builder().registerAll(effectiveHandlers).build();

            // 3. Transport
            AutoCloseable connectorResource = null;
            CoreStreamConnector effectiveConnector = connector;
            if (effectiveConnector == null) {
                GrpcCoreStreamConnector grpc = GrpcCoreStreamConnector.forUri(config.coreUri());
                effectiveConnector = grpc;
                connectorResource = grpc;
            }
            CoreStreamConnector sessionConnector = effectiveConnector;

            AtomicLong sessionCounter = new AtomicLong();
            ExecutorService connectExec = Executors.newSingleThreadExecutor(named("seabird-radio-connect"));
            ExecutorService handlerExec = Executors.newFixedThreadPool(
                    config.routerPolicy().maxInFlight(), named("seabird-radio-handler"));
            ThreadFactory pumpThreads = named("seabird-radio-pump");
            CompletableFuture<ExitStatus> termination = new CompletableFuture<>();

            // 4. Supervisor, emitter and router. The supervisor's listener needs
            //    the router and the emitter needs the supervisor, so the
            //    listener reads them through holders set below.
            RouterHolder routerHolder = new RouterHolder();
            SupervisorHolder supervisorHolder = new SupervisorHolder();

            SupervisorListener listener = new SupervisorListener() {
                @Override
                public void onSessionLive(CoreSession session) {
                    log.info("Connected to core as session {} ({})",
                            session.id(), session.coreSessionId().orElse("no core id"));
                    pumpThreads.newThread(new InboundPump(
                            session, routerHolder.router, supervisorHolder.supervisor,
                            observabilitySink, wallClock)).start();
                }

                @Override
                public void onFatal(AuthException cause) {
                    log.error("Core rejected the plugin token: {}", cause.getMessage());
                    termination.complete(ExitStatus.INVALID_CREDENTIALS);
                }
            };

            ReconnectionSupervisor supervisor = new ReconnectionSupervisor(
                    () -> new CoreSession(
                            "session-" + sessionCounter.incrementAndGet(),
                            config.token(),
                            config.pluginName(),
                            registry.specs(),
                            sessionConnector,
                            clock,
                            wallClock,
                            observabilitySink),
                    config.supervisorTiming(),
                    clock,
                    scheduler,
                    wallClock,
                    connectExec,
                    listener,
                    observabilitySink
            );
            supervisorHolder.supervisor = supervisor;

            ResponseEmitter emitter = new ResponseEmitter(supervisor::currentSession, observabilitySink, wallClock);

            CommandRouter router = new CommandRouter(
                    registry,
                    emitter,
                    handlerExec,
                    config.routerPolicy(),
                    clock,
                    scheduler,
                    wallClock,
                    observabilitySink
            );
            routerHolder.router = router;

            return new SeabirdRadioRuntime(
                    supervisor, router, emitter, schedulerExec, connectExec, handlerExec,
                    connectorResource, termination);
        }
    }

    private static final class RouterHolder {
        volatile CommandRouter router;
    }

    private static final class SupervisorHolder {
        volatile ReconnectionSupervisor supervisor;
    }
}
