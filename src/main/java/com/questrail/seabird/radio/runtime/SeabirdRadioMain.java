package com.questrail.seabird.radio.runtime;

import com.questrail.seabird.radio.config.ConfigException;
import com.questrail.seabird.radio.config.RadioRuntimeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Process entry point. Configuration comes from the environment; the exit
 * code reports why the process ended (see {@link ExitStatus}).
 */
public final class SeabirdRadioMain {

    private static final Logger log = LoggerFactory.getLogger(SeabirdRadioMain.class);

    private SeabirdRadioMain() {}

    public static void main(String[] args) {
        System.exit(run(System.getenv()).code());
    }

    static ExitStatus run(Map<String, String> env) {
        RadioRuntimeConfig config;
        try {
            config = RadioRuntimeConfig.fromEnvironment(env);
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return ExitStatus.CONFIG_ERROR;
        }

        log.info("Connecting to {}", config.coreUri());
        try {
            SeabirdRadioRuntime runtime = SeabirdRadioRuntime.builder()
                    .withConfig(config)
                    .build();
            Runtime.getRuntime().addShutdownHook(new Thread(runtime::stop, "seabird-radio-shutdown"));

            runtime.start();
            ExitStatus status = runtime.termination().join();
            runtime.stop();
            return status;
        } catch (RuntimeException e) {
            log.error("seabird-radio crashed", e);
            return ExitStatus.CRASH;
        }
    }
}
