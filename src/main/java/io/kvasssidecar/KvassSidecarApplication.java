package io.kvasssidecar;

import io.kvasssidecar.config.SidecarConfig;
import io.kvasssidecar.metrics.TargetsMetricsRecorder;
import io.kvasssidecar.targets.TargetsManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Main Spring Boot application class for the shard sidecar.
 * <p>
 * Wires the targets manager and restores the shard's targets from disk at startup. The API that receives
 * target updates from the coordinator and the scrape loop plug in on top of {@link TargetsManager}.
 */
@Slf4j
@SpringBootApplication
public class KvassSidecarApplication {

    public static void main(String[] args) {
        log.info("Starting kvass sidecar");

        try {
            SpringApplication.run(KvassSidecarApplication.class, args);
            log.info("Kvass sidecar started successfully");
        } catch (Exception e) {
            log.error("Failed to start kvass sidecar: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    public SidecarConfig config() {
        return new SidecarConfig();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public TargetsMetricsRecorder targetsMetricsRecorder(MeterRegistry meterRegistry, SidecarConfig config) {
        return new TargetsMetricsRecorder(meterRegistry, config.getSidecarId());
    }

    @Bean
    public TargetsManager targetsManager(SidecarConfig config, TargetsMetricsRecorder metricsRecorder, Clock clock) {
        log.info("Initializing TargetsManager with store directory {}", config.getStoreDir());
        return new TargetsManager(config, metricsRecorder, clock);
    }

    /**
     * Restore local targets before anything else talks to the manager.
     */
    @Bean
    public ApplicationRunner targetsLoader(TargetsManager targetsManager) {
        return args -> {
            targetsManager.load();
            log.info("Loaded {} jobs, idle since {}",
                    targetsManager.currentSnapshot().getTargets().size(),
                    targetsManager.currentSnapshot().getIdleAt());
        };
    }
}
