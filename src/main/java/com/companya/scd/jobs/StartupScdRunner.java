package com.companya.scd.jobs;

import com.companya.scd.config.ScdProperties;
import com.companya.scd.service.RunOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Runs one pass over every configured table once the context is up, when
 * {@code scd.run-on-startup} is set. This is how the service behaves as a one-shot batch job.
 */
@Slf4j
@Component
@Profile("!test") // tests drive passes explicitly
@RequiredArgsConstructor
public class StartupScdRunner implements ApplicationRunner {

    private final ScdProperties properties;
    private final RunOrchestrator orchestrator;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.info("scd.run-on-startup is off, waiting for schedule or manual trigger");
            return;
        }
        log.info("🚀 Running startup SCD passes...");
        orchestrator.runAll();
    }
}
