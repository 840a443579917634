package com.companya.scd.jobs;

import com.companya.scd.service.RunOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ScheduledScdJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduledScdJob.class);

    private final RunOrchestrator orchestrator;

    public ScheduledScdJob(RunOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    // "-" (the default) disables the trigger
    @Scheduled(cron = "${scd.schedule.cron:-}")
    public void run() {
        log.info("Running scheduled SCD job");
        orchestrator.runAll();
        log.info("Scheduled SCD job completed");
    }
}
