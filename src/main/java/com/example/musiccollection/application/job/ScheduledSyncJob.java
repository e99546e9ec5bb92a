package com.example.musiccollection.application.job;

import com.example.musiccollection.application.service.SyncOrchestrator;
import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.model.RunReport;
import java.util.Collections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class ScheduledSyncJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduledSyncJob.class);

    private final AppSyncProperties appSyncProperties;
    private final SyncOrchestrator syncOrchestrator;

    public ScheduledSyncJob(AppSyncProperties appSyncProperties, SyncOrchestrator syncOrchestrator) {
        this.appSyncProperties = appSyncProperties;
        this.syncOrchestrator = syncOrchestrator;
    }

    @Scheduled(cron = "${app.sync.cron:0 0 4 * * ?}")
    public void run() {
        if (!appSyncProperties.isScheduleEnabled()) {
            log.debug("Scheduled sync skipped: schedule disabled");
            return;
        }
        if (syncOrchestrator.isRunning()) {
            log.info("Scheduled sync skipped due to active run, cron={}", appSyncProperties.getCron());
            return;
        }
        log.info("Scheduled sync triggered, cron={}", appSyncProperties.getCron());
        RunReport report = syncOrchestrator.run(Collections.emptySet(), false);
        log.info("Scheduled sync finished, sources={}, failed={}, snapshot={}",
                report.getOutcomes().size(), report.failedCount(), report.isSnapshotRecorded());
    }
}
