package com.example.musiccollection.application.service;

import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.MatchKeys;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.infrastructure.persistence.entity.SyncLedgerEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.SyncLedgerMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Per-source bookkeeping in {@code keep_track}: when a source was last attempted, how many
 * records it produced and the status of that attempt.
 */
@Service
public class SyncLedgerService {

    private static final Logger log = LoggerFactory.getLogger(SyncLedgerService.class);

    public static final String STATUS_SUCCESS = "success";
    private static final String FAILED_PREFIX = "failed: ";
    private static final int STATUS_COLUMN_LENGTH = 100;

    private final SyncLedgerMapper syncLedgerMapper;
    private final AppSyncProperties appSyncProperties;
    private final Clock clock;

    public SyncLedgerService(SyncLedgerMapper syncLedgerMapper,
                             AppSyncProperties appSyncProperties,
                             Clock clock) {
        this.syncLedgerMapper = syncLedgerMapper;
        this.appSyncProperties = appSyncProperties;
        this.clock = clock;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public SyncLedgerEntity find(SyncSourceId source) {
        return syncLedgerMapper.selectBySourceName(source.getLedgerName());
    }

    public List<SyncLedgerEntity> listAll() {
        return syncLedgerMapper.selectAll();
    }

    /**
     * API sources: skipped when the last sync attempt is younger than {@code app.sync.skip-days}.
     */
    public boolean shouldSkip(SyncSourceId source, boolean force) {
        if (force) {
            return false;
        }
        SyncLedgerEntity entry = find(source);
        if (entry == null || entry.getLastSync() == null) {
            return false;
        }
        Duration age = Duration.between(entry.getLastSync(), now());
        boolean skip = age.compareTo(Duration.ofDays(appSyncProperties.getSkipDays())) < 0;
        if (skip) {
            log.info("SYNC_SOURCE_FRESH source={} lastSync={} ageHours={} skipDays={}",
                    source.getLedgerName(), entry.getLastSync(), age.toHours(), appSyncProperties.getSkipDays());
        }
        return skip;
    }

    /**
     * File sources: skipped when the file has not been modified since the last sync attempt.
     */
    public boolean shouldSkipFile(SyncSourceId source, LocalDateTime fileModifiedAt, boolean force) {
        if (force || fileModifiedAt == null) {
            return false;
        }
        SyncLedgerEntity entry = find(source);
        if (entry == null || entry.getLastSync() == null) {
            return false;
        }
        return !fileModifiedAt.isAfter(entry.getLastSync());
    }

    /**
     * Records a sync attempt, successful or not: {@code last_sync} moves to now, so a failing
     * source also waits out the skip window before it is tried again.
     */
    public void update(SyncSourceId source, long recordsCount, String status) {
        ensure(source);
        syncLedgerMapper.updateSync(source.getLedgerName(), now(), recordsCount,
                MatchKeys.truncate(status, STATUS_COLUMN_LENGTH));
    }

    /**
     * Records a failed attempt as {@code failed: <reason>} with a zero record count.
     */
    public void recordFailure(SyncSourceId source, String reason) {
        String status = failedStatus(reason);
        update(source, 0L, status);
        log.warn("SYNC_LEDGER_FAILURE source={} status={}", source.getLedgerName(), status);
    }

    /**
     * The file path stored on the ledger row, or the configured default which is then stored.
     */
    public String resolveFilePath(SyncSourceId source, String configuredDefault) {
        SyncLedgerEntity entry = find(source);
        if (entry != null && StringUtils.hasText(entry.getFilePath())) {
            return entry.getFilePath();
        }
        if (!StringUtils.hasText(configuredDefault)) {
            return null;
        }
        ensure(source);
        syncLedgerMapper.updateFilePath(source.getLedgerName(), configuredDefault);
        return configuredDefault;
    }

    public String failedStatus(String reason) {
        String text = reason == null ? "unknown error" : reason;
        return FAILED_PREFIX + MatchKeys.truncate(text, appSyncProperties.getStatusMaxLength());
    }

    private void ensure(SyncSourceId source) {
        syncLedgerMapper.ensureSource(source.getLedgerName(), source.getSourceType().ledgerValue(), null);
    }
}
