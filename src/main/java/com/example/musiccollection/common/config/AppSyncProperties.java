package com.example.musiccollection.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sync")
public class AppSyncProperties {

    /**
     * API sources synced more recently than this are skipped unless forced.
     */
    private int skipDays = 7;

    /**
     * Rows per flushed insert statement for album and catalog bulk loads.
     */
    private int batchSize = 500;

    /**
     * Rows per flushed insert statement for the track and play-history file imports.
     */
    private int trackBatchSize = 1000;

    /**
     * Max length of the error text written into the ledger status after "failed: ".
     */
    private int statusMaxLength = 50;

    /**
     * Default CSV export path, used when the ledger row carries no file path.
     */
    private String roonTracksFile;

    /**
     * Default JSON export path, used when the ledger row carries no file path.
     */
    private String roonPlayHistoryFile;

    private boolean scheduleEnabled = false;

    private String cron = "0 0 4 * * ?";
}
