package com.example.musiccollection.application.service;

import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Shared gate for the export file imports: resolves the path from the ledger, checks the file
 * exists and is newer than the last successful import.
 */
@Component
public class FileSourceSupport {

    private static final Logger log = LoggerFactory.getLogger(FileSourceSupport.class);

    private final SyncLedgerService syncLedgerService;
    private final CollectionStoreService collectionStoreService;
    private final Clock clock;

    public FileSourceSupport(SyncLedgerService syncLedgerService,
                             CollectionStoreService collectionStoreService,
                             Clock clock) {
        this.syncLedgerService = syncLedgerService;
        this.collectionStoreService = collectionStoreService;
        this.clock = clock;
    }

    /**
     * Returns the file to import, or an outcome explaining why nothing is imported.
     */
    public FileGate check(SyncSourceId source, StoreTable table, String configuredPath, boolean force)
            throws IOException {
        String pathText = syncLedgerService.resolveFilePath(source, configuredPath);
        if (!StringUtils.hasText(pathText)) {
            return FileGate.stop(SyncOutcome.skipped(source, collectionStoreService.count(table),
                    "no file path configured"));
        }
        Path file = Paths.get(pathText);
        if (!Files.isRegularFile(file)) {
            log.warn("FILE_SOURCE_MISSING source={} path={}", source.getLedgerName(), pathText);
            syncLedgerService.recordFailure(source, "file not found");
            return FileGate.stop(SyncOutcome.failed(source, "file not found: " + pathText));
        }
        LocalDateTime modifiedAt = LocalDateTime.ofInstant(Files.getLastModifiedTime(file).toInstant(), clock.getZone());
        if (syncLedgerService.shouldSkipFile(source, modifiedAt, force)) {
            log.info("FILE_SOURCE_UNCHANGED source={} path={} modifiedAt={}", source.getLedgerName(), pathText, modifiedAt);
            return FileGate.stop(SyncOutcome.skipped(source, collectionStoreService.count(table),
                    "file not modified since last sync"));
        }
        log.info("FILE_SOURCE_IMPORT source={} path={} modifiedAt={} force={}",
                source.getLedgerName(), pathText, modifiedAt, force);
        return FileGate.proceed(file);
    }

    public static final class FileGate {

        private final Path file;
        private final SyncOutcome outcome;

        private FileGate(Path file, SyncOutcome outcome) {
            this.file = file;
            this.outcome = outcome;
        }

        static FileGate proceed(Path file) {
            return new FileGate(file, null);
        }

        static FileGate stop(SyncOutcome outcome) {
            return new FileGate(null, outcome);
        }

        public boolean shouldImport() {
            return file != null;
        }

        public Path getFile() {
            return file;
        }

        public SyncOutcome getOutcome() {
            return outcome;
        }
    }
}
