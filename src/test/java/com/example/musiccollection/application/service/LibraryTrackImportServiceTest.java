package com.example.musiccollection.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.enumtype.SyncResultStatus;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.infrastructure.fileimport.LibraryTrackCsvReader;
import com.example.musiccollection.infrastructure.persistence.entity.SyncLedgerEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogTrackMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryAlbumMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryTrackMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.PlayHistoryMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.SyncLedgerMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.TableCountMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.WantlistMapper;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LibraryTrackImportServiceTest {

    private static final String HEADER = "Album Artist,Album,Disc#,Track#,Title,Track Artist(s),Composer(s),"
            + "External Id,Source,Is Dup?,Is Hidden?,Tags\n";

    @TempDir
    Path tempDir;

    private SyncLedgerMapper ledgerMapper;
    private LibraryTrackMapper trackMapper;
    private TableCountMapper countMapper;
    private AppSyncProperties properties;
    private LibraryTrackImportService service;

    @BeforeEach
    void setUp() {
        ledgerMapper = mock(SyncLedgerMapper.class);
        trackMapper = mock(LibraryTrackMapper.class);
        countMapper = mock(TableCountMapper.class);
        properties = new AppSyncProperties();
        properties.setTrackBatchSize(2);
        Clock clock = Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC);

        SyncLedgerService ledgerService = new SyncLedgerService(ledgerMapper, properties, clock);
        CollectionStoreService store = new CollectionStoreService(mock(LibraryAlbumMapper.class), trackMapper,
                mock(PlayHistoryMapper.class), mock(CatalogCollectionMapper.class), mock(CatalogTrackMapper.class),
                mock(WantlistMapper.class), countMapper, properties);
        service = new LibraryTrackImportService(new FileSourceSupport(ledgerService, store, clock),
                new LibraryTrackCsvReader(), store, ledgerService, properties);
    }

    @Test
    void shouldImportChangedFileInBatches() throws IOException {
        Path file = writeExport(3, Instant.parse("2024-03-09T08:00:00Z"));
        properties.setRoonTracksFile(file.toString());
        when(ledgerMapper.selectBySourceName("roon_tracks")).thenReturn(entry(null, LocalDateTime.of(2024, 3, 1, 0, 0)));

        SyncOutcome outcome = service.sync(false);

        assertEquals(SyncResultStatus.SUCCESS, outcome.getStatus());
        assertEquals(3L, outcome.getRecordCount());
        verify(trackMapper).truncate();
        verify(trackMapper, times(2)).batchInsert(any());
        verify(ledgerMapper).updateSync("roon_tracks", LocalDateTime.of(2024, 3, 10, 12, 0), 3L, "success");
    }

    @Test
    void shouldSkipFileOlderThanLastSync() throws IOException {
        Path file = writeExport(3, Instant.parse("2024-03-01T08:00:00Z"));
        when(ledgerMapper.selectBySourceName("roon_tracks"))
                .thenReturn(entry(file.toString(), LocalDateTime.of(2024, 3, 5, 0, 0)));
        when(countMapper.count(StoreTable.ROON_TRACKS)).thenReturn(120L);

        SyncOutcome outcome = service.sync(false);

        assertEquals(SyncResultStatus.SKIPPED, outcome.getStatus());
        assertEquals(120L, outcome.getRecordCount());
        verify(trackMapper, never()).truncate();
    }

    @Test
    void shouldReimportUnchangedFileWhenForced() throws IOException {
        Path file = writeExport(1, Instant.parse("2024-03-01T08:00:00Z"));
        when(ledgerMapper.selectBySourceName("roon_tracks"))
                .thenReturn(entry(file.toString(), LocalDateTime.of(2024, 3, 5, 0, 0)));

        assertEquals(SyncResultStatus.SUCCESS, service.sync(true).getStatus());
        verify(trackMapper).truncate();
    }

    @Test
    void shouldFailWhenFileIsMissing() throws IOException {
        properties.setRoonTracksFile(tempDir.resolve("missing.csv").toString());

        SyncOutcome outcome = service.sync(false);

        assertEquals(SyncResultStatus.FAILED, outcome.getStatus());
        verify(ledgerMapper).updateSync("roon_tracks", LocalDateTime.of(2024, 3, 10, 12, 0), 0L, "failed: file not found");
        verify(trackMapper, never()).truncate();
    }

    @Test
    void shouldSkipWhenNoPathConfigured() throws IOException {
        SyncOutcome outcome = service.sync(false);

        assertEquals(SyncResultStatus.SKIPPED, outcome.getStatus());
        assertEquals("no file path configured", outcome.getMessage());
        verify(ledgerMapper, never()).updateSync(any(), any(), anyLong(), any());
    }

    private Path writeExport(int rows, Instant modifiedAt) throws IOException {
        StringBuilder csv = new StringBuilder(HEADER);
        for (int i = 1; i <= rows; i++) {
            csv.append("Artist,Album,1,").append(i).append(",Track ").append(i).append(",,,,Local,no,no,\n");
        }
        Path file = tempDir.resolve("tracks.csv");
        Files.write(file, csv.toString().getBytes(StandardCharsets.UTF_8));
        Files.setLastModifiedTime(file, FileTime.from(modifiedAt));
        return file;
    }

    private SyncLedgerEntity entry(String filePath, LocalDateTime lastSync) {
        SyncLedgerEntity entity = new SyncLedgerEntity();
        entity.setSourceName("roon_tracks");
        entity.setSourceType("file");
        entity.setFilePath(filePath);
        entity.setLastSync(lastSync);
        return entity;
    }
}
