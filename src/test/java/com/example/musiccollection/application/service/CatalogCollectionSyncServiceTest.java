package com.example.musiccollection.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.enumtype.SyncResultStatus;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.CatalogPageResult;
import com.example.musiccollection.domain.model.CatalogRelease;
import com.example.musiccollection.domain.model.CatalogTrack;
import com.example.musiccollection.domain.model.FetchError;
import com.example.musiccollection.domain.model.FetchResult;
import com.example.musiccollection.domain.model.MarketplaceStats;
import com.example.musiccollection.domain.model.SyncOutcome;
import com.example.musiccollection.infrastructure.persistence.entity.CatalogCollectionEntity;
import com.example.musiccollection.infrastructure.persistence.entity.CatalogTrackEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogTrackMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryAlbumMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryTrackMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.PlayHistoryMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.TableCountMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.WantlistMapper;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CatalogCollectionSyncServiceTest {

    private final Map<Long, CatalogCollectionEntity> collectionRows = new LinkedHashMap<>();
    private final Map<Long, List<CatalogTrackEntity>> trackRows = new LinkedHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    private CatalogFetchService fetchService;
    private SyncLedgerService ledgerService;
    private CatalogCollectionSyncService service;

    @BeforeEach
    void setUp() {
        fetchService = mock(CatalogFetchService.class);
        ledgerService = mock(SyncLedgerService.class);
        AppSyncProperties properties = new AppSyncProperties();
        properties.setBatchSize(2);

        CollectionStoreService store = new CollectionStoreService(
                mock(LibraryAlbumMapper.class),
                mock(LibraryTrackMapper.class),
                mock(PlayHistoryMapper.class),
                inMemoryCollectionMapper(),
                inMemoryTrackMapper(),
                mock(WantlistMapper.class),
                inMemoryCountMapper(),
                properties);
        service = new CatalogCollectionSyncService(fetchService, store, ledgerService, properties);

        when(fetchService.fetchMarketplaceStats(anyLong()))
                .thenReturn(FetchResult.success(new MarketplaceStats(3, new BigDecimal("19.99"), "USD", false)));
        when(fetchService.fetchTracklist(anyLong())).thenAnswer(invocation -> FetchResult.success(Arrays.asList(
                new CatalogTrack("A1", "Side A " + invocation.getArgument(0), "3:00", null, null),
                new CatalogTrack("B1", "Side B " + invocation.getArgument(0), "4:00", null, null))));
    }

    @Test
    void shouldStoreListingAndTracks() {
        when(fetchService.fetchCollection()).thenReturn(listing(null, release(1L, "Pink Floyd", "The Wall"),
                release(2L, "Miles Davis", "Kind of Blue")));

        SyncOutcome outcome = service.sync(true);

        assertEquals(SyncResultStatus.SUCCESS, outcome.getStatus());
        assertEquals(2L, outcome.getRecordCount());
        assertEquals(2, collectionRows.size());
        assertEquals(4, countTracks());
        CatalogCollectionEntity wall = rowByRelease(1L);
        assertEquals("pink floyd - wall", wall.getMatchKey());
        assertEquals(new BigDecimal("19.99"), wall.getLowestPrice());
        verify(ledgerService).update(SyncSourceId.DISCOGS_COLLECTION, 2L, SyncLedgerService.STATUS_SUCCESS);
        verify(ledgerService).update(SyncSourceId.DISCOGS_TRACKS, 4L, SyncLedgerService.STATUS_SUCCESS);
    }

    @Test
    void shouldLeaveSameStateWhenRunTwice() {
        when(fetchService.fetchCollection()).thenAnswer(invocation -> listing(null,
                release(1L, "Pink Floyd", "The Wall"), release(2L, "Miles Davis", "Kind of Blue")));

        service.sync(true);
        Map<Long, Long> idsAfterFirstRun = releaseToId();
        rowByRelease(1L).setNotes("signed copy");
        service.sync(true);

        assertEquals(idsAfterFirstRun, releaseToId());
        assertEquals(4, countTracks());
        assertEquals("signed copy", rowByRelease(1L).getNotes());
    }

    @Test
    void shouldCountDuplicateReleaseAndFetchItsTracklistOnce() {
        when(fetchService.fetchCollection()).thenReturn(listing(null,
                release(1L, "Pink Floyd", "The Wall"), release(1L, "Pink Floyd", "The Wall")));

        SyncOutcome outcome = service.sync(true);

        assertEquals(1L, outcome.getRecordCount());
        assertEquals(1L, outcome.getDetails().get("duplicates").longValue());
        assertEquals(1, collectionRows.size());
        verify(fetchService, times(1)).fetchTracklist(1L);
    }

    @Test
    void shouldPruneReleasesNoLongerListed() {
        when(fetchService.fetchCollection())
                .thenReturn(listing(null, release(1L, "A", "One"), release(2L, "B", "Two")))
                .thenReturn(listing(null, release(2L, "B", "Two")));

        service.sync(true);
        SyncOutcome second = service.sync(true);

        assertEquals(1, collectionRows.size());
        assertEquals(1L, second.getDetails().get("pruned").longValue());
    }

    @Test
    void shouldKeepExistingRowsWhenListingAborts() {
        when(fetchService.fetchCollection())
                .thenReturn(listing(null, release(1L, "A", "One"), release(2L, "B", "Two")))
                .thenReturn(listing(FetchError.status(503), release(2L, "B", "Two")));

        service.sync(true);
        SyncOutcome second = service.sync(true);

        assertEquals(SyncResultStatus.PARTIAL_SUCCESS, second.getStatus());
        assertEquals(2, collectionRows.size());
        verify(ledgerService).update(eq(SyncSourceId.DISCOGS_COLLECTION), eq(1L), anyString());
    }

    @Test
    void shouldFailWithoutTouchingRowsWhenNothingListed() {
        when(fetchService.fetchCollection()).thenReturn(listing(FetchError.status(401)));

        SyncOutcome outcome = service.sync(true);

        assertEquals(SyncResultStatus.FAILED, outcome.getStatus());
        verify(ledgerService).recordFailure(SyncSourceId.DISCOGS_COLLECTION, "HTTP 401");
        verify(ledgerService, never()).update(any(), anyLong(), anyString());
    }

    @Test
    void shouldKeepOldTracklistWhenDetailFails() {
        when(fetchService.fetchCollection()).thenAnswer(invocation -> listing(null, release(1L, "A", "One")));
        service.sync(true);

        when(fetchService.fetchTracklist(1L)).thenReturn(FetchResult.failure(FetchError.status(500)));
        SyncOutcome outcome = service.sync(true);

        assertEquals(SyncResultStatus.PARTIAL_SUCCESS, outcome.getStatus());
        assertEquals(2, countTracks());
        verify(ledgerService).update(eq(SyncSourceId.DISCOGS_COLLECTION), eq(1L), eq("partial: 1 detail requests failed"));
    }

    @Test
    void shouldSkipFreshSource() {
        when(ledgerService.shouldSkip(SyncSourceId.DISCOGS_COLLECTION, false)).thenReturn(true);

        SyncOutcome outcome = service.sync(false);

        assertEquals(SyncResultStatus.SKIPPED, outcome.getStatus());
        verify(fetchService, never()).fetchCollection();
    }

    private CatalogCollectionMapper inMemoryCollectionMapper() {
        CatalogCollectionMapper mapper = mock(CatalogCollectionMapper.class);
        when(mapper.upsert(any())).thenAnswer(invocation -> {
            CatalogCollectionEntity incoming = invocation.getArgument(0);
            CatalogCollectionEntity existing = rowByRelease(incoming.getReleaseId());
            if (existing == null) {
                incoming.setId(idSequence.incrementAndGet());
                collectionRows.put(incoming.getId(), incoming);
                return 1;
            }
            existing.setArtist(incoming.getArtist());
            existing.setAlbumTitle(incoming.getAlbumTitle());
            existing.setMatchKey(incoming.getMatchKey());
            existing.setNumForSale(incoming.getNumForSale());
            existing.setLowestPrice(incoming.getLowestPrice());
            incoming.setId(existing.getId());
            return 2;
        });
        when(mapper.selectAllReleaseIds()).thenAnswer(invocation -> {
            List<Long> ids = new ArrayList<>();
            for (CatalogCollectionEntity row : collectionRows.values()) {
                ids.add(row.getReleaseId());
            }
            return ids;
        });
        when(mapper.deleteByReleaseIds(any())).thenAnswer(invocation -> {
            List<Long> releaseIds = invocation.getArgument(0);
            int deleted = 0;
            for (Long releaseId : releaseIds) {
                CatalogCollectionEntity row = rowByRelease(releaseId);
                if (row != null) {
                    collectionRows.remove(row.getId());
                    trackRows.remove(row.getId());
                    deleted++;
                }
            }
            return deleted;
        });
        return mapper;
    }

    private CatalogTrackMapper inMemoryTrackMapper() {
        CatalogTrackMapper mapper = mock(CatalogTrackMapper.class);
        when(mapper.deleteByCollectionId(anyLong())).thenAnswer(invocation -> {
            List<CatalogTrackEntity> removed = trackRows.remove(invocation.<Long>getArgument(0));
            return removed == null ? 0 : removed.size();
        });
        doAnswer(invocation -> {
            List<CatalogTrackEntity> batch = invocation.getArgument(0);
            for (CatalogTrackEntity track : batch) {
                trackRows.computeIfAbsent(track.getCollectionId(), key -> new ArrayList<>()).add(track);
            }
            return batch.size();
        }).when(mapper).batchInsert(any());
        return mapper;
    }

    private TableCountMapper inMemoryCountMapper() {
        TableCountMapper mapper = mock(TableCountMapper.class);
        when(mapper.count(StoreTable.DISCOGS_COLLECTION)).thenAnswer(invocation -> (long) collectionRows.size());
        when(mapper.count(StoreTable.DISCOGS_TRACKS)).thenAnswer(invocation -> (long) countTracks());
        return mapper;
    }

    private CatalogCollectionEntity rowByRelease(Long releaseId) {
        for (CatalogCollectionEntity row : collectionRows.values()) {
            if (row.getReleaseId().equals(releaseId)) {
                return row;
            }
        }
        return null;
    }

    private Map<Long, Long> releaseToId() {
        Map<Long, Long> ids = new LinkedHashMap<>();
        for (CatalogCollectionEntity row : collectionRows.values()) {
            ids.put(row.getReleaseId(), row.getId());
        }
        return ids;
    }

    private int countTracks() {
        int count = 0;
        for (List<CatalogTrackEntity> tracks : trackRows.values()) {
            count += tracks.size();
        }
        return count;
    }

    private CatalogPageResult listing(FetchError abortError, CatalogRelease... releases) {
        CatalogPageResult result = new CatalogPageResult();
        result.getItems().addAll(Arrays.asList(releases));
        result.setPagesFetched(1);
        result.setTotalPages(abortError == null ? 1 : 2);
        result.setAbortError(abortError);
        return result;
    }

    private CatalogRelease release(Long releaseId, String artist, String title) {
        CatalogRelease release = new CatalogRelease();
        release.setReleaseId(releaseId);
        release.setArtist(artist);
        release.setTitle(title);
        release.setFormat("Vinyl");
        return release;
    }
}
