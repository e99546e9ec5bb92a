package com.example.musiccollection.application.service;

import com.example.musiccollection.common.config.AppSyncProperties;
import com.example.musiccollection.domain.MatchKeys;
import com.example.musiccollection.domain.model.CatalogRelease;
import com.example.musiccollection.domain.model.CatalogTrack;
import com.example.musiccollection.domain.model.LibraryBrowseItem;
import com.example.musiccollection.domain.model.MarketplaceStats;
import com.example.musiccollection.domain.model.TaggedAlbum;
import com.example.musiccollection.domain.model.UpsertResult;
import com.example.musiccollection.infrastructure.persistence.entity.CatalogCollectionEntity;
import com.example.musiccollection.infrastructure.persistence.entity.CatalogTrackEntity;
import com.example.musiccollection.infrastructure.persistence.entity.LibraryAlbumEntity;
import com.example.musiccollection.infrastructure.persistence.entity.LibraryTrackEntity;
import com.example.musiccollection.infrastructure.persistence.entity.PlayHistoryEntity;
import com.example.musiccollection.infrastructure.persistence.entity.WantlistEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogTrackMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryAlbumMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryTrackMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.PlayHistoryMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.TableCountMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.WantlistMapper;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import com.example.musiccollection.infrastructure.persistence.model.TagCountRow;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * All writes into the collection tables. Album, track, play-history and want-list tables follow a
 * replace policy (clear, then reload in flushed batches); catalog collection rows are upserted by
 * release id so user-maintained columns survive.
 */
@Service
public class CollectionStoreService {

    private static final Logger log = LoggerFactory.getLogger(CollectionStoreService.class);

    static final String MARKETPLACE_URL_PREFIX = "https://www.discogs.com/sell/release/";

    private final LibraryAlbumMapper libraryAlbumMapper;
    private final LibraryTrackMapper libraryTrackMapper;
    private final PlayHistoryMapper playHistoryMapper;
    private final CatalogCollectionMapper catalogCollectionMapper;
    private final CatalogTrackMapper catalogTrackMapper;
    private final WantlistMapper wantlistMapper;
    private final TableCountMapper tableCountMapper;
    private final AppSyncProperties appSyncProperties;

    public CollectionStoreService(LibraryAlbumMapper libraryAlbumMapper,
                                  LibraryTrackMapper libraryTrackMapper,
                                  PlayHistoryMapper playHistoryMapper,
                                  CatalogCollectionMapper catalogCollectionMapper,
                                  CatalogTrackMapper catalogTrackMapper,
                                  WantlistMapper wantlistMapper,
                                  TableCountMapper tableCountMapper,
                                  AppSyncProperties appSyncProperties) {
        this.libraryAlbumMapper = libraryAlbumMapper;
        this.libraryTrackMapper = libraryTrackMapper;
        this.playHistoryMapper = playHistoryMapper;
        this.catalogCollectionMapper = catalogCollectionMapper;
        this.catalogTrackMapper = catalogTrackMapper;
        this.wantlistMapper = wantlistMapper;
        this.tableCountMapper = tableCountMapper;
        this.appSyncProperties = appSyncProperties;
    }

    public long count(StoreTable table) {
        return tableCountMapper.count(table);
    }

    // ---- library albums ----

    public long replaceLibraryAlbums(List<LibraryBrowseItem> albums) {
        int deleted = libraryAlbumMapper.deleteAll();
        log.info("STORE_LIBRARY_ALBUMS_CLEARED deleted={} incoming={}", deleted, albums.size());
        BatchBuffer<LibraryAlbumEntity> buffer = new BatchBuffer<>(appSyncProperties.getBatchSize(),
                libraryAlbumMapper::batchInsert);
        for (LibraryBrowseItem album : albums) {
            buffer.add(toLibraryAlbum(album));
        }
        buffer.flush();
        return buffer.getWritten();
    }

    public long flagPhysicalDuplicates(List<TaggedAlbum> taggedAlbums) {
        libraryAlbumMapper.resetPhysicalFlags();
        long matched = 0;
        for (TaggedAlbum album : taggedAlbums) {
            matched += libraryAlbumMapper.flagPhysicalDupe(album.getAlbumTitle(), album.getTagName());
        }
        for (TagCountRow row : libraryAlbumMapper.countPhysicalByTag()) {
            log.info("STORE_PHYSICAL_TAG tag={} albums={}", row.getPhysicalTag(), row.getAlbumCount());
        }
        return matched;
    }

    // ---- catalog collection ----

    /**
     * Upserts one collection item keyed by release id. A release id already in
     * {@code seenReleaseIds} is reported as a duplicate and still written.
     */
    public UpsertResult upsertCollectionItem(CatalogRelease release,
                                             Optional<MarketplaceStats> stats,
                                             Set<Long> seenReleaseIds) {
        boolean duplicate = !seenReleaseIds.add(release.getReleaseId());
        if (duplicate) {
            log.warn("STORE_DUPLICATE_RELEASE releaseId={} artist={} title={}",
                    release.getReleaseId(), release.getArtist(), release.getTitle());
        }
        CatalogCollectionEntity entity = toCollectionEntity(release, stats);
        int affected = catalogCollectionMapper.upsert(entity);
        return new UpsertResult(entity.getId(), affected == 1, duplicate);
    }

    /**
     * Replaces the tracklist of one collection row.
     */
    public long replaceCatalogTracks(Long collectionId, Long releaseId, List<CatalogTrack> tracks) {
        catalogTrackMapper.deleteByCollectionId(collectionId);
        BatchBuffer<CatalogTrackEntity> buffer = new BatchBuffer<>(appSyncProperties.getBatchSize(),
                catalogTrackMapper::batchInsert);
        for (CatalogTrack track : tracks) {
            CatalogTrackEntity entity = new CatalogTrackEntity();
            entity.setCollectionId(collectionId);
            entity.setReleaseId(releaseId);
            entity.setPosition(MatchKeys.truncate(nullToEmpty(track.getPosition()), 20));
            entity.setTrackTitle(MatchKeys.truncate(nullToEmpty(track.getTitle()), 500));
            entity.setDuration(MatchKeys.truncate(nullToEmpty(track.getDuration()), 20));
            entity.setTrackArtists(MatchKeys.truncate(track.getArtists(), 500));
            entity.setExtraArtists(MatchKeys.truncate(track.getExtraArtists(), 500));
            buffer.add(entity);
        }
        buffer.flush();
        return buffer.getWritten();
    }

    /**
     * Deletes collection rows whose release id is not in {@code keepReleaseIds}. Their tracks go
     * with them through the foreign key.
     */
    public long pruneCollection(Collection<Long> keepReleaseIds) {
        Set<Long> keep = new HashSet<>(keepReleaseIds);
        List<Long> stale = new ArrayList<>();
        for (Long releaseId : catalogCollectionMapper.selectAllReleaseIds()) {
            if (!keep.contains(releaseId)) {
                stale.add(releaseId);
            }
        }
        long deleted = 0;
        int batchSize = Math.max(1, appSyncProperties.getBatchSize());
        for (int from = 0; from < stale.size(); from += batchSize) {
            deleted += catalogCollectionMapper.deleteByReleaseIds(
                    stale.subList(from, Math.min(stale.size(), from + batchSize)));
        }
        if (deleted > 0) {
            log.info("STORE_COLLECTION_PRUNED deleted={}", deleted);
        }
        return deleted;
    }

    // ---- want-list ----

    public long replaceWantlist(List<CatalogRelease> releases, List<Optional<MarketplaceStats>> stats) {
        wantlistMapper.truncate();
        BatchBuffer<WantlistEntity> buffer = new BatchBuffer<>(appSyncProperties.getBatchSize(),
                wantlistMapper::batchInsert);
        for (int i = 0; i < releases.size(); i++) {
            buffer.add(toWantlistEntity(releases.get(i), stats.get(i)));
        }
        buffer.flush();
        return buffer.getWritten();
    }

    // ---- file imports ----

    public void clearLibraryTracks() {
        libraryTrackMapper.truncate();
    }

    public BatchBuffer<LibraryTrackEntity> libraryTrackWriter() {
        return new BatchBuffer<>(appSyncProperties.getTrackBatchSize(), libraryTrackMapper::batchInsert);
    }

    public void clearPlayHistory() {
        playHistoryMapper.truncate();
    }

    public BatchBuffer<PlayHistoryEntity> playHistoryWriter() {
        return new BatchBuffer<>(appSyncProperties.getTrackBatchSize(), playHistoryMapper::batchInsert);
    }

    private LibraryAlbumEntity toLibraryAlbum(LibraryBrowseItem item) {
        String artist = item.getSubtitle() == null ? "Unknown" : item.getSubtitle();
        String title = item.getTitle() == null ? "Unknown" : item.getTitle();
        LibraryAlbumEntity entity = new LibraryAlbumEntity();
        entity.setAlbumTitle(MatchKeys.truncate(title, 500));
        entity.setArtist(MatchKeys.truncate(artist, 300));
        entity.setImageKey(MatchKeys.truncate(item.getImageKey(), 100));
        entity.setItemKey(MatchKeys.truncate(item.getItemKey(), 50));
        entity.setArtistNorm(MatchKeys.truncate(MatchKeys.normalize(artist), 300));
        entity.setAlbumNorm(MatchKeys.truncate(MatchKeys.normalize(title), 500));
        entity.setMatchKey(MatchKeys.matchKey(artist, title));
        return entity;
    }

    private CatalogCollectionEntity toCollectionEntity(CatalogRelease release, Optional<MarketplaceStats> stats) {
        CatalogCollectionEntity entity = new CatalogCollectionEntity();
        entity.setReleaseId(release.getReleaseId());
        entity.setInstanceId(release.getInstanceId());
        entity.setArtist(MatchKeys.truncate(release.getArtist(), 300));
        entity.setAlbumTitle(MatchKeys.truncate(release.getTitle(), 500));
        entity.setLabel(MatchKeys.truncate(release.getLabel(), 300));
        entity.setFormat(MatchKeys.truncate(release.getFormat(), 100));
        entity.setYear(release.getYear());
        entity.setDateAdded(release.getDateAdded());
        entity.setRating(release.getRating());
        entity.setFolderId(release.getFolderId());
        entity.setArtistNorm(MatchKeys.truncate(MatchKeys.normalize(release.getArtist()), 300));
        entity.setAlbumNorm(MatchKeys.truncate(MatchKeys.normalize(release.getTitle()), 500));
        entity.setMatchKey(MatchKeys.matchKey(release.getArtist(), release.getTitle()));
        stats.ifPresent(value -> {
            entity.setNumForSale(value.getNumForSale());
            entity.setLowestPrice(value.getLowestPrice());
        });
        entity.setThumbUrl(MatchKeys.truncate(release.getThumbUrl(), 500));
        entity.setCoverImageUrl(MatchKeys.truncate(release.getCoverImageUrl(), 500));
        entity.setMediaCondition(MatchKeys.truncate(release.getMediaCondition(), 100));
        entity.setSleeveCondition(MatchKeys.truncate(release.getSleeveCondition(), 100));
        return entity;
    }

    private WantlistEntity toWantlistEntity(CatalogRelease release, Optional<MarketplaceStats> stats) {
        int numForSale = stats.map(MarketplaceStats::getNumForSale).orElse(0);
        WantlistEntity entity = new WantlistEntity();
        entity.setReleaseId(release.getReleaseId());
        entity.setArtist(MatchKeys.truncate(release.getArtist(), 300));
        entity.setAlbumTitle(MatchKeys.truncate(release.getTitle(), 500));
        entity.setLabel(MatchKeys.truncate(release.getLabel(), 300));
        entity.setFormat(MatchKeys.truncate(release.getFormat(), 100));
        entity.setYear(release.getYear());
        entity.setDateAdded(release.getDateAdded());
        entity.setNotes(release.getNotes());
        entity.setNumForSale(numForSale);
        entity.setLowestPrice(stats.map(MarketplaceStats::getLowestPrice).orElse(null));
        entity.setAvailable(numForSale > 0);
        entity.setMarketplaceUrl(MARKETPLACE_URL_PREFIX + release.getReleaseId());
        entity.setThumbUrl(MatchKeys.truncate(release.getThumbUrl(), 500));
        entity.setCoverImageUrl(MatchKeys.truncate(release.getCoverImageUrl(), 500));
        return entity;
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
