package com.example.musiccollection.application.service;

import com.example.musiccollection.api.response.AlbumPlayCountResponse;
import com.example.musiccollection.api.response.StatsOverviewResponse;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryAlbumMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.PlayHistoryMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.WantlistMapper;
import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import com.example.musiccollection.infrastructure.persistence.model.TagCountRow;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

@Service
public class StatsService {

    private final CollectionStoreService collectionStoreService;
    private final CatalogCollectionMapper catalogCollectionMapper;
    private final LibraryAlbumMapper libraryAlbumMapper;
    private final WantlistMapper wantlistMapper;
    private final PlayHistoryMapper playHistoryMapper;

    public StatsService(CollectionStoreService collectionStoreService,
                        CatalogCollectionMapper catalogCollectionMapper,
                        LibraryAlbumMapper libraryAlbumMapper,
                        WantlistMapper wantlistMapper,
                        PlayHistoryMapper playHistoryMapper) {
        this.collectionStoreService = collectionStoreService;
        this.catalogCollectionMapper = catalogCollectionMapper;
        this.libraryAlbumMapper = libraryAlbumMapper;
        this.wantlistMapper = wantlistMapper;
        this.playHistoryMapper = playHistoryMapper;
    }

    public StatsOverviewResponse overview() {
        StatsOverviewResponse response = new StatsOverviewResponse();
        for (StoreTable table : StoreTable.values()) {
            response.getTableCounts().put(table.getTableName(), collectionStoreService.count(table));
        }
        response.setOverlapAlbums(catalogCollectionMapper.countOverlap());
        response.setOwnedPhysicalDuplicates(catalogCollectionMapper.countOwnedPhysicalDuplicates());
        for (TagCountRow row : libraryAlbumMapper.countPhysicalByTag()) {
            response.getPhysicalCopiesByTag().put(row.getPhysicalTag(), row.getAlbumCount());
        }
        response.setNunFlagged(catalogCollectionMapper.countNunFlagged());
        response.setWantlistLowestPriceTotal(wantlistMapper.sumLowestPrice());
        return response;
    }

    public List<AlbumPlayCountResponse> topPlayedAlbums(Integer limit) {
        int safeLimit = limit == null ? 20 : Math.max(1, Math.min(100, limit));
        return playHistoryMapper.selectTopAlbums(safeLimit).stream()
                .map(row -> new AlbumPlayCountResponse(row.getArtist(), row.getAlbum(), row.getPlayCount()))
                .collect(Collectors.toList());
    }
}
