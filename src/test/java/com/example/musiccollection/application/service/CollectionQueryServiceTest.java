package com.example.musiccollection.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccollection.api.response.BootlegAlbumResponse;
import com.example.musiccollection.api.response.BootlegArtistResponse;
import com.example.musiccollection.api.response.CatalogItemResponse;
import com.example.musiccollection.api.response.LibraryAlbumResponse;
import com.example.musiccollection.api.response.PageResponse;
import com.example.musiccollection.infrastructure.persistence.entity.CatalogCollectionEntity;
import com.example.musiccollection.infrastructure.persistence.entity.LibraryAlbumEntity;
import com.example.musiccollection.infrastructure.persistence.mapper.CatalogCollectionMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.LibraryAlbumMapper;
import com.example.musiccollection.infrastructure.persistence.mapper.WantlistMapper;
import com.example.musiccollection.infrastructure.persistence.model.BootlegArtistRow;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CollectionQueryServiceTest {

    private CatalogCollectionMapper catalogMapper;
    private LibraryAlbumMapper albumMapper;
    private CollectionQueryService service;

    @BeforeEach
    void setUp() {
        catalogMapper = mock(CatalogCollectionMapper.class);
        albumMapper = mock(LibraryAlbumMapper.class);
        service = new CollectionQueryService(catalogMapper, albumMapper, mock(WantlistMapper.class),
                mock(SyncLedgerService.class));
    }

    @Test
    void shouldClampPagingAndTrimKeyword() {
        CatalogCollectionEntity row = new CatalogCollectionEntity();
        row.setId(1L);
        row.setArtist("Pink Floyd");
        row.setAlbumTitle("The Wall");
        row.setIsNun(true);
        when(catalogMapper.selectPage(0, 200, "floyd")).thenReturn(Collections.singletonList(row));
        when(catalogMapper.count("floyd")).thenReturn(1L);

        PageResponse<CatalogItemResponse> page = service.listCatalog(0, 1000, "  floyd ");

        assertEquals(1, page.getPageNo());
        assertEquals(200, page.getPageSize());
        assertEquals(1L, page.getTotal());
        assertTrue(page.getRecords().get(0).isNun());
    }

    @Test
    void shouldPassPhysicalDupeFilterThrough() {
        LibraryAlbumEntity album = new LibraryAlbumEntity();
        album.setId(9L);
        album.setAlbumTitle("Kind of Blue");
        album.setIsPhysicalDupe(true);
        album.setPhysicalTag("mycds");
        when(albumMapper.selectPage(50, 50, null, false)).thenReturn(Collections.singletonList(album));

        PageResponse<LibraryAlbumResponse> page = service.listLibrary(2, 50, " ", false);

        verify(albumMapper).count(null, false);
        assertEquals("mycds", page.getRecords().get(0).getPhysicalTag());
        assertTrue(page.getRecords().get(0).isPhysicalDupe());
    }

    @Test
    void shouldListBootlegsWithShowDate() {
        LibraryAlbumEntity show = new LibraryAlbumEntity();
        show.setId(3L);
        show.setArtist("Grateful Dead");
        show.setAlbumTitle("1977 05/08 Barton Hall");
        when(albumMapper.selectBootlegPage("dead", 0, 50)).thenReturn(Collections.singletonList(show));
        when(albumMapper.countBootlegs("dead")).thenReturn(1L);

        PageResponse<BootlegAlbumResponse> page = service.listBootlegs(" dead ", 1, 50);

        assertEquals(1L, page.getTotal());
        assertEquals("1977 05/08", page.getRecords().get(0).getShowDate());
        assertEquals("Grateful Dead", page.getRecords().get(0).getArtist());
    }

    @Test
    void shouldListBootlegArtistsByShowCount() {
        BootlegArtistRow row = new BootlegArtistRow();
        row.setArtist("Phish");
        row.setShowCount(12L);
        when(albumMapper.countBootlegsByArtist()).thenReturn(Collections.singletonList(row));

        List<BootlegArtistResponse> artists = service.listBootlegArtists();

        assertEquals(1, artists.size());
        assertEquals("Phish", artists.get(0).getArtist());
        assertEquals(12L, artists.get(0).getShowCount());
    }
}
