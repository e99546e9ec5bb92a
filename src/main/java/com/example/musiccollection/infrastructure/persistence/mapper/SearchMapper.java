package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.model.AlbumSearchRow;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * Album listing across both collections. Callers always include at least one side.
 */
@Mapper
public interface SearchMapper {

    String KEYWORD_FILTER = "<if test='keyword != null'>"
            + " AND (artist LIKE CONCAT('%', #{keyword}, '%') OR album_title LIKE CONCAT('%', #{keyword}, '%'))"
            + "</if>";

    String ALBUM_UNION = "<if test='includeCatalog'>"
            + "SELECT 'discogs' AS source, id, artist, album_title, label, format, year, thumb_url, "
            + "NULL AS image_key, last_listened, is_nun, FALSE AS is_physical_dupe, NULL AS physical_tag "
            + "FROM discogs_collection WHERE 1 = 1" + KEYWORD_FILTER
            + "</if>"
            + "<if test='includeCatalog and includeLibrary'> UNION ALL </if>"
            + "<if test='includeLibrary'>"
            + "SELECT 'roon' AS source, id, artist, album_title, NULL AS label, NULL AS format, NULL AS year, "
            + "NULL AS thumb_url, image_key, NULL AS last_listened, FALSE AS is_nun, is_physical_dupe, physical_tag "
            + "FROM roon_albums WHERE 1 = 1"
            + "<if test='hidePhysicalDupes'> AND is_physical_dupe = FALSE</if>"
            + KEYWORD_FILTER
            + "</if>";

    @Select("<script>"
            + "SELECT * FROM (" + ALBUM_UNION + ") albums "
            + "ORDER BY artist, album_title, source, id LIMIT #{offset}, #{pageSize}"
            + "</script>")
    List<AlbumSearchRow> selectAlbumPage(@Param("keyword") String keyword,
                                         @Param("includeLibrary") boolean includeLibrary,
                                         @Param("includeCatalog") boolean includeCatalog,
                                         @Param("hidePhysicalDupes") boolean hidePhysicalDupes,
                                         @Param("offset") int offset,
                                         @Param("pageSize") int pageSize);

    @Select("<script>"
            + "SELECT COUNT(1) FROM (" + ALBUM_UNION + ") albums"
            + "</script>")
    long countAlbums(@Param("keyword") String keyword,
                     @Param("includeLibrary") boolean includeLibrary,
                     @Param("includeCatalog") boolean includeCatalog,
                     @Param("hidePhysicalDupes") boolean hidePhysicalDupes);
}
