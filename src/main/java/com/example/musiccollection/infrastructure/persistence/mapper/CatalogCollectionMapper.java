package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.entity.CatalogCollectionEntity;
import com.example.musiccollection.infrastructure.persistence.model.OverlapAlbumRow;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface CatalogCollectionMapper {

    /**
     * Keyed by release_id. On conflict only the marketplace figures and display text move; user
     * columns (last_listened, is_nun, notes) are never written here. {@code id = LAST_INSERT_ID(id)}
     * makes the generated key available for updates too. Returns 1 for an insert, 2 for a changed
     * row and 0 for an unchanged one.
     */
    @Insert("INSERT INTO discogs_collection("
            + "release_id, instance_id, artist, album_title, label, format, `year`, date_added, rating, folder_id, "
            + "artist_norm, album_norm, match_key, num_for_sale, lowest_price, thumb_url, cover_image_url, "
            + "media_condition, sleeve_condition"
            + ") VALUES ("
            + "#{releaseId}, #{instanceId}, #{artist}, #{albumTitle}, #{label}, #{format}, #{year}, #{dateAdded}, #{rating}, #{folderId}, "
            + "#{artistNorm}, #{albumNorm}, #{matchKey}, #{numForSale}, #{lowestPrice}, #{thumbUrl}, #{coverImageUrl}, "
            + "#{mediaCondition}, #{sleeveCondition}"
            + ") ON DUPLICATE KEY UPDATE "
            + "id = LAST_INSERT_ID(id), "
            + "artist = VALUES(artist), "
            + "album_title = VALUES(album_title), "
            + "artist_norm = VALUES(artist_norm), "
            + "album_norm = VALUES(album_norm), "
            + "match_key = VALUES(match_key), "
            + "num_for_sale = VALUES(num_for_sale), "
            + "lowest_price = VALUES(lowest_price), "
            + "updated_at = NOW()")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int upsert(CatalogCollectionEntity entity);

    @Select("SELECT release_id FROM discogs_collection")
    List<Long> selectAllReleaseIds();

    @Delete("<script>"
            + "DELETE FROM discogs_collection WHERE release_id IN "
            + "<foreach item='rid' collection='releaseIds' open='(' separator=',' close=')'>#{rid}</foreach>"
            + "</script>")
    int deleteByReleaseIds(@Param("releaseIds") List<Long> releaseIds);

    @Select("SELECT id, release_id, instance_id, artist, album_title, label, format, `year`, date_added, rating, "
            + "folder_id, match_key, num_for_sale, lowest_price, thumb_url, cover_image_url, media_condition, "
            + "sleeve_condition, last_listened, is_nun, notes, created_at, updated_at "
            + "FROM discogs_collection WHERE id = #{id}")
    CatalogCollectionEntity selectById(@Param("id") Long id);

    @Select("<script>"
            + "SELECT id, release_id, instance_id, artist, album_title, label, format, `year`, date_added, rating, "
            + "match_key, num_for_sale, lowest_price, thumb_url, cover_image_url, media_condition, sleeve_condition, "
            + "last_listened, is_nun, notes "
            + "FROM discogs_collection WHERE 1 = 1 "
            + "<if test='keyword != null and keyword != \"\"'>"
            + " AND (artist LIKE CONCAT('%', #{keyword}, '%') OR album_title LIKE CONCAT('%', #{keyword}, '%'))"
            + "</if>"
            + " ORDER BY artist, album_title LIMIT #{offset}, #{pageSize}"
            + "</script>")
    List<CatalogCollectionEntity> selectPage(@Param("offset") int offset,
                                             @Param("pageSize") int pageSize,
                                             @Param("keyword") String keyword);

    @Select("<script>"
            + "SELECT COUNT(1) FROM discogs_collection WHERE 1 = 1 "
            + "<if test='keyword != null and keyword != \"\"'>"
            + " AND (artist LIKE CONCAT('%', #{keyword}, '%') OR album_title LIKE CONCAT('%', #{keyword}, '%'))"
            + "</if>"
            + "</script>")
    long count(@Param("keyword") String keyword);

    @Update("UPDATE discogs_collection SET last_listened = #{lastListened} WHERE id = #{id}")
    int updateLastListened(@Param("id") Long id, @Param("lastListened") LocalDateTime lastListened);

    @Update("UPDATE discogs_collection SET is_nun = #{isNun} WHERE id = #{id}")
    int updateNunFlag(@Param("id") Long id, @Param("isNun") boolean isNun);

    @Update("UPDATE discogs_collection SET notes = #{notes} WHERE id = #{id}")
    int updateNotes(@Param("id") Long id, @Param("notes") String notes);

    @Select("SELECT dc.match_key, dc.id AS catalog_id, MIN(ra.id) AS library_album_id, dc.artist, dc.album_title, "
            + "dc.format, dc.`year` "
            + "FROM discogs_collection dc INNER JOIN roon_albums ra ON ra.match_key = dc.match_key "
            + "GROUP BY dc.id, dc.match_key, dc.artist, dc.album_title, dc.format, dc.`year` "
            + "ORDER BY dc.artist, dc.album_title LIMIT #{offset}, #{pageSize}")
    List<OverlapAlbumRow> selectOverlapPage(@Param("offset") int offset, @Param("pageSize") int pageSize);

    /**
     * Albums present in both collections, counted once per match key.
     */
    @Select("SELECT COUNT(DISTINCT dc.match_key) FROM discogs_collection dc "
            + "INNER JOIN roon_albums ra ON ra.match_key = dc.match_key")
    long countOverlap();

    /**
     * Catalog items whose library counterpart is already flagged as a physical copy.
     */
    @Select("SELECT COUNT(DISTINCT dc.id) FROM discogs_collection dc "
            + "INNER JOIN roon_albums ra ON ra.match_key = dc.match_key AND ra.is_physical_dupe = TRUE")
    long countOwnedPhysicalDuplicates();

    @Select("SELECT COUNT(1) FROM discogs_collection WHERE is_nun = TRUE")
    long countNunFlagged();
}
