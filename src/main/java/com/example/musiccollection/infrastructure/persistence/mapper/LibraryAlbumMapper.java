package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.entity.LibraryAlbumEntity;
import com.example.musiccollection.infrastructure.persistence.model.BootlegArtistRow;
import com.example.musiccollection.infrastructure.persistence.model.TagCountRow;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface LibraryAlbumMapper {

    /**
     * Live recordings filed by show date, for example "1974 06/26 Providence".
     */
    String BOOTLEG_TITLE = "album_title REGEXP '^[0-9]{4} [0-9]{2}/[0-9]{2}'";

    /**
     * DELETE rather than TRUNCATE: listening_history references this table and keeps its rows
     * with the link set to NULL.
     */
    @Delete("DELETE FROM roon_albums")
    int deleteAll();

    @Insert("<script>"
            + "INSERT INTO roon_albums(album_title, artist, image_key, item_key, artist_norm, album_norm, match_key) VALUES "
            + "<foreach item='a' collection='list' separator=','>"
            + "(#{a.albumTitle}, #{a.artist}, #{a.imageKey}, #{a.itemKey}, #{a.artistNorm}, #{a.albumNorm}, #{a.matchKey})"
            + "</foreach>"
            + " ON DUPLICATE KEY UPDATE "
            + "album_title = VALUES(album_title), "
            + "artist = VALUES(artist), "
            + "image_key = VALUES(image_key), "
            + "artist_norm = VALUES(artist_norm), "
            + "album_norm = VALUES(album_norm), "
            + "match_key = VALUES(match_key), "
            + "updated_at = NOW()"
            + "</script>")
    int batchInsert(@Param("list") List<LibraryAlbumEntity> list);

    @Update("UPDATE roon_albums SET is_physical_dupe = FALSE, physical_tag = NULL WHERE is_physical_dupe = TRUE OR physical_tag IS NOT NULL")
    int resetPhysicalFlags();

    @Update("UPDATE roon_albums SET is_physical_dupe = TRUE, physical_tag = #{tag} "
            + "WHERE LOWER(album_title) = LOWER(#{albumTitle})")
    int flagPhysicalDupe(@Param("albumTitle") String albumTitle, @Param("tag") String tag);

    @Select("SELECT physical_tag, COUNT(*) AS album_count FROM roon_albums "
            + "WHERE is_physical_dupe = TRUE GROUP BY physical_tag ORDER BY physical_tag")
    List<TagCountRow> countPhysicalByTag();

    @Select("<script>"
            + "SELECT id, album_title, artist, image_key, item_key, match_key, is_physical_dupe, physical_tag "
            + "FROM roon_albums WHERE 1 = 1 "
            + "<if test='!includePhysicalDupes'> AND is_physical_dupe = FALSE</if>"
            + "<if test='keyword != null and keyword != \"\"'>"
            + " AND (artist LIKE CONCAT('%', #{keyword}, '%') OR album_title LIKE CONCAT('%', #{keyword}, '%'))"
            + "</if>"
            + " ORDER BY artist, album_title LIMIT #{offset}, #{pageSize}"
            + "</script>")
    List<LibraryAlbumEntity> selectPage(@Param("offset") int offset,
                                        @Param("pageSize") int pageSize,
                                        @Param("keyword") String keyword,
                                        @Param("includePhysicalDupes") boolean includePhysicalDupes);

    @Select("<script>"
            + "SELECT COUNT(1) FROM roon_albums WHERE 1 = 1 "
            + "<if test='!includePhysicalDupes'> AND is_physical_dupe = FALSE</if>"
            + "<if test='keyword != null and keyword != \"\"'>"
            + " AND (artist LIKE CONCAT('%', #{keyword}, '%') OR album_title LIKE CONCAT('%', #{keyword}, '%'))"
            + "</if>"
            + "</script>")
    long count(@Param("keyword") String keyword, @Param("includePhysicalDupes") boolean includePhysicalDupes);

    @Select("<script>"
            + "SELECT id, album_title, artist, image_key FROM roon_albums WHERE " + BOOTLEG_TITLE
            + "<if test='artist != null'> AND artist LIKE CONCAT('%', #{artist}, '%')</if>"
            + " ORDER BY artist, album_title LIMIT #{offset}, #{pageSize}"
            + "</script>")
    List<LibraryAlbumEntity> selectBootlegPage(@Param("artist") String artist,
                                               @Param("offset") int offset,
                                               @Param("pageSize") int pageSize);

    @Select("<script>"
            + "SELECT COUNT(1) FROM roon_albums WHERE " + BOOTLEG_TITLE
            + "<if test='artist != null'> AND artist LIKE CONCAT('%', #{artist}, '%')</if>"
            + "</script>")
    long countBootlegs(@Param("artist") String artist);

    @Select("SELECT artist, COUNT(*) AS show_count FROM roon_albums WHERE " + BOOTLEG_TITLE
            + " GROUP BY artist ORDER BY show_count DESC, artist")
    List<BootlegArtistRow> countBootlegsByArtist();
}
