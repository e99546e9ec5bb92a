package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.model.TrackIndexRow;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface TrackIndexMapper {

    @Update("TRUNCATE TABLE track_index")
    void truncate();

    @Insert("INSERT INTO track_index(track_title, album, artist, source) "
            + "SELECT track_title, album, album_artist, 'roon' FROM roon_tracks "
            + "WHERE track_title IS NOT NULL AND track_title <> ''")
    int insertFromLibraryTracks();

    @Insert("INSERT INTO track_index(track_title, album, artist, source) "
            + "SELECT dt.track_title, dc.album_title, dc.artist, 'discogs' FROM discogs_tracks dt "
            + "INNER JOIN discogs_collection dc ON dt.collection_id = dc.id "
            + "WHERE dt.track_title IS NOT NULL AND dt.track_title <> ''")
    int insertFromCatalogTracks();

    @Select("SELECT COUNT(1) FROM track_index")
    long countAll();

    @Select("SELECT COUNT(DISTINCT LOWER(track_title)) FROM track_index")
    long countDistinctTitles();

    @Select("<script>"
            + "SELECT id, track_title, album, artist, source FROM track_index WHERE 1 = 1 "
            + "<if test='source != null'> AND source = #{source}</if>"
            + "<if test='keyword != null'>"
            + " AND (track_title LIKE CONCAT('%', #{keyword}, '%') OR album LIKE CONCAT('%', #{keyword}, '%') "
            + "OR artist LIKE CONCAT('%', #{keyword}, '%'))"
            + "</if>"
            + " ORDER BY track_title, artist, album, id LIMIT #{offset}, #{pageSize}"
            + "</script>")
    List<TrackIndexRow> selectPage(@Param("offset") int offset,
                                   @Param("pageSize") int pageSize,
                                   @Param("keyword") String keyword,
                                   @Param("source") String source);

    @Select("<script>"
            + "SELECT COUNT(1) FROM track_index WHERE 1 = 1 "
            + "<if test='source != null'> AND source = #{source}</if>"
            + "<if test='keyword != null'>"
            + " AND (track_title LIKE CONCAT('%', #{keyword}, '%') OR album LIKE CONCAT('%', #{keyword}, '%') "
            + "OR artist LIKE CONCAT('%', #{keyword}, '%'))"
            + "</if>"
            + "</script>")
    long count(@Param("keyword") String keyword, @Param("source") String source);
}
