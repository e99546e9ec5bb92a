package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.entity.PlayHistoryEntity;
import com.example.musiccollection.infrastructure.persistence.model.AlbumPlayCountRow;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface PlayHistoryMapper {

    @Update("TRUNCATE TABLE roon_play_history")
    void truncate();

    @Insert("<script>"
            + "INSERT INTO roon_play_history(album_artist, album, disc_number, track_number, track_title, "
            + "track_artists, composers, external_id, source, played_at) VALUES "
            + "<foreach item='p' collection='list' separator=','>"
            + "(#{p.albumArtist}, #{p.album}, #{p.discNumber}, #{p.trackNumber}, #{p.trackTitle}, "
            + "#{p.trackArtists}, #{p.composers}, #{p.externalId}, #{p.source}, #{p.playedAt})"
            + "</foreach>"
            + "</script>")
    int batchInsert(@Param("list") List<PlayHistoryEntity> list);

    @Select("SELECT id, album_artist, album, track_title, played_at FROM roon_play_history WHERE id = #{id}")
    PlayHistoryEntity selectById(@Param("id") Long id);

    @Update("UPDATE roon_play_history SET played_at = #{playedAt} WHERE id = #{id}")
    int updatePlayedAt(@Param("id") Long id, @Param("playedAt") LocalDateTime playedAt);

    @Select("SELECT album_artist AS artist, album, COUNT(*) AS play_count FROM roon_play_history "
            + "GROUP BY album_artist, album ORDER BY play_count DESC LIMIT #{limit}")
    List<AlbumPlayCountRow> selectTopAlbums(@Param("limit") int limit);

    @Select("<script>"
            + "SELECT id, album_artist, album, disc_number, track_number, track_title, track_artists, source, played_at "
            + "FROM roon_play_history WHERE 1 = 1 "
            + "<if test='keyword != null'>"
            + " AND (track_title LIKE CONCAT('%', #{keyword}, '%') OR album LIKE CONCAT('%', #{keyword}, '%') "
            + "OR album_artist LIKE CONCAT('%', #{keyword}, '%'))"
            + "</if>"
            + " ORDER BY played_at IS NULL, played_at DESC, id DESC LIMIT #{offset}, #{pageSize}"
            + "</script>")
    List<PlayHistoryEntity> selectPage(@Param("offset") int offset,
                                       @Param("pageSize") int pageSize,
                                       @Param("keyword") String keyword);

    @Select("<script>"
            + "SELECT COUNT(1) FROM roon_play_history WHERE 1 = 1 "
            + "<if test='keyword != null'>"
            + " AND (track_title LIKE CONCAT('%', #{keyword}, '%') OR album LIKE CONCAT('%', #{keyword}, '%') "
            + "OR album_artist LIKE CONCAT('%', #{keyword}, '%'))"
            + "</if>"
            + "</script>")
    long count(@Param("keyword") String keyword);
}
