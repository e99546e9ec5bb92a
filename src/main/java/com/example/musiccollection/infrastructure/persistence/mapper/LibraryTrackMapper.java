package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.entity.LibraryTrackEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface LibraryTrackMapper {

    @Update("TRUNCATE TABLE roon_tracks")
    void truncate();

    @Insert("<script>"
            + "INSERT INTO roon_tracks(album_artist, album, disc_number, track_number, track_title, "
            + "track_artists, composers, external_id, source, is_duplicate, is_hidden, tags) VALUES "
            + "<foreach item='t' collection='list' separator=','>"
            + "(#{t.albumArtist}, #{t.album}, #{t.discNumber}, #{t.trackNumber}, #{t.trackTitle}, "
            + "#{t.trackArtists}, #{t.composers}, #{t.externalId}, #{t.source}, #{t.isDuplicate}, #{t.isHidden}, #{t.tags})"
            + "</foreach>"
            + "</script>")
    int batchInsert(@Param("list") List<LibraryTrackEntity> list);

    @Select("SELECT id, album_artist, album, disc_number, track_number, track_title, track_artists, composers, "
            + "external_id, source, is_duplicate, is_hidden, tags "
            + "FROM roon_tracks WHERE album = #{album} "
            + "AND (#{albumArtist} IS NULL OR album_artist = #{albumArtist}) "
            + "ORDER BY disc_number, track_number")
    List<LibraryTrackEntity> selectByAlbum(@Param("album") String album, @Param("albumArtist") String albumArtist);
}
