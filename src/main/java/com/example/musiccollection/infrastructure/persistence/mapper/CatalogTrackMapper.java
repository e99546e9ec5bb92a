package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.entity.CatalogTrackEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface CatalogTrackMapper {

    @Delete("DELETE FROM discogs_tracks WHERE collection_id = #{collectionId}")
    int deleteByCollectionId(@Param("collectionId") Long collectionId);

    @Insert("<script>"
            + "INSERT INTO discogs_tracks(collection_id, release_id, position, track_title, duration, track_artists, extra_artists) VALUES "
            + "<foreach item='t' collection='list' separator=','>"
            + "(#{t.collectionId}, #{t.releaseId}, #{t.position}, #{t.trackTitle}, #{t.duration}, #{t.trackArtists}, #{t.extraArtists})"
            + "</foreach>"
            + "</script>")
    int batchInsert(@Param("list") List<CatalogTrackEntity> list);

    @Select("SELECT id, collection_id, release_id, position, track_title, duration, track_artists, extra_artists "
            + "FROM discogs_tracks WHERE collection_id = #{collectionId} ORDER BY id")
    List<CatalogTrackEntity> selectByCollectionId(@Param("collectionId") Long collectionId);
}
