package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.entity.SyncHistoryEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface SyncHistoryMapper {

    @Insert("INSERT INTO sync_history(sync_date, roon_albums, roon_tracks, roon_play_history, discogs_collection, "
            + "discogs_tracks, discogs_wantlist, track_index_total, track_index_distinct, listening_history) "
            + "VALUES(#{syncDate}, #{roonAlbums}, #{roonTracks}, #{roonPlayHistory}, #{discogsCollection}, "
            + "#{discogsTracks}, #{discogsWantlist}, #{trackIndexTotal}, #{trackIndexDistinct}, #{listeningHistory})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(SyncHistoryEntity entity);

    @Select("SELECT id, sync_date, roon_albums, roon_tracks, roon_play_history, discogs_collection, discogs_tracks, "
            + "discogs_wantlist, track_index_total, track_index_distinct, listening_history "
            + "FROM sync_history ORDER BY sync_date DESC, id DESC LIMIT #{limit}")
    List<SyncHistoryEntity> selectRecent(@Param("limit") int limit);
}
