package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.entity.ListeningHistoryEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ListeningHistoryMapper {

    @Insert("INSERT INTO listening_history(artist, album, source, listened_at, format, notes, discogs_collection_id, roon_album_id) "
            + "VALUES(#{artist}, #{album}, #{source}, #{listenedAt}, #{format}, #{notes}, #{discogsCollectionId}, #{roonAlbumId})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(ListeningHistoryEntity entity);

    @Select("SELECT id, artist, album, source, listened_at, format, notes, discogs_collection_id, roon_album_id, created_at "
            + "FROM listening_history ORDER BY listened_at DESC, id DESC LIMIT #{offset}, #{pageSize}")
    List<ListeningHistoryEntity> selectPage(@Param("offset") int offset, @Param("pageSize") int pageSize);

    @Select("SELECT COUNT(1) FROM listening_history")
    long count();
}
