package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.entity.SyncLedgerEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SyncLedgerMapper {

    @Select("SELECT id, source_name, source_type, file_path, last_sync, records_count, sync_status, updated_at "
            + "FROM keep_track WHERE source_name = #{sourceName}")
    SyncLedgerEntity selectBySourceName(@Param("sourceName") String sourceName);

    @Select("SELECT id, source_name, source_type, file_path, last_sync, records_count, sync_status, updated_at "
            + "FROM keep_track ORDER BY source_name")
    List<SyncLedgerEntity> selectAll();

    @Insert("INSERT IGNORE INTO keep_track(source_name, source_type, file_path) "
            + "VALUES(#{sourceName}, #{sourceType}, #{filePath})")
    int ensureSource(@Param("sourceName") String sourceName,
                     @Param("sourceType") String sourceType,
                     @Param("filePath") String filePath);

    @Update("UPDATE keep_track SET last_sync = #{lastSync}, records_count = #{recordsCount}, sync_status = #{syncStatus}, "
            + "updated_at = NOW() WHERE source_name = #{sourceName}")
    int updateSync(@Param("sourceName") String sourceName,
                   @Param("lastSync") LocalDateTime lastSync,
                   @Param("recordsCount") long recordsCount,
                   @Param("syncStatus") String syncStatus);

    @Update("UPDATE keep_track SET file_path = #{filePath}, updated_at = NOW() WHERE source_name = #{sourceName}")
    int updateFilePath(@Param("sourceName") String sourceName, @Param("filePath") String filePath);
}
