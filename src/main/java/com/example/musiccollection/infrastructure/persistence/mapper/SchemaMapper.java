package com.example.musiccollection.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SchemaMapper {

    @Select("SELECT COUNT(1) FROM information_schema.COLUMNS "
            + "WHERE TABLE_SCHEMA = DATABASE() AND TABLE_NAME = #{tableName} AND COLUMN_NAME = #{columnName}")
    int countColumn(@Param("tableName") String tableName, @Param("columnName") String columnName);

    @Update("ALTER TABLE roon_albums ADD COLUMN is_physical_dupe BOOLEAN DEFAULT FALSE")
    void addPhysicalDupeColumn();

    @Update("ALTER TABLE roon_albums ADD COLUMN physical_tag VARCHAR(50) DEFAULT NULL")
    void addPhysicalTagColumn();
}
