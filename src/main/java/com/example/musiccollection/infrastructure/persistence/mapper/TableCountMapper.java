package com.example.musiccollection.infrastructure.persistence.mapper;

import com.example.musiccollection.infrastructure.persistence.model.StoreTable;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface TableCountMapper {

    @Select("SELECT COUNT(1) FROM ${table.tableName}")
    long count(@Param("table") StoreTable table);
}
