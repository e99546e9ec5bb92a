package com.example.musiccollection.application.service;

import com.example.musiccollection.infrastructure.persistence.mapper.SchemaMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Adds the physical-copy flag columns to databases created before they existed.
 */
@Service
public class SchemaGuardService {

    private static final Logger log = LoggerFactory.getLogger(SchemaGuardService.class);

    private static final String ALBUM_TABLE = "roon_albums";

    private final SchemaMapper schemaMapper;

    public SchemaGuardService(SchemaMapper schemaMapper) {
        this.schemaMapper = schemaMapper;
    }

    public void ensurePhysicalFlagColumns() {
        if (schemaMapper.countColumn(ALBUM_TABLE, "is_physical_dupe") == 0) {
            schemaMapper.addPhysicalDupeColumn();
            log.info("SCHEMA_COLUMN_ADDED table={} column=is_physical_dupe", ALBUM_TABLE);
        }
        if (schemaMapper.countColumn(ALBUM_TABLE, "physical_tag") == 0) {
            schemaMapper.addPhysicalTagColumn();
            log.info("SCHEMA_COLUMN_ADDED table={} column=physical_tag", ALBUM_TABLE);
        }
    }
}
