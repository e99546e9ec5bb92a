package com.example.musiccollection.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SyncLedgerEntity {

    private Long id;

    private String sourceName;

    private String sourceType;

    private String filePath;

    private LocalDateTime lastSync;

    private Integer recordsCount;

    private String syncStatus;

    private LocalDateTime updatedAt;
}
