package com.example.musiccollection.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncSourceStatusResponse {

    private String sourceName;
    private String sourceType;
    private String filePath;
    private LocalDateTime lastSync;
    private Integer recordsCount;
    private String syncStatus;
}
