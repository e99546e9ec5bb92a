package com.example.musiccollection.infrastructure.fileimport;

import lombok.Data;

@Data
public class ImportStats {

    private long recordsRead;

    /**
     * Malformed rows or records with an unparseable date.
     */
    private long recordsSkipped;
}
