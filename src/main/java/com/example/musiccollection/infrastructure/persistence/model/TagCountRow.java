package com.example.musiccollection.infrastructure.persistence.model;

import lombok.Data;

@Data
public class TagCountRow {

    private String physicalTag;

    private long albumCount;
}
