package com.example.musiccollection.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class UpsertResult {

    private Long id;

    private boolean inserted;

    /**
     * The natural key was already written earlier in this run.
     */
    private boolean duplicate;
}
