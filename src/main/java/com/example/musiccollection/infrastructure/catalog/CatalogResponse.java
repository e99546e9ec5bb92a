package com.example.musiccollection.infrastructure.catalog;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CatalogResponse {

    private int statusCode;

    private String body;

    public boolean isOk() {
        return statusCode == 200;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
