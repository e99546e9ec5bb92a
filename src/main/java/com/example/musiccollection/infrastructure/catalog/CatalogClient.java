package com.example.musiccollection.infrastructure.catalog;

import java.io.IOException;

/**
 * Raw GET access to the catalog REST API. Status handling and pacing belong to the caller.
 */
public interface CatalogClient {

    /**
     * @param pathAndQuery path relative to the API base, starting with "/"
     */
    CatalogResponse get(String pathAndQuery) throws IOException;
}
