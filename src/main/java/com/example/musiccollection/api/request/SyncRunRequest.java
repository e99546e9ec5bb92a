package com.example.musiccollection.api.request;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class SyncRunRequest {

    /**
     * Source names as stored in the ledger ({@code roon_albums}, ...). Empty runs everything.
     */
    private List<String> sources = new ArrayList<>();

    private boolean force;
}
