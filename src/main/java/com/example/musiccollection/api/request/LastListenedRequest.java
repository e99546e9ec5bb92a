package com.example.musiccollection.api.request;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class LastListenedRequest {

    /**
     * Defaults to now when omitted.
     */
    private LocalDateTime listenedAt;
}
