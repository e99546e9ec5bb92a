package com.example.musiccollection.api.request;

import java.time.LocalDateTime;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PlayedAtRequest {

    @NotNull(message = "playedAt is required")
    private LocalDateTime playedAt;
}
