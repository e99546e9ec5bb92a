package com.example.musiccollection.api.request;

import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class NunFlagRequest {

    @NotNull(message = "nun is required")
    private Boolean nun;
}
