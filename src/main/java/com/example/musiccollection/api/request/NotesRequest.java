package com.example.musiccollection.api.request;

import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class NotesRequest {

    @Size(max = 5000, message = "notes must be at most 5000 characters")
    private String notes;
}
