package com.example.musiccollection.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Handle of an open browse session on the library core. Browse position is server-side state
 * keyed by {@code sessionKey}, so a session must not be shared by concurrent callers.
 */
@Data
@AllArgsConstructor
public class LibrarySession {

    private String sessionKey;

    private String coreName;

    private LocalDateTime openedAt;
}
