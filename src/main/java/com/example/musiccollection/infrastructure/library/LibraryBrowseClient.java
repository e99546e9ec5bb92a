package com.example.musiccollection.infrastructure.library;

import com.example.musiccollection.domain.model.LibraryBrowseResult;
import com.example.musiccollection.domain.model.LibraryLoadPage;
import com.example.musiccollection.domain.model.LibrarySession;

/**
 * Browse protocol of the library core. Every call may throw
 * {@link com.example.musiccollection.common.exception.LibraryConnectionException}.
 */
public interface LibraryBrowseClient {

    LibrarySession openSession();

    /**
     * Moves the session's browse position. {@code itemKey} null with {@code popAll} true returns to
     * the root menu.
     */
    LibraryBrowseResult browse(LibrarySession session, String itemKey, boolean popAll);

    /** Loads a page of the list at the current browse position. */
    LibraryLoadPage load(LibrarySession session, int offset, int count);

    /** Releases the server-side session; failures are logged, not thrown. */
    void closeSession(LibrarySession session);
}
