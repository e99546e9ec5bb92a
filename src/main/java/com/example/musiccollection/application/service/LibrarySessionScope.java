package com.example.musiccollection.application.service;

import com.example.musiccollection.domain.model.LibrarySession;
import com.example.musiccollection.infrastructure.library.LibraryBrowseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One library session per sync run. Opened on first use, shared by the library routines of the
 * run and closed by the run owner.
 */
public class LibrarySessionScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LibrarySessionScope.class);

    private final LibraryBrowseClient client;
    private LibrarySession session;
    private int openCount;

    public LibrarySessionScope(LibraryBrowseClient client) {
        this.client = client;
    }

    public LibrarySession current() {
        if (session == null) {
            session = client.openSession();
            openCount++;
            log.info("LIBRARY_SESSION_READY core={} reused=false", session.getCoreName());
        }
        return session;
    }

    /**
     * Drops the current session; the next {@link #current()} opens a fresh one.
     */
    public void reset() {
        LibrarySession stale = session;
        session = null;
        if (stale != null) {
            client.closeSession(stale);
        }
    }

    public boolean isOpen() {
        return session != null;
    }

    public int getOpenCount() {
        return openCount;
    }

    @Override
    public void close() {
        reset();
    }
}
