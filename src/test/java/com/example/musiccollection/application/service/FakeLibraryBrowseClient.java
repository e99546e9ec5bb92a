package com.example.musiccollection.application.service;

import com.example.musiccollection.common.exception.LibraryConnectionException;
import com.example.musiccollection.domain.model.LibraryBrowseItem;
import com.example.musiccollection.domain.model.LibraryBrowseResult;
import com.example.musiccollection.domain.model.LibraryLoadPage;
import com.example.musiccollection.domain.model.LibrarySession;
import com.example.musiccollection.infrastructure.library.LibraryBrowseClient;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory browse tree: root, Library, then Albums and Tags.
 */
class FakeLibraryBrowseClient implements LibraryBrowseClient {

    static final String ROOT = "root";

    private final Map<String, List<LibraryBrowseItem>> lists = new HashMap<>();
    private final Map<String, String> positions = new HashMap<>();
    private final List<String> closedSessions = new ArrayList<>();
    private final List<Integer> loadOffsets = new ArrayList<>();
    private int openedSessions;
    private int loadFailuresRemaining;
    private boolean failOnOpen;

    FakeLibraryBrowseClient() {
        lists.put(ROOT, new ArrayList<>(Collections.singletonList(item("Library", "library"))));
        List<LibraryBrowseItem> library = new ArrayList<>();
        library.add(item("Artists", "artists"));
        library.add(item("Albums", "albums"));
        library.add(item("Tags", "tags"));
        lists.put("library", library);
        lists.put("albums", new ArrayList<>());
        lists.put("tags", new ArrayList<>());
    }

    FakeLibraryBrowseClient withAlbums(int count) {
        List<LibraryBrowseItem> albums = lists.get("albums");
        for (int i = 1; i <= count; i++) {
            albums.add(new LibraryBrowseItem("Album " + i, "Artist " + i, "album-" + i, "img-" + i, "list"));
        }
        return this;
    }

    FakeLibraryBrowseClient withAlbum(String title, String artist, String itemKey) {
        lists.get("albums").add(new LibraryBrowseItem(title, artist, itemKey, null, "list"));
        return this;
    }

    FakeLibraryBrowseClient withTag(String tagTitle, String... albumTitles) {
        String key = "tag-" + tagTitle;
        lists.get("tags").add(item(tagTitle, key));
        List<LibraryBrowseItem> members = new ArrayList<>();
        members.add(item("Play Tag", key + "-play"));
        for (String title : albumTitles) {
            members.add(item(title, key + "-" + title));
        }
        lists.put(key, members);
        return this;
    }

    FakeLibraryBrowseClient removeMenu(String parent, String title) {
        lists.get(parent).removeIf(entry -> title.equals(entry.getTitle()));
        return this;
    }

    void failNextLoads(int count) {
        loadFailuresRemaining = count;
    }

    void failOnOpen() {
        failOnOpen = true;
    }

    @Override
    public LibrarySession openSession() {
        if (failOnOpen) {
            throw new LibraryConnectionException("bridge unreachable");
        }
        openedSessions++;
        String key = "session-" + openedSessions;
        positions.put(key, ROOT);
        return new LibrarySession(key, "Test Core", LocalDateTime.now());
    }

    @Override
    public LibraryBrowseResult browse(LibrarySession session, String itemKey, boolean popAll) {
        requireOpen(session);
        String position = popAll ? ROOT : itemKey;
        if (!lists.containsKey(position)) {
            throw new IllegalStateException("Unknown item key " + itemKey);
        }
        positions.put(session.getSessionKey(), position);
        return new LibraryBrowseResult("list", position, lists.get(position).size());
    }

    @Override
    public LibraryLoadPage load(LibrarySession session, int offset, int count) {
        requireOpen(session);
        if (loadFailuresRemaining > 0) {
            loadFailuresRemaining--;
            throw new LibraryConnectionException("connection reset");
        }
        loadOffsets.add(offset);
        List<LibraryBrowseItem> list = lists.get(positions.get(session.getSessionKey()));
        int from = Math.min(offset, list.size());
        int to = Math.min(offset + count, list.size());
        return new LibraryLoadPage(new ArrayList<>(list.subList(from, to)), list.size());
    }

    @Override
    public void closeSession(LibrarySession session) {
        positions.remove(session.getSessionKey());
        closedSessions.add(session.getSessionKey());
    }

    int getOpenedSessions() {
        return openedSessions;
    }

    List<String> getClosedSessions() {
        return closedSessions;
    }

    List<Integer> getLoadOffsets() {
        return loadOffsets;
    }

    private void requireOpen(LibrarySession session) {
        if (!positions.containsKey(session.getSessionKey())) {
            throw new LibraryConnectionException("session closed");
        }
    }

    private static LibraryBrowseItem item(String title, String key) {
        return new LibraryBrowseItem(title, null, key, null, "list");
    }
}
