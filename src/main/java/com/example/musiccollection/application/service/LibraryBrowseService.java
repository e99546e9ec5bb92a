package com.example.musiccollection.application.service;

import com.example.musiccollection.common.config.AppLibraryProperties;
import com.example.musiccollection.common.exception.LibraryConnectionException;
import com.example.musiccollection.common.exception.LibraryNavigationException;
import com.example.musiccollection.domain.model.LibraryBrowseItem;
import com.example.musiccollection.domain.model.LibraryBrowseResult;
import com.example.musiccollection.domain.model.LibraryLoadPage;
import com.example.musiccollection.domain.model.LibrarySession;
import com.example.musiccollection.domain.model.TaggedAlbum;
import com.example.musiccollection.infrastructure.library.LibraryBrowseClient;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Walks the library's browse hierarchy (root, Library, then Albums or Tags) and pages through the
 * resulting lists.
 */
@Service
public class LibraryBrowseService {

    private static final Logger log = LoggerFactory.getLogger(LibraryBrowseService.class);

    static final String MENU_LIBRARY = "Library";
    static final String MENU_ALBUMS = "Albums";
    static final String MENU_TAGS = "Tags";

    private final LibraryBrowseClient client;
    private final AppLibraryProperties properties;

    public LibraryBrowseService(LibraryBrowseClient client, AppLibraryProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    public LibrarySessionScope openScope() {
        return new LibrarySessionScope(client);
    }

    /**
     * Every album in the library, in browse order. Subtitle carries the artist.
     */
    public List<LibraryBrowseItem> loadAlbums(LibrarySessionScope scope) {
        return withRetry("albums", scope, () -> {
            LibrarySession session = scope.current();
            LibraryBrowseResult albums = navigate(session, MENU_ALBUMS);
            log.info("LIBRARY_ALBUMS_LISTED core={} count={}", session.getCoreName(), albums.getListCount());
            return loadAll(session, albums.getListCount());
        });
    }

    /**
     * Albums carrying any of the given tags (matched case-insensitively on the tag title), with
     * the tag's action entry removed.
     */
    public List<TaggedAlbum> loadTaggedAlbums(LibrarySessionScope scope, Set<String> tagNames) {
        return withRetry("tags", scope, () -> {
            LibrarySession session = scope.current();
            LibraryBrowseResult tagsList = navigate(session, MENU_TAGS);
            List<LibraryBrowseItem> tags = loadAll(session, tagsList.getListCount());

            Map<String, String> targetTags = new LinkedHashMap<>();
            for (LibraryBrowseItem tag : tags) {
                String title = tag.getTitle() == null ? "" : tag.getTitle();
                if (tagNames.contains(title.toLowerCase(Locale.ROOT))) {
                    targetTags.put(title, tag.getItemKey());
                }
            }
            log.info("LIBRARY_TAGS_LISTED tagCount={} matched={}", tags.size(), targetTags.keySet());

            List<TaggedAlbum> tagged = new ArrayList<>();
            for (Map.Entry<String, String> tag : targetTags.entrySet()) {
                LibraryBrowseResult members = client.browse(session, tag.getValue(), false);
                pause(properties.getNavigationDelayMs());
                int kept = 0;
                for (LibraryBrowseItem item : loadAll(session, members.getListCount())) {
                    if (properties.getPlayTagTitle().equals(item.getTitle())) {
                        continue;
                    }
                    tagged.add(new TaggedAlbum(item.getTitle(), tag.getKey()));
                    kept++;
                }
                log.info("LIBRARY_TAG_LOADED tag={} listed={} albums={}", tag.getKey(), members.getListCount(), kept);
            }
            return tagged;
        });
    }

    /**
     * Pops to the root, enters Library, then enters {@code childMenu}.
     */
    LibraryBrowseResult navigate(LibrarySession session, String childMenu) {
        client.browse(session, null, true);
        pause(properties.getNavigationDelayMs());
        String libraryKey = findItemKey(client.load(session, 0, properties.getPageSize()), MENU_LIBRARY);

        client.browse(session, libraryKey, false);
        pause(properties.getNavigationDelayMs());
        String childKey = findItemKey(client.load(session, 0, properties.getPageSize()), childMenu);

        LibraryBrowseResult result = client.browse(session, childKey, false);
        pause(properties.getNavigationDelayMs());
        return result;
    }

    /**
     * Pages through the current list from offset 0, advancing by the number of items each page
     * returned. Stops at {@code total} or on the first empty page.
     */
    List<LibraryBrowseItem> loadAll(LibrarySession session, int total) {
        List<LibraryBrowseItem> items = new ArrayList<>(Math.max(0, total));
        int offset = 0;
        while (offset < total) {
            LibraryLoadPage page = client.load(session, offset, properties.getPageSize());
            if (page.isEmpty()) {
                log.warn("LIBRARY_PAGE_EMPTY offset={} total={}", offset, total);
                break;
            }
            items.addAll(page.getItems());
            offset += page.getItems().size();
            if (offset % 500 == 0 || offset >= total) {
                log.info("LIBRARY_PAGE_PROGRESS loaded={} total={}", offset, total);
            }
            pause(properties.getPageDelayMs());
        }
        return items;
    }

    private String findItemKey(LibraryLoadPage page, String title) {
        for (LibraryBrowseItem item : page.getItems()) {
            if (title.equals(item.getTitle())) {
                return item.getItemKey();
            }
        }
        throw new LibraryNavigationException(title);
    }

    private <T> T withRetry(String target, LibrarySessionScope scope, Supplier<T> action) {
        int maxAttempts = Math.max(1, properties.getMaxRetry());
        LibraryConnectionException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (LibraryConnectionException e) {
                lastError = e;
                if (attempt < maxAttempts) {
                    log.warn("LIBRARY_NAVIGATE_RETRY target={} attempt={} maxAttempts={} reason={}",
                            target, attempt, maxAttempts, e.getMessage());
                    scope.reset();
                    pause(properties.getRetryBackoffMs());
                }
            }
        }
        throw lastError;
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Library browse interrupted");
        }
    }
}
