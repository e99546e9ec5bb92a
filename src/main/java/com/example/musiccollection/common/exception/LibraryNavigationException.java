package com.example.musiccollection.common.exception;

/**
 * A named menu entry was not found while walking the browse hierarchy.
 */
public class LibraryNavigationException extends RuntimeException {

    private final String menuTitle;

    public LibraryNavigationException(String menuTitle) {
        super(menuTitle + " not found");
        this.menuTitle = menuTitle;
    }

    public String getMenuTitle() {
        return menuTitle;
    }
}
