package com.example.musiccollection.common.exception;

import org.springframework.http.HttpStatus;

/**
 * A request the service refuses. The status is both the HTTP status of the error response and,
 * as a string, its {@code code}.
 */
public class BusinessException extends RuntimeException {

    private final HttpStatus status;
    private final String userAction;

    public BusinessException(HttpStatus status, String message) {
        this(status, message, null);
    }

    public BusinessException(HttpStatus status, String message, String userAction) {
        super(message);
        this.status = status;
        this.userAction = userAction;
    }

    public static BusinessException notFound(String subject, String userAction) {
        return new BusinessException(HttpStatus.NOT_FOUND, subject + " not found", userAction);
    }

    /**
     * A {@code source} filter other than all, library ({@code roon}) or catalog ({@code discogs}).
     */
    public static BusinessException unknownSource(String source) {
        return new BusinessException(HttpStatus.BAD_REQUEST, "Unknown source: " + source,
                "Use all, library or catalog");
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return String.valueOf(status.value());
    }

    public String getUserAction() {
        return userAction;
    }
}
