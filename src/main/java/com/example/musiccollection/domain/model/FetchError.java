package com.example.musiccollection.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class FetchError {

    public enum Kind {
        RATE_LIMITED,
        HTTP_STATUS,
        IO,
        PARSE
    }

    private Kind kind;

    /**
     * HTTP status, or -1 when no response was received.
     */
    private int statusCode;

    private String reason;

    public static FetchError status(int statusCode) {
        Kind kind = statusCode == 429 ? Kind.RATE_LIMITED : Kind.HTTP_STATUS;
        return new FetchError(kind, statusCode, "HTTP " + statusCode);
    }

    public static FetchError io(Exception e) {
        return new FetchError(Kind.IO, -1, e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    public static FetchError parse(Exception e) {
        return new FetchError(Kind.PARSE, 200, "Unparseable payload: " + e.getMessage());
    }
}
