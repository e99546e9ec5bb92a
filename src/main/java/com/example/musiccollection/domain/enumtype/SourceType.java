package com.example.musiccollection.domain.enumtype;

import java.util.Locale;

public enum SourceType {
    API,
    FILE;

    public String ledgerValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
