package com.example.musiccollection.domain.enumtype;

public enum SyncResultStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    SKIPPED,
    FAILED
}
