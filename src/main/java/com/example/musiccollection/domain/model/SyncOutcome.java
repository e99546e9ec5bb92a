package com.example.musiccollection.domain.model;

import com.example.musiccollection.domain.enumtype.SyncResultStatus;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

@Data
public class SyncOutcome {

    private SyncSourceId source;

    private SyncResultStatus status;

    private long recordCount;

    private String message;

    private long durationMs;

    /**
     * Source specific counters, for example duplicates or failed detail fetches.
     */
    private Map<String, Long> details = new LinkedHashMap<>();

    public static SyncOutcome success(SyncSourceId source, long recordCount) {
        return of(source, SyncResultStatus.SUCCESS, recordCount, null);
    }

    public static SyncOutcome partial(SyncSourceId source, long recordCount, String message) {
        return of(source, SyncResultStatus.PARTIAL_SUCCESS, recordCount, message);
    }

    public static SyncOutcome skipped(SyncSourceId source, long currentCount, String message) {
        return of(source, SyncResultStatus.SKIPPED, currentCount, message);
    }

    public static SyncOutcome failed(SyncSourceId source, String message) {
        return of(source, SyncResultStatus.FAILED, 0L, message);
    }

    public SyncOutcome detail(String key, long value) {
        details.put(key, value);
        return this;
    }

    public boolean isRan() {
        return status == SyncResultStatus.SUCCESS || status == SyncResultStatus.PARTIAL_SUCCESS;
    }

    private static SyncOutcome of(SyncSourceId source, SyncResultStatus status, long recordCount, String message) {
        SyncOutcome outcome = new SyncOutcome();
        outcome.setSource(source);
        outcome.setStatus(status);
        outcome.setRecordCount(recordCount);
        outcome.setMessage(message);
        return outcome;
    }
}
