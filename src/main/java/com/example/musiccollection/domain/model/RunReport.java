package com.example.musiccollection.domain.model;

import com.example.musiccollection.domain.enumtype.SyncResultStatus;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class RunReport {

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    private boolean force;

    private boolean fullRun;

    private boolean snapshotRecorded;

    private List<SyncOutcome> outcomes = new ArrayList<>();

    public SyncOutcome outcomeOf(SyncSourceId source) {
        for (SyncOutcome outcome : outcomes) {
            if (outcome.getSource() == source) {
                return outcome;
            }
        }
        return null;
    }

    public long failedCount() {
        return outcomes.stream().filter(o -> o.getStatus() == SyncResultStatus.FAILED).count();
    }
}
