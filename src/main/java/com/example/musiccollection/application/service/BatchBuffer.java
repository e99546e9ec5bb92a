package com.example.musiccollection.application.service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collects rows and hands them to {@code flusher} every {@code batchSize} rows. Each flush is one
 * auto-committed insert statement, so an interrupted load keeps everything but the pending tail.
 */
public class BatchBuffer<T> {

    private final int batchSize;
    private final Consumer<List<T>> flusher;
    private final List<T> pending;
    private long written;
    private long progressMark;

    public BatchBuffer(int batchSize, Consumer<List<T>> flusher) {
        this.batchSize = Math.max(1, batchSize);
        this.flusher = flusher;
        this.pending = new ArrayList<>(this.batchSize);
    }

    public void add(T row) {
        pending.add(row);
        if (pending.size() >= batchSize) {
            flush();
        }
    }

    public void flush() {
        if (pending.isEmpty()) {
            return;
        }
        List<T> batch = new ArrayList<>(pending);
        pending.clear();
        flusher.accept(batch);
        written += batch.size();
    }

    /**
     * True once each time the written count has moved past a new multiple of {@code interval}.
     * Rows are only counted on flush, so callers may ask after every add.
     */
    public boolean passedProgressMark(long interval) {
        long mark = written / interval;
        if (mark > progressMark) {
            progressMark = mark;
            return true;
        }
        return false;
    }

    public long getWritten() {
        return written;
    }
}
