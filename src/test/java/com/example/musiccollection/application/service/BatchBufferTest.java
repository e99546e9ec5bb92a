package com.example.musiccollection.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchBufferTest {

    @Test
    void shouldFlushFullBatchesAndTail() {
        List<Integer> sizes = new ArrayList<>();
        BatchBuffer<String> buffer = new BatchBuffer<>(2, batch -> sizes.add(batch.size()));

        buffer.add("a");
        buffer.add("b");
        buffer.add("c");
        buffer.flush();

        assertEquals(Arrays.asList(2, 1), sizes);
        assertEquals(3L, buffer.getWritten());
    }

    @Test
    void shouldReportEachProgressMarkOnce() {
        BatchBuffer<Integer> buffer = new BatchBuffer<>(1000, batch -> { });
        int reported = 0;

        for (int i = 0; i < 25000; i++) {
            buffer.add(i);
            if (buffer.passedProgressMark(10000)) {
                reported++;
            }
        }

        assertEquals(2, reported);
    }

    @Test
    void shouldReportMarkSkippedByUnevenBatch() {
        BatchBuffer<Integer> buffer = new BatchBuffer<>(3, batch -> { });
        List<Long> marks = new ArrayList<>();

        for (int i = 0; i < 12; i++) {
            buffer.add(i);
            if (buffer.passedProgressMark(5)) {
                marks.add(buffer.getWritten());
            }
        }

        assertEquals(Arrays.asList(6L, 12L), marks);
    }
}
