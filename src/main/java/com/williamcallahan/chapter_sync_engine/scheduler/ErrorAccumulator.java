package com.williamcallahan.chapter_sync_engine.scheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts per-row failures of one scheduler run and decides when the run should stop early.
 */
public class ErrorAccumulator {

    private static final int MAX_RECORDED = 20;

    private final int ceiling;
    private final List<String> samples = new ArrayList<>();
    private int count;

    /**
     * @param ceiling failures tolerated before halting; 0 or less never halts
     */
    public ErrorAccumulator(int ceiling) {
        this.ceiling = ceiling;
    }

    public void record(String rowId, Exception error) {
        count++;
        if (samples.size() < MAX_RECORDED) {
            samples.add(rowId + ": " + error.getClass().getSimpleName());
        }
    }

    public boolean shouldHalt() {
        return ceiling > 0 && count > ceiling;
    }

    public int count() {
        return count;
    }

    /**
     * The first few failures, for the run summary.
     */
    public List<String> samples() {
        return List.copyOf(samples);
    }
}
