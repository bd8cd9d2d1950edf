package dev.reciperunner.engine;

import dev.reciperunner.model.ExecutionStatistics;
import dev.reciperunner.model.RecipeExecutionResult;
import dev.reciperunner.model.StepStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded log of past run results. The oldest entry is evicted once the limit is
 * reached. Safe for concurrent runs sharing one runner.
 */
public final class ExecutionHistory {

    public static final int DEFAULT_LIMIT = 100;

    private final int limit;
    private final Deque<RecipeExecutionResult> entries = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private long totalRecorded;

    public ExecutionHistory() {
        this(DEFAULT_LIMIT);
    }

    public ExecutionHistory(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be >= 1, got " + limit);
        }
        this.limit = limit;
    }

    public void record(RecipeExecutionResult result) {
        lock.lock();
        try {
            if (entries.size() == limit) {
                entries.removeFirst();
            }
            entries.addLast(result);
            totalRecorded++;
        } finally {
            lock.unlock();
        }
    }

    /** The most recent {@code count} results, oldest first. */
    public List<RecipeExecutionResult> recent(int count) {
        lock.lock();
        try {
            var all = new ArrayList<>(entries);
            int from = Math.max(0, all.size() - Math.max(0, count));
            return List.copyOf(all.subList(from, all.size()));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int limit() {
        return limit;
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Statistics over the retained runs; {@code totalRuns} counts every run ever
     * recorded, evicted ones included.
     */
    public ExecutionStatistics statistics() {
        List<RecipeExecutionResult> retained;
        long total;
        lock.lock();
        try {
            retained = List.copyOf(entries);
            total = totalRecorded;
        } finally {
            lock.unlock();
        }
        if (retained.isEmpty()) {
            return new ExecutionStatistics(total, 0, 0, 0, 0, 0, 0.0, 0.0);
        }

        int successful = 0;
        int cancelled = 0;
        long stepsExecuted = 0;
        double totalSeconds = 0;
        for (RecipeExecutionResult result : retained) {
            if (result.overallSuccess()) {
                successful++;
            }
            if (result.cancelled()) {
                cancelled++;
            }
            stepsExecuted += result.stepResults().stream()
                .filter(r -> r.status() != StepStatus.SKIPPED && r.status() != StepStatus.CANCELLED)
                .count();
            totalSeconds += result.executionTimeSeconds();
        }
        int failed = retained.size() - successful - cancelled;
        return new ExecutionStatistics(
            total,
            retained.size(),
            successful,
            failed,
            cancelled,
            stepsExecuted,
            totalSeconds / retained.size(),
            (double) successful / retained.size()
        );
    }
}
