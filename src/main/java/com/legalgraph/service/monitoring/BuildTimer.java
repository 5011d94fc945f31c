package com.legalgraph.service.monitoring;

import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Step timings and document throughput of one corpus build.
 * <p>
 * Each {@link #mark} closes the step that began at the previous mark (or at
 * {@link #start}). Steps that handle documents record how many, so the
 * build log can show documents per second next to the elapsed time.
 */
public class BuildTimer {

    private final Clock clock;

    private final List<Step> steps = new ArrayList<>();

    @Getter
    private Instant startedAt;

    private Instant lastMark;

    private Instant finishedAt;

    public BuildTimer(Clock clock) {
        this.clock = clock;
    }

    public void start() {
        steps.clear();
        startedAt = clock.instant();
        lastMark = startedAt;
        finishedAt = null;
    }

    public void mark(String stepName) {
        mark(stepName, 0);
    }

    /**
     * Closes a step that handled {@code documents} documents.
     */
    public void mark(String stepName, long documents) {
        if (startedAt == null) {
            start();
        }
        Instant now = clock.instant();
        steps.add(new Step(stepName, Duration.between(lastMark, now), documents));
        lastMark = now;
    }

    public void end() {
        finishedAt = clock.instant();
    }

    public double getTotalTime() {
        if (startedAt == null || finishedAt == null) {
            return 0.0;
        }
        return seconds(Duration.between(startedAt, finishedAt));
    }

    public Map<String, Double> getStepDurations() {
        Map<String, Double> durations = new LinkedHashMap<>();
        for (Step step : steps) {
            durations.merge(step.name, seconds(step.duration), Double::sum);
        }
        return durations;
    }

    /**
     * Documents handled per step; steps marked without a count are left out.
     */
    public Map<String, Long> getStepDocuments() {
        Map<String, Long> documents = new LinkedHashMap<>();
        for (Step step : steps) {
            if (step.documents > 0) {
                documents.merge(step.name, step.documents, Long::sum);
            }
        }
        return documents;
    }

    public String formatDisplay() {
        StringBuilder sb = new StringBuilder(String.format("Build time: %.2fs", getTotalTime()));
        for (Step step : steps) {
            sb.append(String.format("%n  - %s: %.2fs", step.name, seconds(step.duration)));
            if (step.documents > 0) {
                sb.append(String.format(" | %d docs", step.documents));
                if (step.duration.toMillis() > 0) {
                    sb.append(String.format(" | %.1f docs/s", step.documents / seconds(step.duration)));
                }
            }
        }
        return sb.toString();
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }

    private static final class Step {
        private final String name;
        private final Duration duration;
        private final long documents;

        private Step(String name, Duration duration, long documents) {
            this.name = name;
            this.duration = duration;
            this.documents = documents;
        }
    }
}
