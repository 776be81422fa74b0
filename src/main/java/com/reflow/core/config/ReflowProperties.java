package com.reflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Runtime settings bound from {@code reflow.*}.
 */
@Component
@ConfigurationProperties(prefix = "reflow")
public class ReflowProperties {

    /** Fault-injection seed. */
    private long seed = 42L;

    /** Default strategy when the CLI gives none: B0..B4 or the strategy name. */
    private String strategy = "B2";

    /** {@code virtual} (deterministic, simulated time) or {@code system} (wall clock, real sleeping). */
    private String clock = "virtual";

    private Budget budget = new Budget();
    private Retry retry = new Retry();
    private Guard guard = new Guard();
    private Diagnosis diagnosis = new Diagnosis();
    private Memory memory = new Memory();
    private Run run = new Run();

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public String getClock() {
        return clock;
    }

    public void setClock(String clock) {
        this.clock = clock;
    }

    public boolean isVirtualClock() {
        return !"system".equalsIgnoreCase(clock);
    }

    public Budget getBudget() {
        return budget;
    }

    public void setBudget(Budget budget) {
        this.budget = budget;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Guard getGuard() {
        return guard;
    }

    public void setGuard(Guard guard) {
        this.guard = guard;
    }

    public Diagnosis getDiagnosis() {
        return diagnosis;
    }

    public void setDiagnosis(Diagnosis diagnosis) {
        this.diagnosis = diagnosis;
    }

    public Memory getMemory() {
        return memory;
    }

    public void setMemory(Memory memory) {
        this.memory = memory;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public static class Budget {

        private int maxTokens = 10_000;
        private int maxToolCalls = 50;
        private long maxTimeMs = 60_000L;

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getMaxToolCalls() {
            return maxToolCalls;
        }

        public void setMaxToolCalls(int maxToolCalls) {
            this.maxToolCalls = maxToolCalls;
        }

        public long getMaxTimeMs() {
            return maxTimeMs;
        }

        public void setMaxTimeMs(long maxTimeMs) {
            this.maxTimeMs = maxTimeMs;
        }
    }

    public static class Retry {

        /** First exponential backoff delay; doubles per retry. */
        private long baseDelayMs = 100L;

        /** Retries of a transient fault before rule-based recovery escalates. */
        private int maxRetries = 3;

        /** Fixed pause used by naive retry. */
        private long naiveDelayMs = 50L;

        /** Hard ceiling on attempts of one step, whatever the strategy says. */
        private int maxAttemptsPerStep = 4;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getNaiveDelayMs() {
            return naiveDelayMs;
        }

        public void setNaiveDelayMs(long naiveDelayMs) {
            this.naiveDelayMs = naiveDelayMs;
        }

        public int getMaxAttemptsPerStep() {
            return maxAttemptsPerStep;
        }

        public void setMaxAttemptsPerStep(int maxAttemptsPerStep) {
            this.maxAttemptsPerStep = maxAttemptsPerStep;
        }
    }

    public static class Guard {

        /** Consecutive failed attempts with an unchanged state hash that count as no progress. */
        private int window = 3;

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }
    }

    public static class Diagnosis {

        /** {@code heuristic} or {@code llm}. */
        private String mode = "heuristic";
        private double confidenceThreshold = 0.7;
        private int historyWindow = 5;

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public int getHistoryWindow() {
            return historyWindow;
        }

        public void setHistoryWindow(int historyWindow) {
            this.historyWindow = historyWindow;
        }
    }

    public static class Memory {

        private double confidenceThreshold = 0.8;
        private double minSimilarity = 0.6;
        private int maxExamples = 5;

        /** Memory bank file; empty means in-memory only. */
        private String path = "";

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public double getMinSimilarity() {
            return minSimilarity;
        }

        public void setMinSimilarity(double minSimilarity) {
            this.minSimilarity = minSimilarity;
        }

        public int getMaxExamples() {
            return maxExamples;
        }

        public void setMaxExamples(int maxExamples) {
            this.maxExamples = maxExamples;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Run {

        private int parallelism = 1;
        private String traceOut = "traces.jsonl";

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public String getTraceOut() {
            return traceOut;
        }

        public void setTraceOut(String traceOut) {
            this.traceOut = traceOut;
        }
    }
}
