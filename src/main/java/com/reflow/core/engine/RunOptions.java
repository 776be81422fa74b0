package com.reflow.core.engine;

import com.reflow.core.config.ReflowProperties;
import com.reflow.core.model.StrategyType;

import java.nio.file.Path;

/**
 * Per-run settings that may differ from the configured defaults.
 *
 * @param strategy     strategy under test
 * @param seed         fault-injection seed
 * @param parallelism  tasks run concurrently, at least 1
 * @param memoryPath   memory bank file loaded before and saved after a memory-augmented run, or null
 * @param virtualClock whether tasks run on simulated time
 */
public record RunOptions(StrategyType strategy, long seed, int parallelism, Path memoryPath, boolean virtualClock) {

    public RunOptions {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
    }

    public static RunOptions defaults(ReflowProperties properties) {
        String memoryPath = properties.getMemory().getPath();
        return new RunOptions(
                StrategyType.parse(properties.getStrategy()),
                properties.getSeed(),
                properties.getRun().getParallelism(),
                memoryPath == null || memoryPath.isBlank() ? null : Path.of(memoryPath),
                properties.isVirtualClock());
    }

    public RunOptions withStrategy(StrategyType newStrategy) {
        return new RunOptions(newStrategy, seed, parallelism, memoryPath, virtualClock);
    }
}
