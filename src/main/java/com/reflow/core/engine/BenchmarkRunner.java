package com.reflow.core.engine;

import com.reflow.core.budget.TaskClock;
import com.reflow.core.fault.FaultInjector;
import com.reflow.core.memory.MemoryBank;
import com.reflow.core.memory.MemoryBankStore;
import com.reflow.core.model.StrategyType;
import com.reflow.core.model.Task;
import com.reflow.core.model.TaskResult;
import com.reflow.core.recovery.RecoveryPolicyEngine;
import com.reflow.core.recovery.RecoveryStrategyFactory;
import com.reflow.core.trace.InMemoryTraceSink;
import com.reflow.core.trace.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a task set under one strategy.
 * <p>
 * Every task starts from its own fresh world and its own clock. With parallelism above 1
 * tasks run on a fixed pool; results and traces are still returned in task order. A
 * memory-augmented run loads the memory bank first and saves it at the end.
 */
@Service
public class BenchmarkRunner {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkRunner.class);

    private final TaskRunner taskRunner;
    private final RecoveryStrategyFactory strategyFactory;
    private final MemoryBank memoryBank;
    private final MemoryBankStore memoryBankStore;

    public BenchmarkRunner(TaskRunner taskRunner, RecoveryStrategyFactory strategyFactory,
                           MemoryBank memoryBank, MemoryBankStore memoryBankStore) {
        this.taskRunner = taskRunner;
        this.strategyFactory = strategyFactory;
        this.memoryBank = memoryBank;
        this.memoryBankStore = memoryBankStore;
    }

    public RunSummary run(List<Task> tasks, RunOptions options) {
        boolean persistMemory = options.strategy() == StrategyType.MEMORY_AUGMENTED && options.memoryPath() != null;
        if (persistMemory) {
            memoryBankStore.load(options.memoryPath(), memoryBank);
        }

        RecoveryPolicyEngine engine = strategyFactory.engineFor(options.strategy());
        FaultInjector injector = new FaultInjector(options.seed());
        log.info("Running {} tasks with {} (seed {}, parallelism {})",
                tasks.size(), options.strategy().code(), options.seed(), options.parallelism());

        List<TaskRun> runs = options.parallelism() == 1
                ? runSequentially(tasks, engine, injector, options)
                : runInParallel(tasks, engine, injector, options);

        List<TaskResult> results = new ArrayList<>(runs.size());
        List<TraceEvent> events = new ArrayList<>();
        for (TaskRun run : runs) {
            results.add(run.result());
            events.addAll(run.sink().events());
        }

        if (persistMemory) {
            memoryBankStore.save(options.memoryPath(), memoryBank);
        }
        RunSummary summary = new RunSummary(options.strategy(), options.seed(), results, events);
        log.info("Run finished: {} (handled {}%)", summary.outcomeCounts(),
                Math.round(summary.handledRate() * 100));
        return summary;
    }

    private record TaskRun(TaskResult result, InMemoryTraceSink sink) {}

    private List<TaskRun> runSequentially(List<Task> tasks, RecoveryPolicyEngine engine,
                                          FaultInjector injector, RunOptions options) {
        List<TaskRun> runs = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            runs.add(runOne(task, engine, injector, options));
        }
        return runs;
    }

    private List<TaskRun> runInParallel(List<Task> tasks, RecoveryPolicyEngine engine,
                                        FaultInjector injector, RunOptions options) {
        ExecutorService executor = Executors.newFixedThreadPool(options.parallelism());
        try {
            List<Future<TaskRun>> futures = new ArrayList<>(tasks.size());
            for (Task task : tasks) {
                futures.add(executor.submit(() -> runOne(task, engine, injector, options)));
            }
            List<TaskRun> runs = new ArrayList<>(tasks.size());
            for (Future<TaskRun> future : futures) {
                runs.add(future.get());
            }
            return runs;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for tasks", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Task execution failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private TaskRun runOne(Task task, RecoveryPolicyEngine engine, FaultInjector injector, RunOptions options) {
        InMemoryTraceSink sink = new InMemoryTraceSink();
        TaskClock clock = options.virtualClock() ? TaskClock.virtual() : TaskClock.system();
        TaskResult result = taskRunner.run(task, engine, injector, clock, sink);
        return new TaskRun(result, sink);
    }
}
