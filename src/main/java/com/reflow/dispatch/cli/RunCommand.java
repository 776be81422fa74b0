package com.reflow.dispatch.cli;

import com.reflow.core.config.ReflowProperties;
import com.reflow.core.engine.BenchmarkRunner;
import com.reflow.core.engine.RunOptions;
import com.reflow.core.engine.RunSummary;
import com.reflow.core.events.EventBus;
import com.reflow.core.model.StrategyType;
import com.reflow.core.model.Task;
import com.reflow.core.task.TaskLoader;
import com.reflow.core.trace.JsonlTraceWriter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: reflow run --tasks tasks.jsonl --strategy B2 --out traces.jsonl
 * <p>
 * Runs a task set under one recovery strategy, writes the JSONL trace and prints a
 * per-task outcome table. Unset options fall back to the {@code reflow.*} configuration.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a task set under one recovery strategy")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--tasks", "-t"}, required = true, description = "JSONL task file")
    private Path tasksFile;

    @Option(names = {"--strategy", "-s"}, description = "B0, B1, B2, B3 or B4 (default: reflow.strategy)")
    private String strategy;

    @Option(names = {"--out", "-o"}, description = "Trace output file (default: reflow.run.trace-out)")
    private Path out;

    @Option(names = "--memory", description = "Memory bank file for B4 (default: reflow.memory.path)")
    private Path memory;

    @Option(names = "--seed", description = "Fault-injection seed (default: reflow.seed)")
    private Long seed;

    @Option(names = {"--parallelism", "-p"}, description = "Tasks run concurrently (default: reflow.run.parallelism)")
    private Integer parallelism;

    @Option(names = {"--watch", "-w"}, description = "Print recovery events as they happen")
    private boolean watch;

    private final BenchmarkRunner benchmarkRunner;
    private final TaskLoader taskLoader;
    private final JsonlTraceWriter traceWriter;
    private final EventBus eventBus;
    private final ReflowProperties properties;

    public RunCommand(BenchmarkRunner benchmarkRunner, TaskLoader taskLoader, JsonlTraceWriter traceWriter,
                      EventBus eventBus, ReflowProperties properties) {
        this.benchmarkRunner = benchmarkRunner;
        this.taskLoader = taskLoader;
        this.traceWriter = traceWriter;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        RunOptions options;
        try {
            options = resolveOptions();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        EventBus.Subscription subscription = watch ? eventBus.subscribeAll(ConsoleOutput::event) : null;
        try {
            List<Task> tasks = taskLoader.load(tasksFile);
            ConsoleOutput.info("Running " + tasks.size() + " task(s) from " + tasksFile
                    + " with " + options.strategy().code() + " (" + options.strategy() + ")");

            RunSummary summary = benchmarkRunner.run(tasks, options);
            Path traceOut = out != null ? out : Path.of(properties.getRun().getTraceOut());
            traceWriter.write(traceOut, summary.events());

            System.out.println();
            summary.results().forEach(ConsoleOutput::taskResult);
            ConsoleOutput.summary(summary);
            ConsoleOutput.success("Trace written to " + traceOut + " (" + summary.events().size() + " events)");
            return 0;
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }

    RunOptions resolveOptions() {
        RunOptions defaults = RunOptions.defaults(properties);
        return new RunOptions(
                strategy != null ? StrategyType.parse(strategy) : defaults.strategy(),
                seed != null ? seed : defaults.seed(),
                parallelism != null ? parallelism : defaults.parallelism(),
                memory != null ? memory : defaults.memoryPath(),
                defaults.virtualClock());
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
