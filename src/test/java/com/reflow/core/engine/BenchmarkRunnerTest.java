package com.reflow.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.core.budget.TokenEstimator;
import com.reflow.core.config.ReflowProperties;
import com.reflow.core.diagnosis.DiagnosisAction;
import com.reflow.core.diagnosis.DiagnosisCollaborator;
import com.reflow.core.diagnosis.DiagnosisResponse;
import com.reflow.core.events.EventBus;
import com.reflow.core.memory.MemoryBank;
import com.reflow.core.memory.MemoryBankStore;
import com.reflow.core.metrics.RecoveryMetrics;
import com.reflow.core.model.DecisionSource;
import com.reflow.core.model.FaultKind;
import com.reflow.core.model.FaultLayer;
import com.reflow.core.model.FaultMode;
import com.reflow.core.model.FaultSpec;
import com.reflow.core.model.StrategyType;
import com.reflow.core.model.Task;
import com.reflow.core.model.TaskOutcome;
import com.reflow.core.model.TaskResult;
import com.reflow.core.oracle.ConsistencyChecker;
import com.reflow.core.oracle.SuccessOracle;
import com.reflow.core.recovery.RecoveryStrategyFactory;
import com.reflow.core.tools.ToolExecutor;
import com.reflow.core.tools.ToolRegistry;
import com.reflow.core.trace.TraceEvent;
import com.reflow.core.trace.TraceEventType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BenchmarkRunnerTest {

    @TempDir
    Path tempDir;

    private ReflowProperties properties;
    private DiagnosisCollaborator collaborator;
    private MemoryBank memoryBank;
    private MemoryBankStore store;
    private BenchmarkRunner benchmarkRunner;

    @BeforeEach
    void setUp() {
        properties = new ReflowProperties();
        collaborator = mock(DiagnosisCollaborator.class);
        when(collaborator.diagnose(any())).thenReturn(
                new DiagnosisResponse(FaultLayer.CASCADE, DiagnosisAction.ROLLBACK, 0.9, "stale state"));
        memoryBank = new MemoryBank(0.6, 5);
        store = new MemoryBankStore(new ObjectMapper());
        TokenEstimator estimator = new TokenEstimator();
        TaskRunner taskRunner = new TaskRunner(new ToolRegistry(), new ToolExecutor(), estimator,
                new SuccessOracle(), new ConsistencyChecker(), new EventBus(),
                new RecoveryMetrics(new SimpleMeterRegistry()), properties);
        RecoveryStrategyFactory factory = new RecoveryStrategyFactory(properties, collaborator, memoryBank, estimator);
        benchmarkRunner = new BenchmarkRunner(taskRunner, factory, memoryBank, store);
    }

    private static Task renamed(Task task, String taskId) {
        return new Task(taskId, task.initialWorldState(), task.steps(), task.faultSchedule(), task.successCondition());
    }

    private static List<Task> conflictTasks(int count) {
        Task template = TaskRunnerTest.approvalTask(FaultSpec.forward(2, FaultKind.CONFLICT, FaultMode.ONCE));
        return java.util.stream.IntStream.range(0, count)
                .mapToObj(i -> renamed(template, "conflict-" + i))
                .toList();
    }

    @Test
    @DisplayName("a learned recovery bypasses diagnosis on the next matching failure")
    void memoryBypassesDiagnosis() {
        Path memoryFile = tempDir.resolve("memory.json");

        RunSummary summary = benchmarkRunner.run(conflictTasks(2),
                new RunOptions(StrategyType.MEMORY_AUGMENTED, 42L, 1, memoryFile, true));

        assertEquals(2, summary.count(TaskOutcome.SUCCESS));
        assertEquals(1, summary.diagnosisCalls());
        assertEquals(1, summary.memoryHits());
        verify(collaborator, times(1)).diagnose(any());

        TraceEvent secondFailure = summary.events().stream()
                .filter(e -> "conflict-1".equals(e.taskId()) && e.eventType() == TraceEventType.TOOL_CALL
                        && e.errorKind() != null)
                .findFirst()
                .orElseThrow();
        assertEquals(DecisionSource.MEMORY, secondFailure.decisionSource());
        assertNotNull(secondFailure.memoryKey());
        assertNull(secondFailure.diagnosis());
        assertTrue(Files.exists(memoryFile));
    }

    @Test
    @DisplayName("a persisted memory bank is loaded at the start of the next run")
    void memoryPersistsAcrossRuns() {
        Path memoryFile = tempDir.resolve("memory.json");
        RunOptions options = new RunOptions(StrategyType.MEMORY_AUGMENTED, 42L, 1, memoryFile, true);
        benchmarkRunner.run(conflictTasks(1), options);
        memoryBank.clear();

        RunSummary second = benchmarkRunner.run(conflictTasks(1), options);

        assertEquals(1, second.memoryHits());
        assertEquals(0, second.diagnosisCalls());
    }

    @Test
    @DisplayName("diagnosis-driven runs never consult memory")
    void diagnosisOnlyRun() {
        RunSummary summary = benchmarkRunner.run(conflictTasks(2),
                new RunOptions(StrategyType.DIAGNOSIS, 42L, 1, null, true));

        assertEquals(2, summary.diagnosisCalls());
        assertEquals(0, summary.memoryHits());
        assertEquals(0, memoryBank.size());
    }

    @Test
    @DisplayName("parallel runs return results and traces in task order")
    void parallelKeepsTaskOrder() {
        List<Task> tasks = conflictTasks(6);

        RunSummary summary = benchmarkRunner.run(tasks,
                new RunOptions(StrategyType.RULE_BASED, 42L, 3, null, true));

        assertEquals(tasks.stream().map(Task::taskId).toList(),
                summary.results().stream().map(TaskResult::taskId).toList());
        List<String> traceOrder = summary.events().stream()
                .map(TraceEvent::taskId)
                .distinct()
                .toList();
        assertEquals(tasks.stream().map(Task::taskId).toList(), traceOrder);
        assertEquals(1.0, summary.handledRate());
    }

    @Test
    @DisplayName("sequential and parallel runs produce the same trace")
    void parallelMatchesSequential() {
        List<Task> tasks = conflictTasks(4);

        RunSummary sequential = benchmarkRunner.run(tasks, new RunOptions(StrategyType.RULE_BASED, 7L, 1, null, true));
        RunSummary parallel = benchmarkRunner.run(tasks, new RunOptions(StrategyType.RULE_BASED, 7L, 4, null, true));

        assertEquals(sequential.events(), parallel.events());
    }
}
