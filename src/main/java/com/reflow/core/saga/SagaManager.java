package com.reflow.core.saga;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * LIFO compensation stack of one task plus its ledger of irreversible effects.
 * <p>
 * Each frame is invoked at most once: it is popped before its compensation runs. An unwind
 * halts at the first failed compensation, leaving deeper frames on the stack.
 */
public class SagaManager {

    private static final Logger log = LoggerFactory.getLogger(SagaManager.class);

    private static final ObjectMapper KEY_MAPPER = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();

    private final Deque<SagaFrame> stack = new ArrayDeque<>();
    private final Set<String> irreversibleLedger = new HashSet<>();

    /**
     * Invokes one compensation on behalf of {@link #rollback}.
     */
    @FunctionalInterface
    public interface CompensationInvoker {
        CompensationResult compensate(SagaFrame frame);
    }

    public void push(SagaFrame frame) {
        stack.push(frame);
        log.debug("Saga push: step {} {} -> {} (depth {})",
                frame.stepIndex(), frame.forwardTool(), frame.compensatingTool(), stack.size());
    }

    public int depth() {
        return stack.size();
    }

    /** Pending frames, top of stack first. */
    public List<SagaFrame> frames() {
        return List.copyOf(stack);
    }

    /** Commit: the transaction completed, so pending compensations are dropped. */
    public void discard() {
        stack.clear();
    }

    public SagaRollbackResult rollback(CompensationInvoker invoker) {
        List<SagaFrame> compensated = new ArrayList<>();
        while (!stack.isEmpty()) {
            SagaFrame frame = stack.pop();
            CompensationResult result = invoker.compensate(frame);
            if (!result.succeeded()) {
                log.warn("Compensation {} for step {} failed: {}; halting unwind with {} frame(s) pending",
                        frame.compensatingTool(), frame.stepIndex(), result.reason(), stack.size());
                return new SagaRollbackResult(compensated, frame, result.reason(), frames());
            }
            compensated.add(frame);
        }
        return new SagaRollbackResult(compensated, null, null, List.of());
    }

    public void recordIrreversible(int stepIndex, String tool, Map<String, Object> params) {
        irreversibleLedger.add(ledgerKey(stepIndex, tool, params));
    }

    public boolean hasIrreversible(int stepIndex, String tool, Map<String, Object> params) {
        return irreversibleLedger.contains(ledgerKey(stepIndex, tool, params));
    }

    private static String ledgerKey(int stepIndex, String tool, Map<String, Object> params) {
        try {
            return stepIndex + "|" + tool + "|" + KEY_MAPPER.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Parameters of " + tool + " are not serializable", e);
        }
    }
}
