package com.reflow.core.oracle;

import com.reflow.core.model.SuccessCondition;
import com.reflow.core.world.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Evaluates a task's success predicate against its final world state.
 */
@Component
public class SuccessOracle {

    private static final Logger log = LoggerFactory.getLogger(SuccessOracle.class);

    public boolean evaluate(SuccessCondition condition, WorldState world) {
        if (condition == null) {
            return true;
        }
        if (!SuccessCondition.RECORD_STATUS.equals(condition.type())) {
            log.warn("Unsupported success condition type '{}'; treating as unmet", condition.type());
            return false;
        }
        return world.record(condition.recordId())
                .map(record -> Objects.equals(String.valueOf(record.get("status")), condition.expectedStatus()))
                .orElse(false);
    }
}
