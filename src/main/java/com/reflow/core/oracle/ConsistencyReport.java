package com.reflow.core.oracle;

import java.util.List;

public record ConsistencyReport(boolean consistent, List<String> violations) {

    public ConsistencyReport {
        violations = List.copyOf(violations);
    }

    public static ConsistencyReport of(List<String> violations) {
        return new ConsistencyReport(violations.isEmpty(), violations);
    }
}
