package com.reflow.core.model;

/**
 * Descriptor of a fault that actually fired on a call. Carried on the {@link StepResult} and
 * in the trace as ground truth; recovery strategies must not read it.
 *
 * @param faultId     schedule entry id
 * @param kind        fault kind
 * @param layer       reported layer (ground truth or override)
 * @param probability scheduled probability
 * @param mode        scheduled mode
 * @param scenario    scenario label, may be null
 */
public record InjectedFault(
        String faultId,
        FaultKind kind,
        FaultLayer layer,
        double probability,
        FaultMode mode,
        String scenario
) {

    public static InjectedFault of(FaultSpec spec) {
        return new InjectedFault(spec.faultId(), spec.kind(), spec.effectiveLayer(),
                spec.probability(), spec.mode(), spec.scenario());
    }
}
