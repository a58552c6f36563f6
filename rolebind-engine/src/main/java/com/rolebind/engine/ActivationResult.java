package com.rolebind.engine;

import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.resolve.Outcome;

import java.util.List;

/**
 * What happened for one activation.
 *
 * @param outcome  the resolver's decision
 * @param failures platform calls that failed; successful calls are never
 *                 rolled back
 * @param message  the role message the activation was resolved against, null
 *                 when it is unknown
 */
public record ActivationResult(Outcome outcome, List<MutationFailure> failures, RoleMessage message) {

    public ActivationResult {
        failures = List.copyOf(failures);
    }

    public static ActivationResult rejected(Outcome.Rejected outcome, RoleMessage message) {
        return new ActivationResult(outcome, List.of(), message);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
