package com.rolebind.engine.dispatch;

import com.rolebind.engine.ActivationResult;

import java.util.List;

/**
 * Callback bound to one component identity.
 */
@FunctionalInterface
public interface InteractionHandler {

    /**
     * @param memberId member who used the component
     * @param values   selected option values of a select menu; empty for
     *                 buttons
     */
    ActivationResult handle(String memberId, List<String> values);
}
