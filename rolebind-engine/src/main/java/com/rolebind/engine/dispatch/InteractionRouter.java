package com.rolebind.engine.dispatch;

import java.util.Set;

/**
 * Routing table from component identity to handler, owned by the platform
 * adapter.
 */
public interface InteractionRouter {

    /** Bind or replace the handler of an identity. */
    void register(String componentId, InteractionHandler handler);

    /** No-op when the identity is not registered. */
    void unregister(String componentId);

    Set<String> registeredIds();
}
