package com.rolebind.engine.dispatch;

import com.rolebind.engine.ActivationResult;
import com.rolebind.engine.resolve.ActivationKind;

import java.util.List;

/**
 * Entry points invoked by registered component handlers.
 */
public interface ActivationHandler {

    ActivationResult activate(String guildId, String messageId, String triggerKey, String memberId,
            ActivationKind kind);

    ActivationResult selectMenu(String guildId, String messageId, String categoryId, String memberId,
            List<String> desiredRoleIds);
}
