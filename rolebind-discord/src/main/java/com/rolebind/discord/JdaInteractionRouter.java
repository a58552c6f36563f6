package com.rolebind.discord;

import com.rolebind.engine.ActivationResult;
import com.rolebind.engine.dispatch.ComponentIdentities;
import com.rolebind.engine.dispatch.ComponentIdentity;
import com.rolebind.engine.dispatch.InteractionHandler;
import com.rolebind.engine.dispatch.InteractionRouter;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.events.interaction.component.ButtonInteractionEvent;
import net.dv8tion.jda.api.events.interaction.component.GenericComponentInteractionCreateEvent;
import net.dv8tion.jda.api.events.interaction.component.StringSelectInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Routes button and select menu interactions carrying one of our component
 * ids to the registered handler. Interactions are acknowledged immediately
 * and handled on the worker executor; the result is sent back as an
 * ephemeral follow-up.
 */
@Slf4j
public class JdaInteractionRouter extends ListenerAdapter implements InteractionRouter {

    private final Map<String, InteractionHandler> handlers = new ConcurrentHashMap<>();
    private final Executor worker;

    public JdaInteractionRouter(Executor worker) {
        this.worker = worker;
    }

    @Override
    public void register(String componentId, InteractionHandler handler) {
        handlers.put(componentId, handler);
    }

    @Override
    public void unregister(String componentId) {
        handlers.remove(componentId);
    }

    @Override
    public Set<String> registeredIds() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * Run the handler registered for the id.
     *
     * @return the handler's result, or null when nothing is registered
     */
    public ActivationResult dispatch(String componentId, String memberId, List<String> values) {
        InteractionHandler handler = handlers.get(componentId);
        if (handler == null) {
            return null;
        }
        return handler.handle(memberId, values);
    }

    /**
     * Reply text for an interaction with the id.
     */
    public String reply(String componentId, String memberId, List<String> values) {
        try {
            ActivationResult result = dispatch(componentId, memberId, values);
            return result != null ? ActivationMessages.render(result) : ActivationMessages.INACTIVE;
        } catch (RuntimeException e) {
            log.error("Interaction {} of {} failed", componentId, memberId, e);
            return ActivationMessages.INTERNAL_ERROR;
        }
    }

    // =========================================================================
    // JDA events
    // =========================================================================

    @Override
    public void onButtonInteraction(ButtonInteractionEvent event) {
        handle(event, List.of());
    }

    @Override
    public void onStringSelectInteraction(StringSelectInteractionEvent event) {
        handle(event, event.getValues());
    }

    private void handle(GenericComponentInteractionCreateEvent event, List<String> values) {
        String componentId = event.getComponentId();
        ComponentIdentity identity = ComponentIdentities.parse(componentId);
        if (identity == null) {
            // not ours
            return;
        }
        if (event.getGuild() == null || !event.getGuild().getId().equals(identity.guildId())) {
            event.reply(ActivationMessages.INACTIVE).setEphemeral(true).queue();
            return;
        }
        String memberId = event.getUser().getId();
        List<String> selected = List.copyOf(values);
        event.deferReply(true).queue();
        worker.execute(() -> {
            String text = reply(componentId, memberId, selected);
            event.getHook().sendMessage(text).setEphemeral(true).queue(null,
                    err -> log.warn("Failed to answer interaction {}: {}", componentId, err.getMessage()));
        });
    }
}
