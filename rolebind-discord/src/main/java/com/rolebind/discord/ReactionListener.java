package com.rolebind.discord;

import com.rolebind.engine.ActivationResult;
import com.rolebind.engine.dispatch.ActivationHandler;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.TriggerStyle;
import com.rolebind.engine.platform.MessagePlatform;
import com.rolebind.engine.resolve.ActivationKind;
import com.rolebind.engine.resolve.Outcome;
import com.rolebind.engine.resolve.RejectReason;
import com.rolebind.engine.store.BindingStore;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.message.react.GenericMessageReactionEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionAddEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionRemoveEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;

import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

/**
 * Turns reactions on reaction-style role messages into activations. Adding a
 * reaction selects, removing it deselects.
 * <p>
 * The member's reactions are kept in line with the outcome: a rejected
 * reaction is withdrawn and the reason sent by direct message, and the
 * reactions of roles the activation removed are withdrawn as well.
 */
@Slf4j
public class ReactionListener extends ListenerAdapter {

    private final BindingStore store;
    private final ActivationHandler activations;
    private final MessagePlatform messages;
    private final BiConsumer<String, String> directMessages;
    private final Executor worker;

    /**
     * @param directMessages user id and text of a direct message to send
     */
    public ReactionListener(BindingStore store, ActivationHandler activations, MessagePlatform messages,
            BiConsumer<String, String> directMessages, Executor worker) {
        this.store = store;
        this.activations = activations;
        this.messages = messages;
        this.directMessages = directMessages;
        this.worker = worker;
    }

    @Override
    public void onMessageReactionAdd(MessageReactionAddEvent event) {
        handle(event, ActivationKind.SELECT);
    }

    @Override
    public void onMessageReactionRemove(MessageReactionRemoveEvent event) {
        handle(event, ActivationKind.DESELECT);
    }

    private void handle(GenericMessageReactionEvent event, ActivationKind kind) {
        if (!event.isFromGuild() || event.getUserId().equals(event.getJDA().getSelfUser().getId())) {
            return;
        }
        User user = event.getUser();
        if (user != null && user.isBot()) {
            return;
        }
        String guildId = event.getGuild().getId();
        String messageId = event.getMessageId();
        String channelId = event.getChannel().getId();
        String emoji = event.getEmoji().getFormatted();
        String userId = event.getUserId();
        worker.execute(() -> react(guildId, channelId, messageId, emoji, userId, kind));
    }

    /**
     * Activate the trigger and tidy the member's reactions.
     *
     * @return the activation result, or null when the message is not a
     *         reaction role message
     */
    public ActivationResult react(String guildId, String channelId, String messageId, String emoji, String userId,
            ActivationKind kind) {
        RoleMessage message = store.getMessage(guildId, messageId);
        if (message == null || message.style() != TriggerStyle.REACTION || message.stale()) {
            return null;
        }
        try {
            ActivationResult result = activations.activate(guildId, messageId, emoji, userId, kind);
            followUp(guildId, channelId, messageId, emoji, userId, kind, result);
            return result;
        } catch (RuntimeException e) {
            log.error("Reaction {} on {}/{} by {} failed", emoji, guildId, messageId, userId, e);
            return null;
        }
    }

    private void followUp(String guildId, String channelId, String messageId, String emoji, String userId,
            ActivationKind kind, ActivationResult result) {
        if (result.outcome() instanceof Outcome.Rejected rejected) {
            if (kind == ActivationKind.SELECT && rejected.reason() != RejectReason.MISSING_BINDING) {
                withdraw(guildId, channelId, messageId, emoji, userId);
                directMessages.accept(userId, ActivationMessages.render(result));
            }
            return;
        }
        Outcome.Applied applied = (Outcome.Applied) result.outcome();
        RoleMessage message = result.message();
        if (kind == ActivationKind.SELECT && message != null) {
            for (String roleId : applied.remove()) {
                String key = message.triggerKeyOf(roleId);
                if (key != null) {
                    withdraw(guildId, channelId, messageId, key, userId);
                }
            }
        }
        if (result.hasFailures()) {
            directMessages.accept(userId, ActivationMessages.render(result));
        }
    }

    private void withdraw(String guildId, String channelId, String messageId, String emoji, String userId) {
        try {
            messages.removeUserReaction(guildId, channelId, messageId, emoji, userId);
        } catch (RuntimeException e) {
            log.debug("Could not withdraw reaction {} of {} on {}: {}", emoji, userId, messageId, e.getMessage());
        }
    }
}
