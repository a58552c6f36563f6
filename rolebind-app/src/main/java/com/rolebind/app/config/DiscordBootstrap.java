package com.rolebind.app.config;

import com.rolebind.app.discord.ReactionCommandSchema;
import com.rolebind.app.discord.SlashCommandListener;
import com.rolebind.discord.JdaInteractionRouter;
import com.rolebind.discord.ReactionListener;
import com.rolebind.engine.RoleAssignmentEngine;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Startup and shutdown sequence of the bot.
 * <p>
 * Component routes are registered from the store before any listener is
 * attached, so the first interaction after a restart already finds its
 * handler.
 */
@Slf4j
@Component
public class DiscordBootstrap {

    private final JDA jda;
    private final RoleAssignmentEngine engine;
    private final JdaInteractionRouter router;
    private final ReactionListener reactionListener;
    private final SlashCommandListener slashCommandListener;

    public DiscordBootstrap(JDA jda, RoleAssignmentEngine engine, JdaInteractionRouter router,
            ReactionListener reactionListener, SlashCommandListener slashCommandListener) {
        this.jda = jda;
        this.engine = engine;
        this.router = router;
        this.reactionListener = reactionListener;
        this.slashCommandListener = slashCommandListener;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        // 1. Routes for every stored button and menu
        int registered = engine.getRegistrar().registerAll();

        // 2. Listeners
        jda.addEventListener(router, reactionListener, slashCommandListener);

        // 3. Slash command schema
        try {
            jda.awaitReady();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for Discord; slash commands not updated");
            return;
        }
        jda.updateCommands().addCommands(ReactionCommandSchema.build()).queue(
                commands -> log.info("Registered {} slash command(s)", commands.size()),
                err -> log.warn("Failed to register slash commands: {}", err.getMessage()));
        log.info("RoleBind ready in {} guild(s), {} component routes", jda.getGuilds().size(), registered);
    }

    @PreDestroy
    public void shutdown() {
        log.info("RoleBind shut down");
    }
}
