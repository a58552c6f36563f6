package com.rolebind.app.config;

import com.rolebind.app.commands.CommandProcessor;
import com.rolebind.app.discord.SlashCommandListener;
import com.rolebind.common.config.ConfigService;
import com.rolebind.common.config.RoleBindConfig;
import com.rolebind.common.infra.FlushLoop;
import com.rolebind.discord.DiscordToken;
import com.rolebind.discord.JdaInteractionRouter;
import com.rolebind.discord.JdaPlatform;
import com.rolebind.discord.ReactionListener;
import com.rolebind.engine.RoleAssignmentEngine;
import com.rolebind.engine.store.JsonFileBindingStore;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the engine and its Discord adapters.
 */
@Slf4j
@Configuration
public class EngineBeanConfig {

    @Value("${rolebind.config.path:}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        Path path = configPath == null || configPath.isBlank()
                ? ConfigService.resolveDefaultPath(System.getenv())
                : ConfigService.expandHome(configPath);
        return new ConfigService(path);
    }

    @Bean
    public RoleBindConfig roleBindConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public JsonFileBindingStore bindingStore(RoleBindConfig config) {
        Path path = ConfigService.expandHome(config.getStorage().getPath());
        JsonFileBindingStore store = new JsonFileBindingStore(path);
        log.info("Binding store loaded from {} ({} role messages)", path, store.size());
        return store;
    }

    /**
     * Retries failed writes and saves once more on shutdown; a clean store
     * makes each flush a no-op.
     */
    @Bean(initMethod = "start", destroyMethod = "close")
    public FlushLoop bindingStoreFlush(JsonFileBindingStore store, RoleBindConfig config) {
        return new FlushLoop("binding-store-flush", config.getStorage().getFlushIntervalMs(), store::flush);
    }

    /** Runs activations and commands off the JDA event threads. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService roleWorker(RoleBindConfig config) {
        int threads = Math.max(1, config.getDiscord().getWorkerThreads());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "role-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * The Discord connection. Listeners are attached by {@link DiscordBootstrap}
     * once the component routes are registered.
     */
    @Bean(destroyMethod = "shutdown")
    public JDA jda(RoleBindConfig config) {
        DiscordToken.Resolution token = DiscordToken.resolve(config.getDiscord());
        if (!token.present()) {
            throw new IllegalStateException("No Discord bot token: set discord.token in "
                    + "the config file or the " + DiscordToken.ENV_VAR + " environment variable");
        }
        log.info("Connecting to Discord (token from {})", token.source());
        return JDABuilder.createDefault(token.token())
                .enableIntents(GatewayIntent.GUILD_MESSAGE_REACTIONS)
                .build();
    }

    @Bean
    public JdaPlatform jdaPlatform(JDA jda) {
        return new JdaPlatform(jda);
    }

    @Bean
    public JdaInteractionRouter interactionRouter(ExecutorService roleWorker) {
        return new JdaInteractionRouter(roleWorker);
    }

    @Bean
    public RoleAssignmentEngine roleAssignmentEngine(JsonFileBindingStore store, JdaPlatform platform,
            JdaInteractionRouter router) {
        return new RoleAssignmentEngine(store, platform, platform, router);
    }

    @Bean
    public ReactionListener reactionListener(JsonFileBindingStore store, RoleAssignmentEngine engine,
            JdaPlatform platform, ExecutorService roleWorker) {
        return new ReactionListener(store, engine, platform, platform::sendDirectMessage, roleWorker);
    }

    @Bean
    public SlashCommandListener slashCommandListener(CommandProcessor processor, ExecutorService roleWorker) {
        return new SlashCommandListener(processor, roleWorker);
    }
}
