package com.rolebind.discord;

import com.rolebind.common.config.RoleBindConfig;

/**
 * Discord bot token resolution.
 */
public final class DiscordToken {

    private DiscordToken() {
    }

    public static final String ENV_VAR = "DISCORD_BOT_TOKEN";

    public enum Source {
        ENV, CONFIG, NONE
    }

    public record Resolution(String token, Source source) {

        public boolean present() {
            return source != Source.NONE;
        }
    }

    /**
     * Normalize a Discord bot token: trim, strip leading "Bot " prefix.
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        String trimmed = raw.trim();
        String stripped = trimmed.replaceFirst("(?i)^Bot\\s+", "");
        return stripped.isBlank() ? null : stripped;
    }

    /**
     * Resolve the bot token. Priority: config token, then the
     * {@code DISCORD_BOT_TOKEN} environment variable.
     *
     * @param envToken value of the environment variable; null reads the real
     *                 environment
     */
    public static Resolution resolve(RoleBindConfig.DiscordConfig config, String envToken) {
        String configToken = config != null ? normalize(config.getToken()) : null;
        if (configToken != null)
            return new Resolution(configToken, Source.CONFIG);

        String env = envToken != null ? envToken : System.getenv(ENV_VAR);
        String normalizedEnv = normalize(env);
        if (normalizedEnv != null)
            return new Resolution(normalizedEnv, Source.ENV);

        return new Resolution("", Source.NONE);
    }

    public static Resolution resolve(RoleBindConfig.DiscordConfig config) {
        return resolve(config, null);
    }
}
