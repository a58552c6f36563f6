package com.rolebind.app.discord;

import com.rolebind.app.commands.Capability;
import com.rolebind.app.commands.CommandContext;
import com.rolebind.app.commands.CommandOptions;
import com.rolebind.app.commands.CommandProcessor;
import com.rolebind.app.commands.CommandResult;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import net.dv8tion.jda.api.utils.FileUpload;
import net.dv8tion.jda.api.utils.messages.MessageCreateBuilder;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Bridges {@code /reaction} slash command interactions to the
 * {@link CommandProcessor}. Replies are ephemeral and sent from the worker
 * executor after deferring.
 */
@Slf4j
public class SlashCommandListener extends ListenerAdapter {

    private final CommandProcessor processor;
    private final Executor worker;

    public SlashCommandListener(CommandProcessor processor, Executor worker) {
        this.processor = processor;
        this.worker = worker;
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        if (!ReactionCommandSchema.COMMAND_NAME.equals(event.getName())) {
            return;
        }
        if (event.getGuild() == null) {
            event.reply("This command only works in a server.").setEphemeral(true).queue();
            return;
        }
        String subcommand = event.getSubcommandName();
        CommandOptions options = optionsOf(event.getOptions());
        CommandContext ctx = new CommandContext(event.getGuild().getId(), event.getChannel().getId(),
                event.getUser().getId(), capabilitiesOf(event.getMember()));

        event.deferReply(true).queue();
        worker.execute(() -> {
            CommandResult result = processor.handleCommand(subcommand, options, ctx);
            if (result == null) {
                result = CommandResult.text("Unknown subcommand.");
            }
            MessageCreateBuilder reply = new MessageCreateBuilder().setContent(fit(result.text()));
            if (result.hasAttachment()) {
                reply.addFiles(FileUpload.fromData(result.attachment().getBytes(StandardCharsets.UTF_8),
                        result.attachmentName()));
            }
            event.getHook().sendMessage(reply.build()).setEphemeral(true).queue(null,
                    err -> log.warn("Failed to answer /reaction {}: {}", subcommand, err.getMessage()));
        });
    }

    static CommandOptions optionsOf(Collection<OptionMapping> mappings) {
        Map<String, String> values = new LinkedHashMap<>();
        for (OptionMapping mapping : mappings) {
            values.put(mapping.getName(), mapping.getAsString());
        }
        return new CommandOptions(values);
    }

    static Set<Capability> capabilitiesOf(Member member) {
        return member != null ? capabilitiesOf(member.getPermissions()) : Set.of();
    }

    static Set<Capability> capabilitiesOf(Collection<Permission> permissions) {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (permissions.contains(Permission.ADMINISTRATOR)) {
            capabilities.add(Capability.ADMINISTRATOR);
            capabilities.add(Capability.MANAGE_ROLES);
        }
        if (permissions.contains(Permission.MANAGE_ROLES)) {
            capabilities.add(Capability.MANAGE_ROLES);
        }
        return capabilities;
    }

    /** Clip to Discord's message length. */
    static String fit(String text) {
        if (text == null || text.isEmpty())
            return "Done.";
        if (text.length() <= Message.MAX_CONTENT_LENGTH)
            return text;
        return text.substring(0, Message.MAX_CONTENT_LENGTH - 4) + "\n...";
    }
}
