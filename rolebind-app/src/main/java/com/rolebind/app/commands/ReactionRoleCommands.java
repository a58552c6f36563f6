package com.rolebind.app.commands;

import com.rolebind.engine.RoleAssignmentEngine;
import com.rolebind.engine.model.Binding;
import com.rolebind.engine.model.Category;
import com.rolebind.engine.model.MessageContent;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.Settings;
import com.rolebind.engine.model.TriggerStyle;
import com.rolebind.engine.reconcile.MessageReport;
import com.rolebind.engine.reconcile.OrphanedBinding;
import com.rolebind.engine.reconcile.RebuildReport;
import com.rolebind.engine.reconcile.ReconcileReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.rolebind.app.commands.CommandUtils.channelMention;
import static com.rolebind.app.commands.CommandUtils.plural;
import static com.rolebind.app.commands.CommandUtils.roleMention;

/**
 * The {@code /reaction} subcommands. Each handler parses its options, makes
 * one call into the engine and formats the reply.
 */
@Slf4j
@Component
public class ReactionRoleCommands {

    private final RoleAssignmentEngine engine;

    public ReactionRoleCommands(RoleAssignmentEngine engine) {
        this.engine = engine;
    }

    // =========================================================================
    // Creating and adopting messages
    // =========================================================================

    public CommandResult handleCreate(CommandOptions options, CommandContext ctx) {
        TriggerStyle style = CommandUtils.parseStyle(options.optional("style"), TriggerStyle.REACTION);
        if (style == TriggerStyle.MENU) {
            return handleCreateMenu(options, ctx);
        }
        RoleMessage message = engine.createRoleMessage(ctx.guildId(), channel(options, ctx), style,
                content(options));
        return CommandResult.text("✅ Created " + style.key() + " role message `" + message.id() + "` in "
                + channelMention(message.channelId()) + ". Add roles with `/reaction add`.");
    }

    public CommandResult handleCreateMenu(CommandOptions options, CommandContext ctx) {
        RoleMessage message = engine.createRoleMessage(ctx.guildId(), channel(options, ctx), TriggerStyle.MENU,
                content(options));
        return CommandResult.text("✅ Created role menu `" + message.id() + "` in "
                + channelMention(message.channelId())
                + ". Add categories with `/reaction add_category`, then roles with `/reaction add_menu_role`.");
    }

    public CommandResult handleAdopt(CommandOptions options, CommandContext ctx) {
        TriggerStyle style = CommandUtils.parseStyle(options.optional("style"), TriggerStyle.REACTION);
        RoleMessage message = engine.registerExistingMessage(ctx.guildId(), channel(options, ctx),
                options.required("message_id"), style);
        return CommandResult.text("✅ Message `" + message.id() + "` in " + channelMention(message.channelId())
                + " is now a " + message.style().key() + " role message.");
    }

    public CommandResult handleEdit(CommandOptions options, CommandContext ctx) {
        String messageId = options.required("message_id");
        RoleMessage message = engine.editContent(ctx.guildId(), messageId, options.optional("title"),
                options.optional("description"), CommandUtils.parseColor(options.optional("color")));
        return CommandResult.text("✅ Updated the embed of `" + message.id() + "`.");
    }

    public CommandResult handleDelete(CommandOptions options, CommandContext ctx) {
        String messageId = options.required("message_id");
        engine.deleteRoleMessage(ctx.guildId(), messageId);
        return CommandResult.text("✅ Stopped tracking role message `" + messageId + "`.");
    }

    // =========================================================================
    // Reaction and button triggers
    // =========================================================================

    public CommandResult handleAdd(CommandOptions options, CommandContext ctx) {
        String messageId = options.required("message_id");
        RoleMessage current = find(ctx.guildId(), messageId);
        TriggerStyle style = current != null ? current.style() : TriggerStyle.REACTION;
        String trigger = CommandUtils.parseTrigger(options.required("trigger"), style);
        Binding binding = new Binding(options.required("role"), CommandUtils.parseMode(options.optional("mode")),
                options.optional("label"), CommandUtils.parseEmoji(options.optional("emoji")), null, false);
        engine.addBinding(ctx.guildId(), messageId, trigger, binding);
        return CommandResult.text("✅ " + trigger + " now gives " + roleMention(binding.roleId()) + " ("
                + binding.mode().key() + ").");
    }

    public CommandResult handleRemove(CommandOptions options, CommandContext ctx) {
        String messageId = options.required("message_id");
        RoleMessage current = find(ctx.guildId(), messageId);
        TriggerStyle style = current != null ? current.style() : TriggerStyle.BUTTON;
        String trigger = CommandUtils.parseTrigger(options.required("trigger"), style);
        engine.removeBinding(ctx.guildId(), messageId, trigger);
        return CommandResult.text("✅ Removed " + trigger + " from message `" + messageId + "`.");
    }

    // =========================================================================
    // Menu categories
    // =========================================================================

    public CommandResult handleAddCategory(CommandOptions options, CommandContext ctx) {
        String name = options.required("name");
        engine.addCategory(ctx.guildId(), options.required("message_id"), name,
                CommandUtils.parseEmoji(options.optional("emoji")), options.optional("description"));
        return CommandResult.text("✅ Added category **" + name + "**. Add roles with `/reaction add_menu_role`.");
    }

    public CommandResult handleRemoveCategory(CommandOptions options, CommandContext ctx) {
        String name = options.required("name");
        engine.removeCategory(ctx.guildId(), options.required("message_id"), name);
        return CommandResult.text("✅ Removed category **" + name + "**.");
    }

    public CommandResult handleAddMenuRole(CommandOptions options, CommandContext ctx) {
        String category = options.required("category");
        Binding binding = new Binding(options.required("role"), CommandUtils.parseMode(options.optional("mode")),
                options.optional("label"), CommandUtils.parseEmoji(options.optional("emoji")),
                options.optional("description"), false);
        engine.addMenuBinding(ctx.guildId(), options.required("message_id"), category, binding);
        return CommandResult.text("✅ Added " + roleMention(binding.roleId()) + " (" + binding.mode().key()
                + ") to **" + category + "**.");
    }

    public CommandResult handleRemoveMenuRole(CommandOptions options, CommandContext ctx) {
        String roleId = options.required("role");
        engine.removeMenuBinding(ctx.guildId(), options.required("message_id"), roleId);
        return CommandResult.text("✅ Removed " + roleMention(roleId) + " from the menu.");
    }

    // =========================================================================
    // Settings
    // =========================================================================

    public CommandResult handleSettings(CommandOptions options, CommandContext ctx) {
        String messageId = options.required("message_id");
        Integer maxRoles = options.integer("max_roles");
        String requiredRole = options.optional("required_role");
        boolean clearRequired = options.flag("clear_required");
        boolean clearMax = options.flag("clear_max_roles");

        RoleMessage updated = engine.updateSettings(ctx.guildId(), messageId, maxRoles, requiredRole,
                clearRequired);
        if (clearMax) {
            updated = engine.clearMaxRoles(ctx.guildId(), messageId);
        }
        return CommandResult.text("✅ Settings of `" + messageId + "`: " + describe(updated.settings()) + ".");
    }

    // =========================================================================
    // Listing and export
    // =========================================================================

    public CommandResult handleList(CommandOptions options, CommandContext ctx) {
        List<RoleMessage> messages = engine.list(ctx.guildId());
        if (messages.isEmpty()) {
            return CommandResult.text("No role messages are set up in this server.");
        }
        StringBuilder sb = new StringBuilder();
        sb.append("**Role messages** (").append(messages.size()).append(")\n");
        for (RoleMessage message : messages) {
            sb.append("\n`").append(message.id()).append("` ").append(message.style().key())
                    .append(" in ").append(channelMention(message.channelId()));
            if (message.stale()) {
                sb.append(" [message missing]");
            }
            sb.append("\n");
            if (!Settings.DEFAULT.equals(message.settings())) {
                sb.append("  ").append(describe(message.settings())).append("\n");
            }
            if (message.style() == TriggerStyle.MENU) {
                for (Category category : message.categories().values()) {
                    sb.append("  **").append(category.name()).append("**\n");
                    for (Binding binding : category.bindings()) {
                        sb.append("    ").append(describe(binding.emoji(), binding)).append("\n");
                    }
                }
            } else {
                for (Map.Entry<String, Binding> entry : message.triggers().entrySet()) {
                    sb.append("  ").append(describe(entry.getKey(), entry.getValue())).append("\n");
                }
            }
        }
        return CommandResult.text(sb.toString().trim());
    }

    public CommandResult handleExport(CommandOptions options, CommandContext ctx) {
        String json = engine.export(ctx.guildId());
        int count = engine.list(ctx.guildId()).size();
        return CommandResult.withAttachment("📦 Exported " + plural(count, "role message") + ".",
                "reaction_roles_export_" + ctx.guildId() + ".json", json);
    }

    public CommandResult handleClone(CommandOptions options, CommandContext ctx) {
        RoleMessage copy = engine.clone(ctx.guildId(), options.required("message_id"), channel(options, ctx));
        return CommandResult.text("✅ Cloned to " + channelMention(copy.channelId()) + " as `" + copy.id() + "`.");
    }

    // =========================================================================
    // Reconciliation
    // =========================================================================

    public CommandResult handleVerify(CommandOptions options, CommandContext ctx) {
        ReconcileReport report = engine.verify(ctx.guildId());
        StringBuilder sb = new StringBuilder();
        if (report.issueCount() == 0) {
            sb.append("✅ Checked ").append(plural(report.messages().size(), "role message"))
                    .append(": no issues found.");
        } else {
            sb.append("⚠️ Checked ").append(plural(report.messages().size(), "role message")).append(": ")
                    .append(plural(report.issueCount(), "issue")).append(". Run `/reaction cleanup` to fix them.");
        }
        appendFindings(sb, report);
        return CommandResult.text(sb.toString());
    }

    public CommandResult handleCleanup(CommandOptions options, CommandContext ctx) {
        ReconcileReport report = engine.cleanup(ctx.guildId());
        StringBuilder sb = new StringBuilder();
        if (report.issueCount() == 0) {
            sb.append("✅ Nothing to clean up.");
        } else {
            sb.append("🧹 Cleaned up: ")
                    .append(plural(report.missingMessages(), "missing message")).append(" marked stale, ")
                    .append(plural(report.orphanedBindings(), "binding")).append(" of deleted roles removed");
            if (report.emptyCategories() > 0) {
                sb.append(", ").append(plural(report.emptyCategories(), "empty category")).append(" noted");
            }
            sb.append(".");
        }
        appendFindings(sb, report);
        return CommandResult.text(sb.toString());
    }

    public CommandResult handleRebuild(CommandOptions options, CommandContext ctx) {
        RebuildReport report = engine.rebuild(ctx.guildId());
        StringBuilder sb = new StringBuilder();
        sb.append("🔧 Rebuilt ").append(plural(report.rebuilt().size(), "role message")).append(".");
        if (!report.missing().isEmpty()) {
            sb.append("\nMissing: ");
            report.missing().forEach(id -> sb.append('`').append(id).append("` "));
            sb.append("\nRun `/reaction cleanup` to mark them stale.");
        }
        for (Map.Entry<String, String> failure : report.failed().entrySet()) {
            sb.append("\n❌ `").append(failure.getKey()).append("`: ").append(failure.getValue());
        }
        return CommandResult.text(sb.toString());
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void appendFindings(StringBuilder sb, ReconcileReport report) {
        for (MessageReport message : report.messages()) {
            if (message.clean()) {
                continue;
            }
            List<String> lines = new ArrayList<>();
            if (message.missing()) {
                lines.add("message no longer exists");
            }
            if (message.lookupError() != null) {
                lines.add("could not be checked: " + message.lookupError());
            }
            for (OrphanedBinding orphan : message.orphanedBindings()) {
                lines.add("role " + orphan.roleId() + " was deleted ("
                        + (orphan.categoryId() != null ? "category " + orphan.categoryId() : orphan.triggerKey())
                        + ")");
            }
            for (String category : message.emptyCategories()) {
                lines.add("category " + category + " has no roles");
            }
            for (String roleId : message.unmanageableRoles()) {
                lines.add(roleMention(roleId) + " is above my highest role or managed by an integration");
            }
            sb.append("\n`").append(message.messageId()).append("` in ").append(channelMention(message.channelId()));
            for (String line : lines) {
                sb.append("\n  - ").append(line);
            }
        }
        if (!report.staleMessageIds().isEmpty()) {
            sb.append("\nAlready marked missing: ").append(plural(report.staleMessageIds().size(), "message"));
        }
    }

    private RoleMessage find(String guildId, String messageId) {
        for (RoleMessage message : engine.list(guildId)) {
            if (message.id().equals(messageId)) {
                return message;
            }
        }
        return null;
    }

    private static String channel(CommandOptions options, CommandContext ctx) {
        String channel = options.optional("channel");
        return channel != null ? channel : ctx.channelId();
    }

    private static MessageContent content(CommandOptions options) {
        return new MessageContent(options.optional("title"), options.optional("description"),
                CommandUtils.parseColor(options.optional("color")));
    }

    private static String describe(Settings settings) {
        List<String> parts = new ArrayList<>();
        parts.add(settings.maxRoles() != null ? "max " + plural(settings.maxRoles(), "role") : "no role limit");
        if (settings.requiredRoles().isEmpty()) {
            parts.add("no required role");
        } else {
            List<String> mentions = settings.requiredRoles().stream().map(CommandUtils::roleMention).toList();
            parts.add("requires " + String.join(" or ", mentions));
        }
        return String.join(", ", parts);
    }

    private static String describe(String trigger, Binding binding) {
        StringBuilder sb = new StringBuilder();
        if (trigger != null) {
            sb.append(trigger).append(" → ");
        }
        sb.append(roleMention(binding.roleId())).append(" (").append(binding.mode().key()).append(")");
        if (binding.label() != null && !binding.label().equals(trigger)) {
            sb.append(" \"").append(binding.label()).append("\"");
        }
        if (binding.orphaned()) {
            sb.append(" [role deleted]");
        }
        return sb.toString();
    }
}
