package com.rolebind.app.commands;

import com.rolebind.engine.ConfigurationException;
import com.rolebind.engine.PersistenceException;
import com.rolebind.engine.PlatformException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Dispatcher of the {@code /reaction} subcommands. Checks the sender's
 * capability, then routes to the handler and turns engine errors into reply
 * text.
 */
@Slf4j
@Component
public class CommandProcessor {

    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();

    public CommandProcessor(ReactionRoleCommands commands) {
        // Messages
        handlers.put("create", commands::handleCreate);
        handlers.put("create_menu", commands::handleCreateMenu);
        handlers.put("adopt", commands::handleAdopt);
        handlers.put("edit", commands::handleEdit);
        handlers.put("delete", commands::handleDelete);
        handlers.put("clone", commands::handleClone);

        // Triggers
        handlers.put("add", commands::handleAdd);
        handlers.put("remove", commands::handleRemove);

        // Menus
        handlers.put("add_category", commands::handleAddCategory);
        handlers.put("remove_category", commands::handleRemoveCategory);
        handlers.put("add_menu_role", commands::handleAddMenuRole);
        handlers.put("remove_menu_role", commands::handleRemoveMenuRole);

        // Settings and inspection
        handlers.put("settings", commands::handleSettings);
        handlers.put("list", commands::handleList);
        handlers.put("export", commands::handleExport);

        // Reconciliation
        handlers.put("verify", commands::handleVerify);
        handlers.put("cleanup", commands::handleCleanup);
        handlers.put("rebuild", commands::handleRebuild);
    }

    public Set<String> subcommands() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * Handle a subcommand.
     *
     * @return the reply, or null if the subcommand is unknown
     */
    public CommandResult handleCommand(String subcommand, CommandOptions options, CommandContext ctx) {
        if (subcommand == null || subcommand.isBlank()) {
            return null;
        }
        String name = subcommand.trim().toLowerCase();
        CommandHandler handler = handlers.get(name);
        if (handler == null) {
            log.debug("Unknown subcommand: /reaction {}", name);
            return null;
        }
        if (ctx.guildId() == null) {
            return CommandResult.text("❌ This command only works in a server.");
        }
        if (!CommandAuthorization.isAuthorized(name, ctx)) {
            return CommandResult.text("❌ You need the "
                    + (CommandAuthorization.requiredFor(name) == Capability.ADMINISTRATOR
                            ? "Administrator"
                            : "Manage Roles")
                    + " permission to use this command.");
        }

        try {
            return handler.handle(options != null ? options : new CommandOptions(Map.of()), ctx);
        } catch (ConfigurationException e) {
            log.debug("/reaction {} rejected: {}", name, e.getMessage());
            return CommandResult.text("❌ " + e.getMessage());
        } catch (PlatformException e) {
            log.warn("/reaction {} failed on Discord ({}): {}", name, e.getStatus(), e.getMessage());
            return CommandResult.text("❌ Discord refused the request: " + e.getMessage());
        } catch (PersistenceException e) {
            log.warn("/reaction {} could not be saved: {}", name, e.getMessage());
            return CommandResult.text("❌ The change could not be saved: " + e.getMessage());
        } catch (Exception e) {
            log.error("/reaction {} failed: {}", name, e.getMessage(), e);
            return CommandResult.text("❌ Command failed: " + e.getMessage());
        }
    }
}
