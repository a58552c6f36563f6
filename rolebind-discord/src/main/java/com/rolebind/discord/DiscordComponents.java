package com.rolebind.discord;

import com.rolebind.engine.dispatch.ComponentIdentity;
import com.rolebind.engine.model.Binding;
import com.rolebind.engine.model.Category;
import com.rolebind.engine.model.MessageContent;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.TriggerStyle;
import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.interactions.components.ActionRow;
import net.dv8tion.jda.api.interactions.components.ItemComponent;
import net.dv8tion.jda.api.interactions.components.buttons.Button;
import net.dv8tion.jda.api.interactions.components.selections.SelectOption;
import net.dv8tion.jda.api.interactions.components.selections.StringSelectMenu;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds the embeds and components of role messages. Pure: nothing here talks
 * to Discord.
 */
public final class DiscordComponents {

    private DiscordComponents() {
    }

    /** Embed colour when none is configured. */
    public static final int DEFAULT_COLOR = 0x3498DB;
    static final String MENU_FOOTER = "Use the dropdown menus below to select roles";

    // =========================================================================
    // Embeds
    // =========================================================================

    public static MessageEmbed embed(MessageContent content) {
        EmbedBuilder builder = new EmbedBuilder().setColor(parseColor(content != null ? content.color() : null));
        if (content != null) {
            builder.setTitle(truncate(content.title(), MessageEmbed.TITLE_MAX_LENGTH));
            builder.setDescription(truncate(content.description(), MessageEmbed.DESCRIPTION_MAX_LENGTH));
        }
        if (builder.isEmpty()) {
            builder.setTitle("Role Selection");
        }
        return builder.build();
    }

    /**
     * Menu embed: the message text plus one field per category listing its
     * roles.
     */
    public static MessageEmbed menuEmbed(RoleMessage message) {
        EmbedBuilder builder = new EmbedBuilder(embed(message.content()));
        for (Category category : message.categories().values()) {
            List<String> lines = new ArrayList<>();
            if (category.description() != null) {
                lines.add(category.description());
            }
            for (Binding binding : category.bindings()) {
                if (binding.orphaned()) {
                    continue;
                }
                StringBuilder line = new StringBuilder();
                if (binding.emoji() != null) {
                    line.append(binding.emoji()).append(' ');
                }
                line.append(ActivationMessages.mention(binding.roleId()));
                if (binding.description() != null) {
                    line.append(" - ").append(binding.description());
                }
                lines.add(line.toString());
            }
            if (lines.isEmpty()) {
                continue;
            }
            String name = category.emoji() != null ? category.emoji() + " " + category.name() : category.name();
            builder.addField(truncate(name, MessageEmbed.TITLE_MAX_LENGTH),
                    truncate(String.join("\n", lines), MessageEmbed.VALUE_MAX_LENGTH), false);
        }
        builder.setFooter(MENU_FOOTER);
        return builder.build();
    }

    static int parseColor(String color) {
        if (color == null || color.isBlank())
            return DEFAULT_COLOR;
        String hex = color.trim().startsWith("#") ? color.trim().substring(1) : color.trim();
        try {
            return hex.length() == 6 ? Integer.parseInt(hex, 16) : DEFAULT_COLOR;
        } catch (NumberFormatException e) {
            return DEFAULT_COLOR;
        }
    }

    // =========================================================================
    // Components
    // =========================================================================

    /**
     * Action rows for a button or menu message; empty for reaction messages.
     *
     * @param roleNames role id to display name, for menu option labels
     */
    public static List<ActionRow> rows(String guildId, RoleMessage message, Function<String, String> roleNames) {
        if (message.style() == TriggerStyle.BUTTON) {
            List<ItemComponent> buttons = new ArrayList<>();
            for (Map.Entry<String, Binding> entry : message.triggers().entrySet()) {
                buttons.add(button(guildId, message.id(), entry.getKey(), entry.getValue()));
            }
            return buttons.isEmpty() ? List.of() : ActionRow.partitionOf(buttons);
        }
        if (message.style() == TriggerStyle.MENU) {
            List<ActionRow> rows = new ArrayList<>();
            for (Map.Entry<String, Category> entry : message.categories().entrySet()) {
                StringSelectMenu menu = selectMenu(guildId, message.id(), entry.getKey(), entry.getValue(),
                        roleNames);
                if (menu != null) {
                    rows.add(ActionRow.of(menu));
                }
            }
            return rows;
        }
        return List.of();
    }

    static Button button(String guildId, String messageId, String key, Binding binding) {
        String id = new ComponentIdentity(guildId, messageId, ComponentIdentity.Kind.BUTTON, key).value();
        boolean keyIsEmoji = DiscordEmoji.isEmoji(key);
        String label = binding.label() != null ? binding.label() : (keyIsEmoji ? null : key);
        String emoji = keyIsEmoji ? key : binding.emoji();
        Button button = label != null
                ? Button.secondary(id, truncate(label, Button.LABEL_MAX_LENGTH))
                : Button.secondary(id, DiscordEmoji.toEmoji(emoji));
        if (label != null && emoji != null) {
            button = button.withEmoji(DiscordEmoji.toEmoji(emoji));
        }
        return binding.orphaned() ? button.asDisabled() : button;
    }

    /**
     * Select menu of one category, or null when the category has no live
     * roles. Single-select when the category holds a unique role.
     */
    static StringSelectMenu selectMenu(String guildId, String messageId, String categoryId, Category category,
            Function<String, String> roleNames) {
        List<SelectOption> options = new ArrayList<>();
        for (Binding binding : category.bindings()) {
            if (binding.orphaned()) {
                continue;
            }
            String name = binding.label() != null ? binding.label() : roleNames.apply(binding.roleId());
            SelectOption option = SelectOption.of(truncate(name, SelectOption.LABEL_MAX_LENGTH), binding.roleId());
            if (binding.description() != null) {
                option = option.withDescription(truncate(binding.description(), SelectOption.DESCRIPTION_MAX_LENGTH));
            }
            if (binding.emoji() != null) {
                option = option.withEmoji(DiscordEmoji.toEmoji(binding.emoji()));
            }
            options.add(option);
        }
        if (options.isEmpty()) {
            return null;
        }
        String placeholder = "Select " + category.name() + " roles";
        if (category.emoji() != null) {
            placeholder = category.emoji() + " " + placeholder;
        }
        String id = new ComponentIdentity(guildId, messageId, ComponentIdentity.Kind.MENU, categoryId).value();
        return StringSelectMenu.create(id)
                .setPlaceholder(truncate(placeholder, StringSelectMenu.PLACEHOLDER_MAX_LENGTH))
                .setMinValues(0)
                .setMaxValues(category.hasUnique() ? 1 : options.size())
                .addOptions(options)
                .build();
    }

    static String truncate(String text, int max) {
        if (text == null || text.length() <= max)
            return text;
        return text.substring(0, max - 3) + "...";
    }
}
