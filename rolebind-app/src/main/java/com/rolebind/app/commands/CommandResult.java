package com.rolebind.app.commands;

/**
 * Result of a command handler execution.
 * Can carry one text attachment (the export file).
 */
public record CommandResult(
        String text,
        String attachmentName,
        String attachment) {

    /** Create a plain text result with no attachment. */
    public static CommandResult text(String text) {
        return new CommandResult(text, null, null);
    }

    /** Create a result with text and a file attachment. */
    public static CommandResult withAttachment(String text, String name, String content) {
        return new CommandResult(text, name, content);
    }

    /** Whether this result has an attachment. */
    public boolean hasAttachment() {
        return attachmentName != null && attachment != null;
    }
}
