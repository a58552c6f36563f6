package com.rolebind.discord;

import com.rolebind.common.infra.ErrorUtils;
import com.rolebind.engine.PlatformException;
import com.rolebind.engine.platform.MutationStatus;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.PermissionException;

/**
 * Maps JDA failures to platform statuses.
 */
public final class DiscordErrors {

    private DiscordErrors() {
    }

    public static MutationStatus statusOf(Throwable err) {
        if (ErrorUtils.findCause(err, PermissionException.class) != null)
            return MutationStatus.FORBIDDEN;
        ErrorResponseException response = ErrorUtils.findCause(err, ErrorResponseException.class);
        if (response == null)
            return MutationStatus.FAILED;
        return switch (response.getErrorResponse()) {
            case UNKNOWN_ROLE, UNKNOWN_MEMBER, UNKNOWN_USER, UNKNOWN_MESSAGE, UNKNOWN_CHANNEL, UNKNOWN_GUILD ->
                MutationStatus.NOT_FOUND;
            case MISSING_PERMISSIONS, MISSING_ACCESS -> MutationStatus.FORBIDDEN;
            default -> MutationStatus.FAILED;
        };
    }

    /** Whether the failure means the referenced entity does not exist. */
    public static boolean isNotFound(Throwable err) {
        return statusOf(err) == MutationStatus.NOT_FOUND;
    }

    public static PlatformException translate(String action, Throwable err) {
        return new PlatformException(action + ": " + ErrorUtils.formatErrorMessage(err), statusOf(err), err);
    }
}
