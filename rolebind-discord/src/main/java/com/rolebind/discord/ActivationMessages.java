package com.rolebind.discord;

import com.rolebind.engine.ActivationResult;
import com.rolebind.engine.MutationFailure;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.resolve.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * User-facing text for activation results, sent as ephemeral replies to
 * button and menu users and as direct messages for rejected reactions.
 */
public final class ActivationMessages {

    private ActivationMessages() {
    }

    public static final String UNAVAILABLE = "This role option is no longer available.";
    public static final String NO_CHANGES = "No changes to your roles.";
    public static final String FETCH_FAILED = "I couldn't look up your roles right now. Please try again.";
    public static final String INACTIVE = "This role menu is no longer active.";
    public static final String INTERNAL_ERROR = "Something went wrong while updating your roles.";

    public static String mention(String roleId) {
        return "<@&" + roleId + ">";
    }

    public static String render(ActivationResult result) {
        if (result.outcome() instanceof Outcome.Rejected rejected) {
            return rejection(rejected, result.message());
        }
        Outcome.Applied applied = (Outcome.Applied) result.outcome();
        List<String> lines = new ArrayList<>();
        for (MutationFailure failure : result.failures()) {
            lines.add(failureText(failure));
        }
        List<String> added = applied.add().stream()
                .filter(id -> !failed(result, id))
                .map(ActivationMessages::mention)
                .toList();
        List<String> removed = applied.remove().stream()
                .filter(id -> !failed(result, id))
                .map(ActivationMessages::mention)
                .toList();
        if (!added.isEmpty()) {
            lines.add(0, (added.size() == 1 ? "Added role: " : "Added roles: ") + String.join(", ", added));
        }
        if (!removed.isEmpty()) {
            lines.add(added.isEmpty() ? 0 : 1,
                    (removed.size() == 1 ? "Removed role: " : "Removed roles: ") + String.join(", ", removed));
        }
        return lines.isEmpty() ? NO_CHANGES : String.join("\n", lines);
    }

    static String rejection(Outcome.Rejected rejected, RoleMessage message) {
        return switch (rejected.reason()) {
            case MISSING_BINDING -> UNAVAILABLE;
            case MISSING_REQUIRED_ROLE -> {
                String roles = message != null
                        ? message.settings().requiredRoles().stream().map(ActivationMessages::mention)
                                .collect(Collectors.joining(", "))
                        : "";
                yield roles.isEmpty()
                        ? "You don't have the role needed to use this."
                        : "You need one of these roles to use this: " + roles;
            }
            case CAP_REACHED -> {
                Integer max = message != null ? message.settings().maxRoles() : null;
                yield max != null
                        ? "You can only have " + max + (max == 1 ? " role" : " roles") + " from this message."
                        : "You already have the maximum number of roles from this message.";
            }
        };
    }

    static String failureText(MutationFailure failure) {
        if (failure.operation() == MutationFailure.Operation.FETCH_MEMBER) {
            return FETCH_FAILED;
        }
        return switch (failure.status()) {
            case FORBIDDEN -> "I don't have permission to manage " + mention(failure.roleId()) + ".";
            case NOT_FOUND -> "The role " + mention(failure.roleId()) + " no longer exists.";
            default -> "Could not " + (failure.operation() == MutationFailure.Operation.ADD ? "add " : "remove ")
                    + mention(failure.roleId()) + ". Please try again.";
        };
    }

    private static boolean failed(ActivationResult result, String roleId) {
        return result.failures().stream().anyMatch(f -> roleId.equals(f.roleId()));
    }
}
