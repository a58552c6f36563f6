package com.rolebind.engine.resolve;

import com.rolebind.engine.model.Binding;
import com.rolebind.engine.model.BindingMode;
import com.rolebind.engine.model.Category;
import com.rolebind.engine.model.RoleMessage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which roles to add and remove for an activation. Pure: no platform
 * access, no store access, no side effects.
 * <p>
 * The plan keeps these properties of the member's resulting role set:
 * <ul>
 * <li>at most one unique-mode role per scope (the message, or the category of
 * a menu);</li>
 * <li>an exclusive-mode role excludes every other role bound in the
 * guild;</li>
 * <li>no more than {@code maxRoles} roles bound by one message.</li>
 * </ul>
 */
public class AssignmentResolver {

    /**
     * Resolve a single trigger activation.
     *
     * @param memberRoles   roles the member holds right now
     * @param guildMessages every role message of the guild; stale ones are
     *                      ignored
     * @param target        the role message the trigger belongs to
     * @param trigger       trigger key within {@code target}
     */
    public Outcome resolve(Set<String> memberRoles, Collection<RoleMessage> guildMessages,
            RoleMessage target, String trigger, ActivationKind kind) {
        Binding binding = trigger != null ? target.effectiveTriggers().get(trigger) : null;
        if (binding == null || binding.orphaned()) {
            return Outcome.rejected(RejectReason.MISSING_BINDING);
        }
        String role = binding.roleId();
        boolean held = memberRoles.contains(role);

        if (kind == ActivationKind.DESELECT) {
            return held ? new Outcome.Applied(Set.of(), Set.of(role)) : Outcome.Applied.empty();
        }

        if (!requiredSatisfied(target, memberRoles)) {
            return Outcome.rejected(RejectReason.MISSING_REQUIRED_ROLE);
        }
        Integer maxRoles = target.settings().maxRoles();
        if (maxRoles != null && !held && countHeld(memberRoles, target.boundRoleIds()) >= maxRoles) {
            return Outcome.rejected(RejectReason.CAP_REACHED);
        }

        Set<String> remove = preRemove(memberRoles, guildMessages, target, binding, !held);
        if (held) {
            remove.add(role);
            return new Outcome.Applied(Set.of(), remove);
        }
        return new Outcome.Applied(Set.of(role), remove);
    }

    /**
     * Resolve a menu submission: the member's roles in the category become
     * exactly {@code desiredRoleIds}, subject to the mode rules. Ids not bound in
     * the category are ignored.
     */
    public Outcome resolveMenu(Set<String> memberRoles, Collection<RoleMessage> guildMessages,
            RoleMessage target, String categoryId, Collection<String> desiredRoleIds) {
        Category category = categoryId != null ? target.categories().get(categoryId) : null;
        if (category == null) {
            return Outcome.rejected(RejectReason.MISSING_BINDING);
        }
        if (!requiredSatisfied(target, memberRoles)) {
            return Outcome.rejected(RejectReason.MISSING_REQUIRED_ROLE);
        }

        Set<String> desired = new LinkedHashSet<>(desiredRoleIds);
        Set<String> working = new LinkedHashSet<>(memberRoles);
        List<Binding> toAdd = new ArrayList<>();
        for (Binding binding : category.bindings()) {
            if (binding.orphaned()) {
                continue;
            }
            boolean held = memberRoles.contains(binding.roleId());
            boolean wanted = desired.contains(binding.roleId());
            if (held && !wanted) {
                working.remove(binding.roleId());
            } else if (!held && wanted) {
                toAdd.add(binding);
            }
        }

        for (Binding binding : addOrder(toAdd)) {
            working.removeAll(preRemove(working, guildMessages, target, binding, true));
            working.add(binding.roleId());
        }

        Set<String> add = new LinkedHashSet<>(working);
        add.removeAll(memberRoles);
        Set<String> remove = new LinkedHashSet<>(memberRoles);
        remove.removeAll(working);

        Integer maxRoles = target.settings().maxRoles();
        if (maxRoles != null && !add.isEmpty() && countHeld(working, target.boundRoleIds()) > maxRoles) {
            return Outcome.rejected(RejectReason.CAP_REACHED);
        }
        return new Outcome.Applied(add, remove);
    }

    // =========================================================================
    // Rules
    // =========================================================================

    private static boolean requiredSatisfied(RoleMessage target, Set<String> memberRoles) {
        Set<String> required = target.settings().requiredRoles();
        if (required.isEmpty()) {
            return true;
        }
        for (String roleId : required) {
            if (memberRoles.contains(roleId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Held roles that must go before (or together with) toggling the binding.
     */
    private static Set<String> preRemove(Set<String> held, Collection<RoleMessage> guildMessages,
            RoleMessage target, Binding binding, boolean adding) {
        String role = binding.roleId();
        Set<String> remove = new LinkedHashSet<>();
        switch (binding.mode()) {
            case UNIQUE -> remove.addAll(target.uniqueScopeOf(role));
            case EXCLUSIVE -> remove.addAll(guildBoundRoles(guildMessages, target));
            case NORMAL -> {
            }
        }
        if (adding && binding.mode() != BindingMode.EXCLUSIVE) {
            remove.addAll(guildExclusiveRoles(guildMessages, target));
        }
        remove.remove(role);
        remove.retainAll(held);
        return remove;
    }

    /** Unique first, then normal, exclusive last; category order within a mode. */
    private static List<Binding> addOrder(List<Binding> bindings) {
        List<Binding> ordered = new ArrayList<>(bindings.size());
        for (BindingMode mode : List.of(BindingMode.UNIQUE, BindingMode.NORMAL, BindingMode.EXCLUSIVE)) {
            for (Binding binding : bindings) {
                if (binding.mode() == mode) {
                    ordered.add(binding);
                }
            }
        }
        return ordered;
    }

    private static Set<String> guildBoundRoles(Collection<RoleMessage> guildMessages, RoleMessage target) {
        Set<String> roles = new LinkedHashSet<>(target.boundRoleIds());
        for (RoleMessage message : guildMessages) {
            if (!message.stale()) {
                roles.addAll(message.boundRoleIds());
            }
        }
        return roles;
    }

    private static Set<String> guildExclusiveRoles(Collection<RoleMessage> guildMessages, RoleMessage target) {
        Set<String> roles = new LinkedHashSet<>(target.exclusiveRoleIds());
        for (RoleMessage message : guildMessages) {
            if (!message.stale()) {
                roles.addAll(message.exclusiveRoleIds());
            }
        }
        return roles;
    }

    private static int countHeld(Set<String> held, Set<String> roles) {
        int count = 0;
        for (String roleId : roles) {
            if (held.contains(roleId)) {
                count++;
            }
        }
        return count;
    }
}
