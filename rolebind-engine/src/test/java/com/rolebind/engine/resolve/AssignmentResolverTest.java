package com.rolebind.engine.resolve;

import com.rolebind.engine.model.Binding;
import com.rolebind.engine.model.BindingMode;
import com.rolebind.engine.model.Category;
import com.rolebind.engine.model.RoleMessage;
import com.rolebind.engine.model.Settings;
import com.rolebind.engine.model.TriggerStyle;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentResolverTest {

    private final AssignmentResolver resolver = new AssignmentResolver();

    private static RoleMessage reactions(String id, Map<String, Binding> triggers) {
        return new RoleMessage(id, "c1", TriggerStyle.REACTION, Settings.DEFAULT, null, false, triggers, Map.of());
    }

    private static Set<String> apply(Set<String> held, Outcome outcome) {
        Outcome.Applied applied = assertInstanceOf(Outcome.Applied.class, outcome);
        assertTrue(applied.add().stream().noneMatch(applied.remove()::contains), "add and remove overlap");
        Set<String> next = new LinkedHashSet<>(held);
        next.removeAll(applied.remove());
        next.addAll(applied.add());
        return next;
    }

    private Set<String> select(Set<String> held, List<RoleMessage> guild, RoleMessage target, String trigger) {
        return apply(held, resolver.resolve(held, guild, target, trigger, ActivationKind.SELECT));
    }

    // =========================================================================
    // Normal mode
    // =========================================================================

    @Nested
    class Normal {

        private final RoleMessage m = reactions("m", Map.of(
                "🔴", Binding.of("red", BindingMode.NORMAL),
                "🔵", Binding.of("blue", BindingMode.NORMAL)));

        @Test
        void selectTogglesOnThenOff() {
            Set<String> held = select(Set.of(), List.of(m), m, "🔴");
            assertEquals(Set.of("red"), held);
            held = select(held, List.of(m), m, "🔴");
            assertEquals(Set.of(), held);
        }

        @Test
        void normalRolesAccumulate() {
            Set<String> held = select(Set.of(), List.of(m), m, "🔴");
            held = select(held, List.of(m), m, "🔵");
            assertEquals(Set.of("red", "blue"), held);
        }

        @Test
        void twoSelectsRestoreTheOriginalSet() {
            Set<String> start = Set.of("blue", "unrelated");
            Set<String> held = select(select(start, List.of(m), m, "🔴"), List.of(m), m, "🔴");
            assertEquals(start, held);
        }

        @Test
        void deselectRemovesOnlyWhenHeld() {
            var outcome = resolver.resolve(Set.of("red"), List.of(m), m, "🔴", ActivationKind.DESELECT);
            assertEquals(new Outcome.Applied(Set.of(), Set.of("red")), outcome);

            outcome = resolver.resolve(Set.of(), List.of(m), m, "🔴", ActivationKind.DESELECT);
            assertTrue(((Outcome.Applied) outcome).noop());
        }

        @Test
        void unknownTriggerIsRejected() {
            var outcome = resolver.resolve(Set.of(), List.of(m), m, "🟢", ActivationKind.SELECT);
            assertEquals(new Outcome.Rejected(RejectReason.MISSING_BINDING), outcome);
        }

        @Test
        void orphanedBindingIsRejected() {
            RoleMessage orphaned = reactions("m", Map.of("🔴", Binding.of("red", BindingMode.NORMAL).withOrphaned(true)));
            var outcome = resolver.resolve(Set.of(), List.of(orphaned), orphaned, "🔴", ActivationKind.SELECT);
            assertEquals(new Outcome.Rejected(RejectReason.MISSING_BINDING), outcome);
            outcome = resolver.resolve(Set.of("red"), List.of(orphaned), orphaned, "🔴", ActivationKind.DESELECT);
            assertEquals(new Outcome.Rejected(RejectReason.MISSING_BINDING), outcome);
        }
    }

    // =========================================================================
    // Unique mode
    // =========================================================================

    @Nested
    class Unique {

        private final RoleMessage medals = reactions("m", Map.of(
                "🥇", Binding.of("gold", BindingMode.UNIQUE),
                "🥈", Binding.of("silver", BindingMode.UNIQUE),
                "🥉", Binding.of("bronze", BindingMode.UNIQUE)));

        @Test
        void swapHappensInOneOutcome() {
            Set<String> held = select(Set.of(), List.of(medals), medals, "🥇");
            assertEquals(Set.of("gold"), held);

            var outcome = resolver.resolve(held, List.of(medals), medals, "🥈", ActivationKind.SELECT);
            assertEquals(new Outcome.Applied(Set.of("silver"), Set.of("gold")), outcome);
        }

        @Test
        void atMostOneUniqueRoleAfterAnySequence() {
            Set<String> held = Set.of("gold", "bronze");
            for (String trigger : List.of("🥈", "🥉", "🥇", "🥇", "🥈")) {
                held = select(held, List.of(medals), medals, trigger);
                long count = held.stream().filter(Set.of("gold", "silver", "bronze")::contains).count();
                assertTrue(count <= 1, "held " + held);
            }
        }

        @Test
        void menuUniqueScopeIsTheCategory() {
            RoleMessage menu = new RoleMessage("menu", "c1", TriggerStyle.MENU, Settings.DEFAULT, null, false,
                    Map.of(), Map.of(
                            "colors", new Category("Colors", null, null, List.of(
                                    Binding.of("red", BindingMode.UNIQUE), Binding.of("blue", BindingMode.UNIQUE))),
                            "games", new Category("Games", null, null, List.of(
                                    Binding.of("chess", BindingMode.NORMAL)))));

            Set<String> held = select(Set.of("chess", "blue"), List.of(menu), menu, "red");
            assertEquals(Set.of("chess", "red"), held);
        }
    }

    // =========================================================================
    // Exclusive mode
    // =========================================================================

    @Nested
    class Exclusive {

        private final RoleMessage factions = reactions("m1", Map.of(
                "🅰️", Binding.of("factionA", BindingMode.EXCLUSIVE),
                "🅱️", Binding.of("factionB", BindingMode.EXCLUSIVE)));
        private final RoleMessage news = reactions("m2", Map.of(
                "📰", Binding.of("subscriber", BindingMode.NORMAL)));
        private final List<RoleMessage> guild = List.of(factions, news);

        @Test
        void exclusiveRemovesRolesOfOtherMessages() {
            Set<String> held = select(Set.of("subscriber", "unbound"), guild, factions, "🅰️");
            assertEquals(Set.of("unbound", "factionA"), held);
        }

        @Test
        void addingANormalRoleDropsHeldExclusiveRole() {
            Set<String> held = select(Set.of("factionA"), guild, news, "📰");
            assertEquals(Set.of("subscriber"), held);
        }

        @Test
        void staleMessagesAreOutsideTheExclusiveScope() {
            RoleMessage staleNews = news.withStale(true);
            Set<String> held = select(Set.of("subscriber"), List.of(factions, staleNews), factions, "🅰️");
            assertEquals(Set.of("subscriber", "factionA"), held);
        }

        @Test
        void holdingExclusiveExcludesEveryOtherBoundRole() {
            Set<String> held = Set.of();
            for (var step : List.of(Map.entry(news, "📰"), Map.entry(factions, "🅱️"), Map.entry(news, "📰"),
                    Map.entry(factions, "🅰️"))) {
                held = select(held, guild, step.getKey(), step.getValue());
                if (held.contains("factionA") || held.contains("factionB")) {
                    assertEquals(1, held.size(), "held " + held);
                }
            }
            assertEquals(Set.of("factionA"), held);
        }
    }

    // =========================================================================
    // Gates
    // =========================================================================

    @Nested
    class Gates {

        private final RoleMessage capped = reactions("m", Map.of(
                "1️⃣", Binding.of("r1", BindingMode.NORMAL),
                "2️⃣", Binding.of("r2", BindingMode.NORMAL),
                "3️⃣", Binding.of("r3", BindingMode.NORMAL)))
                .withSettings(Settings.DEFAULT.withMaxRoles(1));

        @Test
        void capRejectsSecondRole() {
            var outcome = resolver.resolve(Set.of("r1"), List.of(capped), capped, "2️⃣", ActivationKind.SELECT);
            assertEquals(new Outcome.Rejected(RejectReason.CAP_REACHED), outcome);
        }

        @Test
        void capStillAllowsTogglingOffAHeldRole() {
            Set<String> held = select(Set.of("r1"), List.of(capped), capped, "1️⃣");
            assertEquals(Set.of(), held);
        }

        @Test
        void requiredRoleGatesSelection() {
            RoleMessage gated = capped.withSettings(new Settings(Set.of("verified", "member"), null));
            var outcome = resolver.resolve(Set.of(), List.of(gated), gated, "1️⃣", ActivationKind.SELECT);
            assertEquals(new Outcome.Rejected(RejectReason.MISSING_REQUIRED_ROLE), outcome);

            assertEquals(Set.of("member", "r1"), select(Set.of("member"), List.of(gated), gated, "1️⃣"));
        }

        @Test
        void deselectIgnoresGates() {
            RoleMessage gated = capped.withSettings(new Settings(Set.of("verified"), 1));
            var outcome = resolver.resolve(Set.of("r1"), List.of(gated), gated, "1️⃣", ActivationKind.DESELECT);
            assertEquals(new Outcome.Applied(Set.of(), Set.of("r1")), outcome);
        }
    }

    // =========================================================================
    // Menu selection
    // =========================================================================

    @Nested
    class Menu {

        private final RoleMessage menu = new RoleMessage("menu", "c1", TriggerStyle.MENU, Settings.DEFAULT, null,
                false, Map.of(), Map.of(
                        "games", new Category("Games", null, null, List.of(
                                Binding.of("chess", BindingMode.NORMAL),
                                Binding.of("go", BindingMode.NORMAL),
                                Binding.of("poker", BindingMode.NORMAL))),
                        "teams", new Category("Teams", null, null, List.of(
                                Binding.of("red", BindingMode.UNIQUE),
                                Binding.of("blue", BindingMode.UNIQUE))),
                        "alignment", new Category("Alignment", null, null, List.of(
                                Binding.of("loner", BindingMode.EXCLUSIVE)))));

        @Test
        void selectionBecomesTheCategoryState() {
            var outcome = resolver.resolveMenu(Set.of("chess", "other"), List.of(menu), menu, "games",
                    List.of("go", "poker"));
            assertEquals(new Outcome.Applied(Set.of("go", "poker"), Set.of("chess")), outcome);
        }

        @Test
        void unknownIdsAreIgnored() {
            var outcome = resolver.resolveMenu(Set.of(), List.of(menu), menu, "games", List.of("chess", "red", "x"));
            assertEquals(new Outcome.Applied(Set.of("chess"), Set.of()), outcome);
        }

        @Test
        void uniqueKeepsOneRolePerCategory() {
            var outcome = resolver.resolveMenu(Set.of("blue"), List.of(menu), menu, "teams", List.of("red", "blue"));
            Set<String> held = apply(Set.of("blue"), outcome);
            assertEquals(1, held.stream().filter(Set.of("red", "blue")::contains).count());
        }

        @Test
        void exclusiveOptionClearsOtherBoundRoles() {
            Set<String> held = apply(Set.of("chess", "red"),
                    resolver.resolveMenu(Set.of("chess", "red"), List.of(menu), menu, "alignment", List.of("loner")));
            assertEquals(Set.of("loner"), held);
        }

        @Test
        void unknownCategoryIsRejected() {
            var outcome = resolver.resolveMenu(Set.of(), List.of(menu), menu, "nope", List.of("chess"));
            assertEquals(new Outcome.Rejected(RejectReason.MISSING_BINDING), outcome);
        }

        @Test
        void capCountsTheResultingState() {
            RoleMessage capped = menu.withSettings(Settings.DEFAULT.withMaxRoles(2));
            var outcome = resolver.resolveMenu(Set.of("red"), List.of(capped), capped, "games",
                    List.of("chess", "go"));
            assertEquals(new Outcome.Rejected(RejectReason.CAP_REACHED), outcome);

            outcome = resolver.resolveMenu(Set.of("red"), List.of(capped), capped, "games", List.of("chess"));
            assertEquals(new Outcome.Applied(Set.of("chess"), Set.of()), outcome);
        }
    }
}
