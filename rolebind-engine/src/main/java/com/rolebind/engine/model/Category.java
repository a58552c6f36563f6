package com.rolebind.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A named sub-scope of bindings within a menu-style role message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Category(
        String name,
        String emoji,
        String description,
        List<Binding> bindings) {

    public Category {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("category name is required");
        }
        bindings = Collections.unmodifiableList(new ArrayList<>(bindings != null ? bindings : List.of()));
    }

    /**
     * Category identifier derived from its display name.
     */
    public static String slug(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }

    /** Whether any binding of this category uses the unique mode. */
    public boolean hasUnique() {
        return bindings.stream().anyMatch(b -> b.mode() == BindingMode.UNIQUE);
    }

    public Category withBindings(List<Binding> newBindings) {
        return new Category(name, emoji, description, newBindings);
    }
}
