package com.rolebind.engine.dispatch;

/**
 * Stable identity of one interactive component: a button, or the select menu
 * of one category.
 *
 * @param key trigger key of a button, or category id of a menu
 */
public record ComponentIdentity(String guildId, String messageId, Kind kind, String key) {

    public enum Kind {
        BUTTON("b"),
        MENU("m");

        private final String code;

        Kind(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        static Kind fromCode(String code) {
            for (Kind kind : values()) {
                if (kind.code.equals(code))
                    return kind;
            }
            return null;
        }
    }

    /** The platform custom id. */
    public String value() {
        return ComponentIdentities.format(this);
    }
}
