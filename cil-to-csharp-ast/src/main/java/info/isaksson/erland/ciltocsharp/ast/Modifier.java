package info.isaksson.erland.ciltocsharp.ast;

import java.util.Locale;

/**
 * Language-neutral declaration modifiers.
 *
 * <p>Declaration order is the order keywords are printed in.</p>
 */
public enum Modifier {
    PUBLIC,
    PROTECTED,
    INTERNAL,
    PRIVATE,
    CONST,
    STATIC,
    ABSTRACT,
    VIRTUAL;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
