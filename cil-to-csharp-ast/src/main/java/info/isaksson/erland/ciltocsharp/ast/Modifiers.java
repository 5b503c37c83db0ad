package info.isaksson.erland.ciltocsharp.ast;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Helpers for immutable modifier sets. */
public final class Modifiers {

    private Modifiers() {}

    public static Set<Modifier> none() {
        return Collections.unmodifiableSet(EnumSet.noneOf(Modifier.class));
    }

    public static Set<Modifier> of(Modifier first, Modifier... rest) {
        return Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    public static Set<Modifier> copyOf(Collection<Modifier> modifiers) {
        if (modifiers == null || modifiers.isEmpty()) return none();
        return Collections.unmodifiableSet(EnumSet.copyOf(modifiers));
    }
}
