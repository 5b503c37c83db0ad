package info.isaksson.erland.ciltocsharp.builder;

import info.isaksson.erland.ciltocsharp.ast.Modifier;
import info.isaksson.erland.ciltocsharp.ast.Modifiers;
import info.isaksson.erland.ciltocsharp.metadata.CompiledField;
import info.isaksson.erland.ciltocsharp.metadata.CompiledMethod;
import info.isaksson.erland.ciltocsharp.metadata.CompiledType;
import info.isaksson.erland.ciltocsharp.metadata.MemberAccess;

import java.util.EnumSet;
import java.util.Set;

/**
 * Maps metadata access and attribute flags to declaration modifiers.
 *
 * <p>Properties and events have no flags of their own; callers pass the accessor method.</p>
 *
 * <p>Family-and-assembly access has no single C# keyword in this model and is approximated as
 * {@code protected}.</p>
 */
public final class ModifierCalculator {

    private ModifierCalculator() {}

    public static Set<Modifier> modifiers(CompiledType typeDef) {
        EnumSet<Modifier> m = EnumSet.noneOf(Modifier.class);
        switch (typeDef.visibility) {
            case NESTED_PRIVATE:
                m.add(Modifier.PRIVATE);
                break;
            case NESTED_FAMILY_AND_ASSEMBLY:
            case NESTED_FAMILY:
                m.add(Modifier.PROTECTED);
                break;
            case NESTED_ASSEMBLY:
                m.add(Modifier.INTERNAL);
                break;
            case NESTED_FAMILY_OR_ASSEMBLY:
                m.add(Modifier.PROTECTED);
                m.add(Modifier.INTERNAL);
                break;
            case PUBLIC:
            case NESTED_PUBLIC:
                m.add(Modifier.PUBLIC);
                break;
            case NOT_PUBLIC:
                break;
        }
        if (typeDef.isAbstract) m.add(Modifier.ABSTRACT);
        return Modifiers.copyOf(m);
    }

    public static Set<Modifier> modifiers(CompiledField fieldDef) {
        EnumSet<Modifier> m = EnumSet.noneOf(Modifier.class);
        addAccess(m, fieldDef.access);
        if (fieldDef.isLiteral) m.add(Modifier.CONST);
        if (fieldDef.isStatic) m.add(Modifier.STATIC);
        return Modifiers.copyOf(m);
    }

    /** A null method (e.g. an event without add accessor) has no modifiers. */
    public static Set<Modifier> modifiers(CompiledMethod methodDef) {
        if (methodDef == null) return Modifiers.none();
        EnumSet<Modifier> m = EnumSet.noneOf(Modifier.class);
        addAccess(m, methodDef.access);
        if (methodDef.isStatic) m.add(Modifier.STATIC);
        if (methodDef.isVirtual) m.add(Modifier.VIRTUAL);
        if (methodDef.isAbstract) m.add(Modifier.ABSTRACT);
        return Modifiers.copyOf(m);
    }

    private static void addAccess(EnumSet<Modifier> m, MemberAccess access) {
        switch (access) {
            case PRIVATE:
                m.add(Modifier.PRIVATE);
                break;
            case FAMILY_AND_ASSEMBLY:
            case FAMILY:
                m.add(Modifier.PROTECTED);
                break;
            case ASSEMBLY:
                m.add(Modifier.INTERNAL);
                break;
            case FAMILY_OR_ASSEMBLY:
                m.add(Modifier.PROTECTED);
                m.add(Modifier.INTERNAL);
                break;
            case PUBLIC:
                m.add(Modifier.PUBLIC);
                break;
            case COMPILER_CONTROLLED:
                break;
        }
    }
}
