package info.isaksson.erland.ciltocsharp.ast;

/** Shapes of a source-level type expression. */
public enum TypeExpressionKind {
    /** Builtin keyword type such as {@code dynamic}. */
    PRIMITIVE,
    /** Unqualified name. */
    SIMPLE,
    /** {@code target.name}: namespace segment chain or nested type. */
    QUALIFIED,
    /** {@code target<typeArguments>}. */
    GENERIC,
    /** {@code target[,,]}. */
    ARRAY,
    /** {@code target*}. */
    POINTER,
    /** Absent type reference. */
    NULL
}
