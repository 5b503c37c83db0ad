package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Source-level type expression.
 *
 * <p>{@link #target} is the qualifier for QUALIFIED, the generic base for GENERIC and the element
 * type for ARRAY and POINTER. Leaves (PRIMITIVE, SIMPLE, NULL) have no target.</p>
 *
 * <p>Instances are immutable and never shared or cached between decoder calls.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"kind","name","target","typeArguments","rank"})
public final class TypeExpression {
    public final TypeExpressionKind kind;

    /** PRIMITIVE/SIMPLE: the name. QUALIFIED: the member name. */
    public final String name;

    public final TypeExpression target;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<TypeExpression> typeArguments;

    /** ARRAY only. */
    public final Integer rank;

    private TypeExpression(TypeExpressionKind kind, String name, TypeExpression target, List<TypeExpression> typeArguments, Integer rank) {
        this.kind = kind;
        this.name = name;
        this.target = target;
        this.typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
        this.rank = rank;
    }

    public static TypeExpression primitive(String keyword) {
        return new TypeExpression(TypeExpressionKind.PRIMITIVE, Objects.requireNonNull(keyword, "keyword"), null, null, null);
    }

    public static TypeExpression simple(String name) {
        return new TypeExpression(TypeExpressionKind.SIMPLE, Objects.requireNonNull(name, "name"), null, null, null);
    }

    public static TypeExpression qualified(TypeExpression target, String memberName) {
        Objects.requireNonNull(target, "target");
        return new TypeExpression(TypeExpressionKind.QUALIFIED, Objects.requireNonNull(memberName, "memberName"), target, null, null);
    }

    public static TypeExpression generic(TypeExpression base, List<TypeExpression> typeArguments) {
        Objects.requireNonNull(base, "base");
        return new TypeExpression(TypeExpressionKind.GENERIC, null, base, typeArguments, null);
    }

    public static TypeExpression array(TypeExpression element, int rank) {
        Objects.requireNonNull(element, "element");
        if (rank < 1) throw new IllegalArgumentException("array rank must be >= 1: " + rank);
        return new TypeExpression(TypeExpressionKind.ARRAY, null, element, null, rank);
    }

    public static TypeExpression pointer(TypeExpression element) {
        Objects.requireNonNull(element, "element");
        return new TypeExpression(TypeExpressionKind.POINTER, null, element, null, null);
    }

    public static TypeExpression nullType() {
        return new TypeExpression(TypeExpressionKind.NULL, null, null, null, null);
    }

    /** Builds {@code a.b.c} as a QUALIFIED chain rooted at {@code SIMPLE(a)}. */
    public static TypeExpression dotted(String dottedName) {
        String[] parts = dottedName.split("\\.");
        TypeExpression t = simple(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            t = qualified(t, parts[i]);
        }
        return t;
    }

    @JsonIgnore
    public boolean isNull() {
        return kind == TypeExpressionKind.NULL;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeExpression)) return false;
        TypeExpression that = (TypeExpression) o;
        return kind == that.kind &&
                Objects.equals(name, that.name) &&
                Objects.equals(target, that.target) &&
                Objects.equals(typeArguments, that.typeArguments) &&
                Objects.equals(rank, that.rank);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, name, target, typeArguments, rank);
    }

    /** Structural form, e.g. {@code Array(Pointer(Simple(T)),2)}; use {@link TypeExpressionPrinter} for C#. */
    @Override public String toString() {
        switch (kind) {
            case PRIMITIVE: return "Primitive(" + name + ")";
            case SIMPLE: return "Simple(" + name + ")";
            case QUALIFIED: return "Qualified(" + target + "," + name + ")";
            case GENERIC: return "Generic(" + target + "," + typeArguments + ")";
            case ARRAY: return "Array(" + target + "," + rank + ")";
            case POINTER: return "Pointer(" + target + ")";
            default: return "Null";
        }
    }
}
